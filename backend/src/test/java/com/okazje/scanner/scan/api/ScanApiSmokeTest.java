package com.okazje.scanner.scan.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ScanApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void statusReportsConfigurationAndPlatforms() throws Exception {
        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.keywordCount").value(greaterThan(0)))
            .andExpect(jsonPath("$.scanInterval").value("PT30M"))
            .andExpect(jsonPath("$.minMarginPercent").value(200))
            .andExpect(jsonPath("$.monitoredPlatforms").value(hasItems("sprzedajemy.pl", "gratka.pl")))
            .andExpect(jsonPath("$.extractablePlatforms").value(hasItems("olx.pl", "vinted.pl", "allegro.pl")))
            .andExpect(jsonPath("$.scanRunning").value(false));
    }

    @Test
    void scanWithoutDestinationIsSkipped() throws Exception {
        mockMvc.perform(post("/api/scan/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("SKIPPED_NO_DESTINATION"))
            .andExpect(jsonPath("$.acceptedCount").value(0));
    }

    @Test
    void keywordsCanBeAddedAndRemoved() throws Exception {
        mockMvc.perform(get("/api/keywords"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());

        mockMvc.perform(post("/api/keywords")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"keyword\":\"lampa naftowa smoke\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").value(hasItems("lampa naftowa smoke")));

        mockMvc.perform(delete("/api/keywords/{numberOrText}", "lampa naftowa smoke"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.removed").value("lampa naftowa smoke"));

        mockMvc.perform(delete("/api/keywords/{numberOrText}", "nie ma takiego"))
            .andExpect(status().isNotFound());
    }

    @Test
    void shortManualDescriptionIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/listings/analyze-description")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"za krótko\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void manualDescriptionWithoutApiKeyReportsClassifierError() throws Exception {
        mockMvc.perform(post("/api/listings/analyze-description")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"Sprzedam stary zegar ścienny, sprawny, z kluczykiem\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.listing.platform").value("MANUAL"))
            .andExpect(jsonPath("$.listing.verdict").value("SKIP"))
            .andExpect(jsonPath("$.listing.analysis").value(startsWith("❌ Błąd analizy AI")));
    }

    @Test
    void unreachableListingIsFetchError() throws Exception {
        mockMvc.perform(get("/api/listings/extract").param("url", "http://127.0.0.1:1/oferta-nr1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.platform").value("OTHER"))
            .andExpect(jsonPath("$.failure.kind").value("FETCH_ERROR"));
    }

    @Test
    void searchOnPlatformWithoutDiscoveryIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/search").param("platform", "olx.pl").param("keyword", "zegar"))
            .andExpect(status().isBadRequest());
    }
}
