package com.okazje.scanner.scan.api;

import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.discovery.DiscoveryService;
import com.okazje.scanner.scan.model.AnalysisResult;
import com.okazje.scanner.scan.model.ExtractionView;
import com.okazje.scanner.scan.model.Listing;
import com.okazje.scanner.scan.model.Platform;
import com.okazje.scanner.scan.platform.ListingExtractionService;
import com.okazje.scanner.scan.service.ListingAnalysisService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api")
public class ListingController {
    private final ListingExtractionService extractionService;
    private final ListingAnalysisService analysisService;
    private final DiscoveryService discoveryService;
    private final ScannerProperties properties;

    public ListingController(
        ListingExtractionService extractionService,
        ListingAnalysisService analysisService,
        DiscoveryService discoveryService,
        ScannerProperties properties
    ) {
        this.extractionService = extractionService;
        this.analysisService = analysisService;
        this.discoveryService = discoveryService;
        this.properties = properties;
    }

    @GetMapping("/listings/extract")
    public ExtractionView extract(@RequestParam("url") String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        return extractionService.describe(url.trim());
    }

    @PostMapping("/listings/analyze")
    public List<AnalysisResult> analyze(@RequestBody TextRequest request) {
        String text = request == null ? null : request.text();
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
        return analysisService.analyzeText(text);
    }

    @PostMapping("/listings/analyze-description")
    public AnalysisResult analyzeDescription(@RequestBody TextRequest request) {
        return analysisService.analyzeDescription(request == null ? null : request.text());
    }

    @GetMapping("/search")
    public List<Listing> search(
        @RequestParam("platform") String platform,
        @RequestParam("keyword") String keyword,
        @RequestParam(name = "maxPrice", required = false) BigDecimal maxPrice
    ) {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("keyword is required");
        }
        BigDecimal ceiling = maxPrice == null ? properties.getScan().getMaxPrice() : maxPrice;
        return discoveryService.search(Platform.fromLabel(platform), keyword.trim(), ceiling);
    }
}
