package com.okazje.scanner.scan.api;

import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.model.ScanSummary;
import com.okazje.scanner.scan.model.StatusResponse;
import com.okazje.scanner.scan.persistence.KeywordRepository;
import com.okazje.scanner.scan.service.ScanOrchestratorService;
import com.okazje.scanner.scan.service.StatusService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.CONFLICT;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class ScanController {
    private final KeywordRepository keywordRepository;
    private final ScanOrchestratorService orchestratorService;
    private final StatusService statusService;
    private final ScannerProperties properties;

    public ScanController(
        KeywordRepository keywordRepository,
        ScanOrchestratorService orchestratorService,
        StatusService statusService,
        ScannerProperties properties
    ) {
        this.keywordRepository = keywordRepository;
        this.orchestratorService = orchestratorService;
        this.statusService = statusService;
        this.properties = properties;
    }

    @GetMapping("/keywords")
    public List<String> keywords() {
        return keywordRepository.list();
    }

    @PostMapping("/keywords")
    public List<String> addKeyword(@RequestBody KeywordRequest request) {
        String keyword = request == null ? null : request.keyword();
        if (!keywordRepository.add(keyword)) {
            throw new ResponseStatusException(CONFLICT, "Keyword already present: " + keyword.trim());
        }
        return keywordRepository.list();
    }

    @DeleteMapping("/keywords/{numberOrText}")
    public Map<String, Object> removeKeyword(@PathVariable("numberOrText") String numberOrText) {
        String removed = keywordRepository.remove(numberOrText)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Keyword not found: " + numberOrText));
        return Map.of("removed", removed, "keywords", keywordRepository.list());
    }

    @PostMapping("/scan/run")
    public ScanSummary runScan(@RequestParam(name = "destination", required = false) String destination) {
        String target = destination == null || destination.isBlank()
            ? properties.getScan().getDestination()
            : destination.trim();
        return orchestratorService.runScan(target);
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return statusService.status();
    }
}
