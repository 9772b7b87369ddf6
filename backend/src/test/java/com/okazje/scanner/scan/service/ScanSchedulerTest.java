package com.okazje.scanner.scan.service;

import com.okazje.scanner.config.ScannerProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScanSchedulerTest {

    @Mock
    private ScanOrchestratorService orchestratorService;

    @Test
    void skipsWhenNoDestinationConfigured() {
        ScannerProperties properties = new ScannerProperties();

        new ScanScheduler(orchestratorService, properties).scheduledScan();

        verifyNoInteractions(orchestratorService);
    }

    @Test
    void skipsWhenDisabled() {
        ScannerProperties properties = new ScannerProperties();
        properties.getScan().setDestination("chat-1");
        properties.getScan().setEnabled(false);

        new ScanScheduler(orchestratorService, properties).scheduledScan();

        verifyNoInteractions(orchestratorService);
    }

    @Test
    void overlappingRunIsSwallowedByScheduler() {
        ScannerProperties properties = new ScannerProperties();
        properties.getScan().setDestination("chat-1");
        when(orchestratorService.runScan("chat-1")).thenThrow(new ActiveScanException("A scan is already running"));

        new ScanScheduler(orchestratorService, properties).scheduledScan();

        verify(orchestratorService).runScan("chat-1");
    }
}
