package com.okazje.scanner.scan.api;

import com.okazje.scanner.scan.persistence.PersistenceException;
import com.okazje.scanner.scan.service.ActiveScanException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ScanExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ScanExceptionHandler.class);

    @ExceptionHandler(ActiveScanException.class)
    public ResponseEntity<Map<String, String>> handleActiveScan(ActiveScanException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", "active_scan", "message", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<Map<String, String>> handlePersistence(PersistenceException ex) {
        log.error("Storage write failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of("error", "storage_error", "message", String.valueOf(ex.getMessage())));
    }
}
