package com.okazje.scanner.scan.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveScanException extends RuntimeException {
    public ActiveScanException(String message) {
        super(message);
    }
}
