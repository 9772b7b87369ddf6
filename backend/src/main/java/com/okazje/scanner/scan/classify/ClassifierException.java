package com.okazje.scanner.scan.classify;

public class ClassifierException extends RuntimeException {
    public ClassifierException(String message) {
        super(message);
    }

    public ClassifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
