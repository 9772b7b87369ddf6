package com.okazje.scanner.scan.notify;

public class NotificationException extends RuntimeException {
    public NotificationException(String message) {
        super(message);
    }
}
