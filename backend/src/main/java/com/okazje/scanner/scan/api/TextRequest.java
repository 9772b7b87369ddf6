package com.okazje.scanner.scan.api;

public record TextRequest(String text) {
}
