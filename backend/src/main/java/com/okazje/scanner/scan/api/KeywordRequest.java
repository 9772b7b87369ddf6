package com.okazje.scanner.scan.api;

public record KeywordRequest(String keyword) {
}
