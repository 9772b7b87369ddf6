package com.okazje.scanner.scan.model;

public enum FailureKind {
    FETCH_ERROR,
    PARSE_ERROR
}
