package com.okazje.scanner.scan.model;

public enum ScanStatus {
    COMPLETED,
    NO_NEW_LISTINGS,
    SKIPPED_NO_DESTINATION,
    INTERRUPTED
}
