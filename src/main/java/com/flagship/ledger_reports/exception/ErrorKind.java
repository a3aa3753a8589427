package com.flagship.ledger_reports.exception;

/**
 * Machine-readable classification of report failures.
 * Carried on every {@link ReportException} and echoed in API error bodies.
 */
public enum ErrorKind {
    NOT_FOUND,
    INVALID_RANGE,
    INCONSISTENT_DATA,
    STORAGE,
    CANCELLED
}
