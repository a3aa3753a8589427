package com.flagship.ledger_reports.exception;

import java.util.Map;

/**
 * Requested period is unusable: {@code from} after {@code to}, or an as-on
 * date earlier than any data held for the company.
 */
public class InvalidRangeException extends ReportException {

    public InvalidRangeException(String message, Map<String, String> context) {
        super(ErrorKind.INVALID_RANGE, message, context);
    }
}
