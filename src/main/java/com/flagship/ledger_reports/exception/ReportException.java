package com.flagship.ledger_reports.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every failure raised while building a report.
 *
 * Each exception carries the {@link ErrorKind} and the identifiers needed to
 * reproduce the failing request (company, ledger, dates).
 */
public abstract class ReportException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, String> context;

    protected ReportException(ErrorKind kind, String message, Map<String, String> context) {
        this(kind, message, context, null);
    }

    protected ReportException(ErrorKind kind, String message, Map<String, String> context, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.context = context == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, String> getContext() {
        return context;
    }
}
