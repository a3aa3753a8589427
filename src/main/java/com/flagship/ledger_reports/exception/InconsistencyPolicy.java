package com.flagship.ledger_reports.exception;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * What a report does when the data behind it is inconsistent.
 */
public enum InconsistencyPolicy {

    /**
     * Refuse to produce the report.
     */
    FAIL,

    /**
     * Produce the report and list the issues alongside it.
     */
    REPORT;

    /**
     * @throws InconsistentDataException under {@link #FAIL} when issues exist
     */
    public void enforce(List<DataIssue> issues, Map<String, String> context) {
        if (this == FAIL && !issues.isEmpty()) {
            throw new InconsistentDataException(issues, context);
        }
    }

    public static InconsistencyPolicy fromProperty(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
