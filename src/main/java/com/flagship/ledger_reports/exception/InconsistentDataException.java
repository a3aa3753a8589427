package com.flagship.ledger_reports.exception;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Imported data violates an accounting invariant.
 *
 * The offending identifiers travel with the exception so the caller can
 * decide whether a best-effort report is acceptable.
 */
public class InconsistentDataException extends ReportException {

    private final List<DataIssue> issues;

    public InconsistentDataException(List<DataIssue> issues, Map<String, String> context) {
        super(ErrorKind.INCONSISTENT_DATA, describe(issues), context);
        this.issues = List.copyOf(issues);
    }

    public List<DataIssue> getIssues() {
        return issues;
    }

    private static String describe(List<DataIssue> issues) {
        String references = issues.stream()
            .map(DataIssue::getReference)
            .limit(10)
            .collect(Collectors.joining(", "));
        return String.format("Inconsistent data (%d issue(s)): %s%s",
            issues.size(), references, issues.size() > 10 ? ", ..." : "");
    }
}
