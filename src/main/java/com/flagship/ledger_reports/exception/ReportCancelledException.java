package com.flagship.ledger_reports.exception;

import java.util.Map;

/**
 * The caller withdrew the request while the report was being computed.
 */
public class ReportCancelledException extends ReportException {

    public ReportCancelledException(String phase) {
        super(ErrorKind.CANCELLED, "Report cancelled before phase: " + phase, Map.of("phase", phase));
    }
}
