package com.flagship.ledger_reports.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unknown company or ledger.
 */
public class NotFoundException extends ReportException {

    public NotFoundException(String message, Map<String, String> context) {
        super(ErrorKind.NOT_FOUND, message, context);
    }

    public static NotFoundException company(String companyId) {
        return new NotFoundException("Company not found: " + companyId, Map.of("company_id", companyId));
    }

    public static NotFoundException ledger(String companyId, String ledgerName) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("company_id", companyId);
        context.put("ledger_name", ledgerName);
        return new NotFoundException("Ledger not found: " + ledgerName, context);
    }
}
