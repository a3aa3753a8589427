package com.flagship.ledger_reports.outstanding;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.ledger_reports.common.Side;

import java.util.Locale;

/**
 * Which side of the outstanding schedule is requested.
 */
public enum ReportType {
    RECEIVABLES("receivables"),
    PAYABLES("payables"),
    BOTH("both");

    private final String value;

    ReportType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Receivables also carry advances received from debtors (credit bills),
     * payables the advances paid to creditors (debit bills).
     */
    public boolean includes(OutstandingBill bill) {
        return switch (this) {
            case RECEIVABLES -> bill.isReceivable() || (bill.isAdvance() && bill.getSide() == Side.CR);
            case PAYABLES -> bill.isPayable() || (bill.isAdvance() && bill.getSide() == Side.DR);
            case BOTH -> true;
        };
    }

    /**
     * @throws IllegalArgumentException for anything but receivables, payables or both
     */
    public static ReportType fromValue(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (ReportType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException(
            "Invalid report type: " + value + " (expected receivables, payables or both)");
    }
}
