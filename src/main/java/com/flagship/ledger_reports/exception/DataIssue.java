package com.flagship.ledger_reports.exception;

import lombok.Value;

/**
 * One detected inconsistency in the imported data.
 *
 * {@code reference} identifies the offending voucher, leg or bill so that the
 * caller can trace it back to the source system.
 */
@Value
public class DataIssue {
    Type type;
    String reference;
    String message;

    public enum Type {
        UNBALANCED_VOUCHER,
        OVER_ALLOCATED_BILL,
        UNPARSEABLE_DATE,
        UNPARSEABLE_AMOUNT
    }
}
