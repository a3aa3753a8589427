package com.flagship.ledger_reports.outstanding;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Signed amount of a ledger that is not tied to any bill.
 */
@Value
public class OnAccountBalance {
    String ledgerName;
    BigDecimal amount;
}
