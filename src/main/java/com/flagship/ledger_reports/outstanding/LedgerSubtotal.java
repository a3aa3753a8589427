package com.flagship.ledger_reports.outstanding;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Party-wise line of the outstanding report.
 */
@Value
public class LedgerSubtotal {
    String ledgerName;
    BigDecimal receivable;
    BigDecimal payable;
    BigDecimal advance;
    BigDecimal netBalance;
    int openBills;
    LocalDate oldestBillDate;
    BigDecimal onAccount;
}
