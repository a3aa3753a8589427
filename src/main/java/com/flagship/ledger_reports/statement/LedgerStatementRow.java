package com.flagship.ledger_reports.statement;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One statement line per voucher. At most one of debit and credit is
 * non-zero; {@code balance} is the signed running balance after this line.
 */
@Value
public class LedgerStatementRow {
    String voucherId;
    LocalDate date;
    String particulars;
    String voucherType;
    String voucherNumber;
    String narration;
    BigDecimal debit;
    BigDecimal credit;
    BigDecimal balance;
}
