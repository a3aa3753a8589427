package com.flagship.ledger_reports.voucher;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One voucher leg exactly as the import stored it.
 *
 * Dates are raw text and amounts may come as separate debit/credit columns or
 * as a single amount with a Dr/Cr indicator; {@link TransactionLoader}
 * normalizes both.
 */
@Value
@Builder
public class LegRow {
    long id;
    String companyGuid;
    String voucherId;
    Long alterId;
    String voucherDate;
    String voucherType;
    String voucherNumber;
    String ledgerName;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    BigDecimal ledgerAmount;
    String drCr;
    String billRef;
    String billType;
    String billDate;
    String dueDate;
    Integer creditPeriodDays;
    String narration;
}
