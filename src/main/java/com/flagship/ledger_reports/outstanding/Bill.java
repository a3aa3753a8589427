package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.common.Side;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A named reference raised by an originating voucher leg.
 *
 * {@code originalAmount} is unsigned; {@code side} says whether the bill sits
 * on the debit or the credit side of its ledger. {@code sequence} is the
 * chronological position of the originating leg and breaks bill-date ties.
 */
@Value
public class Bill {
    String ledgerName;
    String billRef;
    String billType;
    LocalDate billDate;
    LocalDate dueDate;
    Integer creditPeriodDays;
    String voucherId;
    String voucherType;
    String voucherNumber;
    Side side;
    BigDecimal originalAmount;
    long sequence;
}
