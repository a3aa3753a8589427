package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.common.Side;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One open bill as it appears in the outstanding report.
 *
 * {@code outstandingAmount} is unsigned; {@code side} carries the direction.
 * A bill is receivable when it sits on the debit side of a debtor-like ledger
 * and payable when it sits on the credit side of a creditor-like one. A bill
 * against its ledger's natural side is an advance and is neither.
 * {@code balance} is the signed running outstanding of the ledger after this
 * bill, filled in by {@link OutstandingAggregator}.
 */
@Value
public class OutstandingBill {
    String ledgerName;
    String billRef;
    LocalDate billDate;
    String billType;
    String voucherType;
    String voucherNumber;
    BigDecimal originalAmount;
    BigDecimal outstandingAmount;
    Side side;
    boolean receivable;
    boolean payable;
    boolean advance;
    LocalDate dueDate;
    long overdueDays;
    AgeingBucket bucket;
    @With
    BigDecimal balance;

    public BigDecimal getSignedOutstanding() {
        return side == Side.DR ? outstandingAmount : outstandingAmount.negate();
    }
}
