package com.flagship.ledger_reports.outstanding;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A slice of a settling leg applied to one bill.
 *
 * {@code byReference} is true when the settling leg named the bill itself and
 * false when the bill was picked in FIFO order.
 */
@Value
public class BillAllocation {
    String billRef;
    BigDecimal amount;
    LocalDate allocationDate;
    String settlingVoucherId;
    String settlingVoucherNumber;
    BigDecimal remainingAfter;
    boolean byReference;
}
