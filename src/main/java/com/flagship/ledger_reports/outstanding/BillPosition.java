package com.flagship.ledger_reports.outstanding;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A bill with every allocation made against it up to the as-on date.
 * {@code outstanding} = original amount - sum of allocations, never negative.
 */
@Value
public class BillPosition {
    Bill bill;
    List<BillAllocation> allocations;
    BigDecimal outstanding;

    public boolean isOpen() {
        return outstanding.signum() > 0;
    }

    public BigDecimal getAllocated() {
        return allocations.stream()
            .map(BillAllocation::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
