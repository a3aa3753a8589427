package com.flagship.ledger_reports.common;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Unsigned magnitude plus the side it sits on.
 * The sign never leaks into {@link #amount}.
 */
@Value
public class DrCrAmount {
    BigDecimal amount;
    Side side;

    public static DrCrAmount of(BigDecimal signedAmount, Side whenZero) {
        return new DrCrAmount(signedAmount.abs(), Side.of(signedAmount, whenZero));
    }

    public static DrCrAmount of(BigDecimal signedAmount) {
        return of(signedAmount, Side.DR);
    }

    /**
     * Back to the debit-positive signed form.
     */
    public BigDecimal signed() {
        return side == Side.DR ? amount : amount.negate();
    }
}
