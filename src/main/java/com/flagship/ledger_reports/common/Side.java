package com.flagship.ledger_reports.common;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/**
 * Debit or credit side of a balance.
 * Signed amounts follow the debit-positive convention throughout the engine.
 */
public enum Side {
    DR("Dr"),
    CR("Cr");

    private final String label;

    Side(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public Side opposite() {
        return this == DR ? CR : DR;
    }

    /**
     * Side of a signed amount; zero falls back to {@code whenZero}.
     */
    public static Side of(BigDecimal signedAmount, Side whenZero) {
        int sign = signedAmount.signum();
        if (sign == 0) {
            return whenZero;
        }
        return sign > 0 ? DR : CR;
    }
}
