package com.flagship.ledger_reports.voucher;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Derives the signed (debit positive) amount of an imported leg.
 */
public final class SourceAmounts {

    private SourceAmounts() {
    }

    /**
     * Separate debit/credit columns win. Otherwise the single amount is signed
     * by its Dr/Cr indicator, or trusted as already signed when there is none.
     *
     * @throws IllegalArgumentException if the row carries no amount at all
     */
    public static BigDecimal signedAmount(LegRow row) {
        if (row.getDebitAmount() != null || row.getCreditAmount() != null) {
            BigDecimal debit = row.getDebitAmount() != null ? row.getDebitAmount() : BigDecimal.ZERO;
            BigDecimal credit = row.getCreditAmount() != null ? row.getCreditAmount() : BigDecimal.ZERO;
            return debit.abs().subtract(credit.abs());
        }
        BigDecimal amount = row.getLedgerAmount();
        if (amount == null) {
            throw new IllegalArgumentException("Leg " + row.getId() + " carries no amount");
        }
        String indicator = row.getDrCr() == null ? "" : row.getDrCr().trim().toUpperCase(Locale.ROOT);
        if (indicator.startsWith("DR")) {
            return amount.abs();
        }
        if (indicator.startsWith("CR")) {
            return amount.abs().negate();
        }
        return amount;
    }
}
