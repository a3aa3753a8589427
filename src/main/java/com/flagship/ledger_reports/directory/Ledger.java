package com.flagship.ledger_reports.directory;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Domain model for a Ledger (account) within one company.
 *
 * {@code openingBalance} is the signed balance at the start of the books,
 * debit positive. {@code creditPeriodDays} may be null.
 */
@Value
public class Ledger {
    String companyGuid;
    String name;
    LedgerNature nature;
    BigDecimal openingBalance;
    Integer creditPeriodDays;

    /**
     * Ledger seen in voucher legs but absent from the ledger master.
     */
    public static Ledger unregistered(String companyGuid, String name) {
        return new Ledger(companyGuid, name.trim(), LedgerNature.UNCLASSIFIED, BigDecimal.ZERO, null);
    }

    public boolean isNamed(String candidate) {
        return sameName(name, candidate);
    }

    /**
     * Ledger names are compared the way the source system keys them: trimmed
     * and case-insensitive.
     */
    public static boolean sameName(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return normalizeName(a).equals(normalizeName(b));
    }

    public static String normalizeName(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }
}
