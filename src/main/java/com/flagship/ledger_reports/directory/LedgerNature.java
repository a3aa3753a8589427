package com.flagship.ledger_reports.directory;

import com.flagship.ledger_reports.common.Side;

import java.util.Locale;

/**
 * Accounting nature of a ledger, used for display sides and for
 * receivable/payable classification.
 */
public enum LedgerNature {
    DEBTOR(Side.DR),
    CREDITOR(Side.CR),
    ASSET(Side.DR),
    LIABILITY(Side.CR),
    INCOME(Side.CR),
    EXPENSE(Side.DR),
    UNCLASSIFIED(Side.DR);

    private final Side naturalSide;

    LedgerNature(Side naturalSide) {
        this.naturalSide = naturalSide;
    }

    /**
     * Side on which this ledger normally carries its balance.
     */
    public Side getNaturalSide() {
        return naturalSide;
    }

    public boolean isDebtorLike() {
        return this == DEBTOR || this == ASSET;
    }

    public boolean isCreditorLike() {
        return this == CREDITOR || this == LIABILITY;
    }

    /**
     * Parties are tracked bill by bill even when no bill reference was imported.
     */
    public boolean isParty() {
        return this == DEBTOR || this == CREDITOR;
    }

    /**
     * Maps the stored nature or primary group name ("Sundry Debtors",
     * "Current Liabilities", "LIABILITY", ...) onto a nature.
     */
    public static LedgerNature fromStorage(String value) {
        if (value == null || value.isBlank()) {
            return UNCLASSIFIED;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.contains("DEBTOR")) {
            return DEBTOR;
        }
        if (normalized.contains("CREDITOR")) {
            return CREDITOR;
        }
        if (normalized.contains("LIABILIT") || normalized.contains("CAPITAL") || normalized.contains("LOAN")) {
            return LIABILITY;
        }
        if (normalized.contains("ASSET") || normalized.contains("BANK") || normalized.contains("CASH")) {
            return ASSET;
        }
        if (normalized.contains("INCOME") || normalized.contains("SALES") || normalized.contains("REVENUE")) {
            return INCOME;
        }
        if (normalized.contains("EXPENSE") || normalized.contains("PURCHASE")) {
            return EXPENSE;
        }
        return UNCLASSIFIED;
    }
}
