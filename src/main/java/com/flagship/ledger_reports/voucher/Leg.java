package com.flagship.ledger_reports.voucher;

import com.flagship.ledger_reports.directory.Ledger;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One debit or credit entry of a voucher against a ledger.
 *
 * {@code amount} is signed, debit positive. Bill fields are null when the leg
 * carries no bill reference.
 */
@Value
public class Leg {
    long id;
    String ledgerName;
    BigDecimal amount;
    String billRef;
    String billType;
    LocalDate billDate;
    LocalDate dueDate;
    Integer creditPeriodDays;

    public boolean isDebit() {
        return amount.signum() > 0;
    }

    public boolean isCredit() {
        return amount.signum() < 0;
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean hasBillRef() {
        return billRef != null && !billRef.isBlank();
    }

    public boolean isAgainst(String ledger) {
        return Ledger.sameName(ledgerName, ledger);
    }
}
