package com.flagship.ledger_reports.voucher;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Domain model for a posted Voucher.
 *
 * Key invariant: the signed amounts of all legs sum to zero. The loader
 * checks it and reports violations; the voucher itself just exposes
 * {@link #imbalance()}.
 */
@Value
public class Voucher {

    /**
     * Date, then the source's alteration id, then the voucher id.
     */
    public static final Comparator<Voucher> CHRONOLOGICAL = Comparator
        .comparing(Voucher::getDate)
        .thenComparing(Voucher::getAlterId, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Voucher::getId);

    String id;
    LocalDate date;
    Long alterId;
    String voucherType;
    String voucherNumber;
    String narration;
    List<Leg> legs;

    public Voucher(String id, LocalDate date, Long alterId, String voucherType,
                   String voucherNumber, String narration, List<Leg> legs) {
        this.id = id;
        this.date = date;
        this.alterId = alterId;
        this.voucherType = voucherType;
        this.voucherNumber = voucherNumber;
        this.narration = narration;
        this.legs = List.copyOf(legs);
    }

    public BigDecimal imbalance() {
        return legs.stream()
            .map(Leg::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isBalanced() {
        return imbalance().signum() == 0;
    }

    public boolean touches(String ledgerName) {
        return legs.stream().anyMatch(leg -> leg.isAgainst(ledgerName));
    }

    /**
     * Net signed amount posted to the given ledger by this voucher.
     */
    public BigDecimal amountFor(String ledgerName) {
        return legs.stream()
            .filter(leg -> leg.isAgainst(ledgerName))
            .map(Leg::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
