package com.flagship.ledger_reports.voucher;

import lombok.Value;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * A normalized leg together with the header of the voucher it belongs to.
 */
@Value
public class Posting {

    /**
     * Chronological order with the source system's alteration id and then the
     * leg id as tie-breaks, so equal dates always sort the same way.
     */
    public static final Comparator<Posting> CHRONOLOGICAL = Comparator
        .comparing(Posting::getDate)
        .thenComparing(Posting::getAlterId, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Posting::getVoucherId)
        .thenComparingLong(p -> p.getLeg().getId());

    String voucherId;
    Long alterId;
    LocalDate date;
    String voucherType;
    String voucherNumber;
    String narration;
    Leg leg;
}
