package com.flagship.ledger_reports.outstanding;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overdue-days ranges. A bill not yet due sits in the first bucket.
 */
public enum AgeingBucket {
    DAYS_0_30("0-30", 0, 30),
    DAYS_31_60("31-60", 31, 60),
    DAYS_61_90("61-90", 61, 90),
    OVER_90(">90", 91, Long.MAX_VALUE);

    private final String label;
    private final long fromDays;
    private final long toDays;

    AgeingBucket(String label, long fromDays, long toDays) {
        this.label = label;
        this.fromDays = fromDays;
        this.toDays = toDays;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static AgeingBucket of(long overdueDays) {
        for (AgeingBucket bucket : values()) {
            if (overdueDays >= bucket.fromDays && overdueDays <= bucket.toDays) {
                return bucket;
            }
        }
        throw new IllegalArgumentException("Overdue days cannot be negative: " + overdueDays);
    }
}
