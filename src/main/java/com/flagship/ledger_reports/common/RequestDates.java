package com.flagship.ledger_reports.common;

import com.flagship.ledger_reports.voucher.SourceDates;

import java.time.LocalDate;
import java.time.Month;

/**
 * Date handling for report request parameters.
 *
 * Accepts the same spellings as imported data. Books run on an April to
 * March financial year.
 */
public final class RequestDates {

    private RequestDates() {
    }

    /**
     * @return the parsed date, or {@code fallback} when the parameter is absent
     * @throws IllegalArgumentException naming the parameter when the value is not a date
     */
    public static LocalDate parseOrDefault(String value, String parameter, LocalDate fallback) {
        try {
            LocalDate parsed = SourceDates.parse(value);
            return parsed != null ? parsed : fallback;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + parameter + " date: '" + value + "'", e);
        }
    }

    /**
     * First of April of the financial year containing {@code date}.
     */
    public static LocalDate financialYearStart(LocalDate date) {
        int year = date.getMonthValue() >= Month.APRIL.getValue() ? date.getYear() : date.getYear() - 1;
        return LocalDate.of(year, Month.APRIL, 1);
    }
}
