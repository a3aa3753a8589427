package com.flagship.ledger_reports.voucher;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;

/**
 * Parses the date spellings found in imported data into {@link LocalDate}.
 *
 * Upstream never writes month-first dates, so {@code 03-04-2024} is always
 * the 3rd of April.
 */
public final class SourceDates {

    private static final int ISO_DATE_LENGTH = "uuuu-MM-dd".length();

    private static final List<DateTimeFormatter> FORMATS = List.of(
        strict("uuuu-MM-dd"),
        strict("dd-MM-uuuu"),
        strict("dd/MM/uuuu"),
        strict("uuuuMMdd"),
        strict("d-MMM-uuuu"),
        strict("d-MMM-uu")
    );

    private SourceDates() {
    }

    /**
     * @return the parsed date, or null for null/blank input
     * @throws IllegalArgumentException if no known format matches
     */
    public static LocalDate parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = raw.trim();
        // timestamps from the import carry a time part after the ISO date
        if (text.length() > ISO_DATE_LENGTH
                && (text.charAt(ISO_DATE_LENGTH) == 'T' || text.charAt(ISO_DATE_LENGTH) == ' ')) {
            text = text.substring(0, ISO_DATE_LENGTH);
        }
        for (DateTimeFormatter format : FORMATS) {
            try {
                return LocalDate.parse(text, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        throw new IllegalArgumentException("Unrecognised date: '" + raw + "'");
    }

    private static DateTimeFormatter strict(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
