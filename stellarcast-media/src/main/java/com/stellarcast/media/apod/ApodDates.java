package com.stellarcast.media.apod;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Date argument validation for by-date requests.
 */
public final class ApodDates {

    private ApodDates() {
    }

    /** Dates must be strictly after this day. */
    public static final LocalDate EARLIEST_DATE = LocalDate.of(1995, 6, 16);

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    public static boolean isValidDateFormat(String raw) {
        try {
            parse(raw);
            return true;
        } catch (InvalidDateFormatException e) {
            return false;
        }
    }

    /**
     * @throws InvalidDateFormatException if malformed or not after
     *                                    {@link #EARLIEST_DATE}
     */
    public static LocalDate parse(String raw) {
        if (raw == null) {
            throw new InvalidDateFormatException("date is required");
        }
        LocalDate date;
        try {
            date = LocalDate.parse(raw.trim(), FORMAT);
        } catch (DateTimeParseException e) {
            throw new InvalidDateFormatException("not a YYYY-MM-DD date: " + raw);
        }
        if (!date.isAfter(EARLIEST_DATE)) {
            throw new InvalidDateFormatException("date must be after " + EARLIEST_DATE + ": " + raw);
        }
        return date;
    }
}
