package dk.trustworks.attribution.utils;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public final class DateUtils {

    private static final DateTimeFormatter ISO_DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private DateUtils() {
    }

    /**
     * Parse a yyyy-MM-dd query value; null or blank gives null.
     *
     * @throws IllegalArgumentException when the value is not a date in that format
     */
    public static LocalDate dateIt(String date) {
        if (date == null || date.isBlank()) return null;
        try {
            return LocalDate.parse(date.trim(), ISO_DAY);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Expected a date as yyyy-MM-dd but got '" + date + "'", e);
        }
    }
}
