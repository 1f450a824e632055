package dev.univer.points.util;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.regex.Pattern;

public class ParseUtil {
    /** Format every timestamp is written back to the sheet in. */
    public static final DateTimeFormatter CANONICAL = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final DateTimeFormatter WITH_FRACTION = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .toFormatter();

    // tried in order, the first that parses wins
    private static final List<DateTimeFormatter> DATE_TIMES = List.of(
            CANONICAL,
            WITH_FRACTION,
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm")
    );
    private static final List<DateTimeFormatter> DATES = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy")
    );

    private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");

    private ParseUtil() {
    }

    /**
     * Reads a sheet timestamp. Local formats are interpreted in {@code zone};
     * strings carrying their own offset keep it.
     *
     * @return the instant, or {@code null} when the string is blank or matches no known format
     */
    public static Instant parseTimestamp(String raw, ZoneId zone) {
        if (raw == null || raw.isBlank()) return null;
        String text = raw.trim();

        for (DateTimeFormatter f : DATE_TIMES) {
            try {
                return LocalDateTime.parse(text, f).atZone(zone).toInstant();
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        for (DateTimeFormatter f : DATES) {
            try {
                return LocalDate.parse(text, f).atStartOfDay(zone).toInstant();
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static String formatTimestamp(Instant instant, ZoneId zone) {
        if (instant == null) return "";
        return CANONICAL.format(instant.atZone(zone));
    }

    /**
     * Whole-number points. Blank cells count as zero and are not malformed.
     *
     * @return the value, or {@code null} when the cell holds something that is not an integer
     */
    public static Integer parsePoints(String raw) {
        if (raw == null || raw.isBlank()) return 0;
        String text = raw.trim();
        if (!INTEGER.matcher(text).matches()) return null;
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            // out of int range
            return null;
        }
    }

    public static String trimToEmpty(String s) {
        return s == null ? "" : s.trim();
    }
}
