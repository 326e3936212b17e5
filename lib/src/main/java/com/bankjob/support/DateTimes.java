package com.bankjob.support;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;

/**
 * Date-time conversions between scraped text and the two output encodings: the fixed-width OFX form
 * {@code yyyyMMddHHmmss} and the CSV form {@code yyyy-MM-dd HH:mm:ss}.
 */
public final class DateTimes {

    private static final DateTimeFormatter INTERCHANGE =
            DateTimeFormatter.ofPattern("uuuuMMddHHmmss", Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter RECORD =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss", Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter DIGITS_MINUTES =
            DateTimeFormatter.ofPattern("uuuuMMddHHmm", Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter DIGITS_DATE =
            DateTimeFormatter.ofPattern("uuuuMMdd", Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT);

    // Layouts tried in order for anything that is not a plain digit run.
    private static final List<DateTimeFormatter> TEXT_LAYOUTS =
            List.of(
                    withOptionalTime("uuuu-MM-dd"),
                    withOptionalTime("uuuu/MM/dd"),
                    withOptionalTime("d-M-uuuu"),
                    withOptionalTime("d/M/uuuu"),
                    withOptionalTime("d.M.uuuu"),
                    DateTimeFormatter.ISO_LOCAL_DATE_TIME);

    private DateTimes() {}

    /** Returns {@code yyyyMMddHHmmss}, or the empty string for {@code null}. */
    public static String toInterchange(LocalDateTime dateTime) {
        return dateTime == null ? "" : INTERCHANGE.format(dateTime);
    }

    /** Returns {@code yyyy-MM-dd HH:mm:ss}, or the empty string for {@code null}. */
    public static String toRecord(LocalDateTime dateTime) {
        return dateTime == null ? "" : RECORD.format(dateTime);
    }

    /**
     * Best-effort conversion of a scraped date into a {@link LocalDateTime}.
     *
     * <p>A {@link LocalDateTime} is returned unchanged and a {@link LocalDate} becomes the start of
     * that day. {@code null} and blank text mean "no date" and yield {@code null}. Digit-only text of
     * 14, 12 or 8 characters is read literally as {@code yyyyMMddHHmmss}, {@code yyyyMMddHHmm} or
     * {@code yyyyMMdd}; a zero-padded year such as {@code 00080729000000} therefore parses to year 8
     * rather than being guessed into another century.</p>
     *
     * @throws DateTimeParseException if the text matches none of the known layouts
     */
    public static LocalDateTime parseFlexible(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof LocalDateTime dateTime) {
            return dateTime;
        }
        if (raw instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        String text = raw.toString().strip();
        if (text.isEmpty()) {
            return null;
        }
        if (isDigits(text)) {
            return parseDigits(text);
        }
        for (DateTimeFormatter layout : TEXT_LAYOUTS) {
            try {
                return layout.parse(text, DateTimes::toDateTime);
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        throw new DateTimeParseException("Unrecognized date: " + text, text, 0);
    }

    private static LocalDateTime parseDigits(String text) {
        switch (text.length()) {
            case 14:
                return LocalDateTime.parse(text, INTERCHANGE);
            case 12:
                return LocalDateTime.parse(text, DIGITS_MINUTES);
            case 8:
                return LocalDate.parse(text, DIGITS_DATE).atStartOfDay();
            default:
                throw new DateTimeParseException(
                        "Numeric date must have 8, 12 or 14 digits: " + text, text, 0);
        }
    }

    private static LocalDateTime toDateTime(TemporalAccessor parsed) {
        LocalDate date = LocalDate.from(parsed);
        if (!parsed.isSupported(ChronoField.HOUR_OF_DAY)) {
            return date.atStartOfDay();
        }
        return date.atTime(
                parsed.get(ChronoField.HOUR_OF_DAY),
                parsed.get(ChronoField.MINUTE_OF_HOUR),
                parsed.isSupported(ChronoField.SECOND_OF_MINUTE)
                        ? parsed.get(ChronoField.SECOND_OF_MINUTE)
                        : 0);
    }

    private static DateTimeFormatter withOptionalTime(String datePattern) {
        return new DateTimeFormatterBuilder()
                .appendPattern(datePattern)
                .optionalStart()
                .appendLiteral(' ')
                .appendPattern("HH:mm")
                .optionalStart()
                .appendPattern(":ss")
                .optionalEnd()
                .optionalEnd()
                .toFormatter(Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    private static boolean isDigits(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
