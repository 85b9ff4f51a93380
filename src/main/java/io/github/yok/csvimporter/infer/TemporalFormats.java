package io.github.yok.csvimporter.infer;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Date and time-of-day formats recognized in CSV values.
 *
 * <p>
 * The formats are permissive about separators and optional seconds so that the usual exports of
 * spreadsheet tools and databases are detected, while staying strict about calendar validity.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class TemporalFormats {

    /**
     * Date-only formatters tried in order.
     * <ol>
     * <li>{@code yyyy-MM-dd} (ISO)</li>
     * <li>{@code yyyy/MM/dd}</li>
     * <li>{@code yyyy.MM.dd}</li>
     * <li>{@code M/d/yyyy}</li>
     * <li>{@code yyyy年M月d日} (Japanese)</li>
     * </ol>
     */
    public static final List<DateTimeFormatter> DATE_FORMATTERS = List.of(
            strict("uuuu-MM-dd"), strict("uuuu/MM/dd"), strict("uuuu.MM.dd"),
            strict("M/d/uuuu"),
            DateTimeFormatter.ofPattern("uuuu年M月d日", Locale.JAPANESE)
                    .withResolverStyle(ResolverStyle.STRICT));

    /**
     * Time-of-day parser accepting {@code HH:mm}, {@code HH:mm:ss} and
     * {@code HH:mm:ss.fraction}.
     */
    public static final DateTimeFormatter TIME_FORMATTER =
            new DateTimeFormatterBuilder().appendPattern("HH:mm").optionalStart()
                    .appendPattern(":ss").optionalEnd().optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
                    .toFormatter();

    // Date part, optionally followed by 'T' or a space and a time part
    static final Pattern DATE_TIME = Pattern.compile("(\\S+?)(?:[T ](\\S+))?");

    // Time part with a trailing UTC designator or offset
    static final Pattern ZONE_SUFFIX =
            Pattern.compile("(.+?)(?:Z|[+-]\\d{2}(?::?\\d{2})?)");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private TemporalFormats() {}

    /**
     * Parses a date in any of {@link #DATE_FORMATTERS}.
     *
     * @param text date text
     * @return parsed date
     * @throws DateTimeParseException if no format matches
     */
    public static LocalDate parseDate(String text) {
        DateTimeParseException last = null;
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(text, formatter);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw last;
    }

    /**
     * Parses a date or a date-time. A date alone resolves to midnight; a UTC designator or offset
     * after the time is ignored and the local time is kept.
     *
     * @param text date or date-time text
     * @return parsed local date-time
     * @throws DateTimeParseException if the text is not a recognized date or date-time
     */
    public static LocalDateTime parseDateTime(String text) {
        String value = text.strip();
        Matcher m = DATE_TIME.matcher(value);
        if (!m.matches()) {
            throw new DateTimeParseException("Unrecognized date-time", value, 0);
        }
        LocalDate date = parseDate(m.group(1));
        String time = m.group(2);
        if (time == null) {
            return date.atStartOfDay();
        }
        Matcher zoned = ZONE_SUFFIX.matcher(time);
        if (zoned.matches()) {
            try {
                return date.atTime(LocalTime.parse(zoned.group(1), TIME_FORMATTER));
            } catch (DateTimeParseException e) {
                // not an offset; parse the whole time
                return date.atTime(LocalTime.parse(time, TIME_FORMATTER));
            }
        }
        return date.atTime(LocalTime.parse(time, TIME_FORMATTER));
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
