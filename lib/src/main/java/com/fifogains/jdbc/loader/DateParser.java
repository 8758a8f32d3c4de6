package com.fifogains.jdbc.loader;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Date parsing for transaction rows. Parsing never throws: a value that cannot be read
 * yields {@code null} and the caller keeps the row with an invalid date.
 *
 * <p>Patterns may be given either as {@link DateTimeFormatter} patterns ({@code yyyy-MM-dd}) or as
 * strftime patterns ({@code %Y-%m-%d}); anything containing {@code %} is treated as strftime.
 */
public final class DateParser {

    // Month-first layouts are tried before day-first ones, so 07/08/2024 reads as July 8.
    private static final List<DateTimeFormatter> AUTO_DETECT =
            List.of(
                    DateTimeFormatter.ISO_LOCAL_DATE_TIME,
                    strict("uuuu-MM-dd HH:mm:ss"),
                    strict("uuuu-MM-dd HH:mm"),
                    DateTimeFormatter.ISO_LOCAL_DATE,
                    strict("uuuu/MM/dd"),
                    strict("uuuu/MM/dd HH:mm:ss"),
                    strict("uuuuMMdd"),
                    strict("M/d/uuuu"),
                    strict("M/d/uuuu H:mm"),
                    strict("M/d/uuuu H:mm:ss"),
                    strict("M/d/uu"),
                    strict("M-d-uuuu"),
                    strict("d.M.uuuu"),
                    strict("d.M.uuuu H:mm"),
                    strict("d-MMM-uuuu"),
                    strict("d MMM uuuu"),
                    strict("d MMMM uuuu"),
                    strict("MMM d, uuuu"),
                    strict("MMMM d, uuuu"));

    private static final Map<Character, String> STRFTIME =
            Map.ofEntries(
                    Map.entry('Y', "yyyy"),
                    Map.entry('y', "yy"),
                    Map.entry('m', "MM"),
                    Map.entry('d', "dd"),
                    Map.entry('H', "HH"),
                    Map.entry('I', "hh"),
                    Map.entry('M', "mm"),
                    Map.entry('S', "ss"),
                    Map.entry('f', "SSSSSS"),
                    Map.entry('p', "a"),
                    Map.entry('b', "MMM"),
                    Map.entry('B', "MMMM"),
                    Map.entry('a', "EEE"),
                    Map.entry('A', "EEEE"),
                    Map.entry('j', "DDD"),
                    Map.entry('z', "xx"),
                    Map.entry('Z', "z"));

    // Parsing accepts unpadded numbers, as strptime does. Directives written back to back keep
    // their fixed widths so that the digits can still be split.
    private static final Map<Character, String> STRFTIME_PARSE =
            Map.ofEntries(
                    Map.entry('Y', "uuuu"),
                    Map.entry('y', "uu"),
                    Map.entry('m', "M"),
                    Map.entry('d', "d"),
                    Map.entry('H', "H"),
                    Map.entry('I', "h"),
                    Map.entry('M', "m"),
                    Map.entry('S', "s"));

    private DateParser() {}

    /**
     * Parses a raw date value.
     *
     * @param raw date object or text
     * @param pattern explicit pattern, or {@code null} to auto-detect
     * @return the timestamp, or {@code null} when the value cannot be parsed
     */
    public static LocalDateTime parse(Object raw, String pattern) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof LocalDateTime dateTime) {
            return dateTime;
        }
        if (raw instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        if (raw instanceof OffsetDateTime offset) {
            return offset.toLocalDateTime();
        }
        if (raw instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (raw instanceof Date date) {
            return LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC);
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        if (pattern != null && !pattern.isBlank()) {
            DateTimeFormatter formatter;
            try {
                formatter = parser(pattern);
            } catch (IllegalArgumentException ex) {
                return null;
            }
            return tryParse(text, formatter);
        }
        for (DateTimeFormatter formatter : AUTO_DETECT) {
            LocalDateTime parsed = tryParse(text, formatter);
            if (parsed != null) {
                return parsed;
            }
        }
        try {
            return OffsetDateTime.parse(text).toLocalDateTime();
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    /**
     * Builds a case-insensitive English output formatter from a java.time or strftime pattern.
     *
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public static DateTimeFormatter formatter(String pattern) {
        String javaPattern = pattern.indexOf('%') >= 0 ? translateStrftime(pattern) : pattern;
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(javaPattern)
                .toFormatter(Locale.ENGLISH);
    }

    /**
     * Builds the strict formatter used for an explicit input pattern. Impossible dates such as
     * February 30 are rejected instead of being moved to the end of the month.
     *
     * @throws IllegalArgumentException if the pattern is invalid
     */
    static DateTimeFormatter parser(String pattern) {
        String javaPattern =
                pattern.indexOf('%') >= 0 ? translateStrftime(pattern, true) : prolepticYears(pattern);
        return strict(javaPattern);
    }

    static String translateStrftime(String pattern) {
        return translateStrftime(pattern, false);
    }

    static String translateStrftime(String pattern, boolean forParsing) {
        StringBuilder out = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        boolean afterDirective = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '%' && i + 1 < pattern.length()) {
                char directive = pattern.charAt(++i);
                if (directive == '%') {
                    literal.append('%');
                    afterDirective = false;
                    continue;
                }
                String replacement = STRFTIME.get(directive);
                if (replacement == null) {
                    throw new IllegalArgumentException("Unsupported strftime directive: %" + directive);
                }
                boolean adjacent = afterDirective || directiveAt(pattern, i + 1);
                if (forParsing
                        && STRFTIME_PARSE.containsKey(directive)
                        && (directive == 'Y' || directive == 'y' || !adjacent)) {
                    replacement = STRFTIME_PARSE.get(directive);
                }
                flushLiteral(out, literal);
                out.append(replacement);
                afterDirective = true;
            } else {
                literal.append(c);
                afterDirective = false;
            }
        }
        flushLiteral(out, literal);
        return out.toString();
    }

    private static boolean directiveAt(String pattern, int index) {
        return index + 1 < pattern.length()
                && pattern.charAt(index) == '%'
                && pattern.charAt(index + 1) != '%';
    }

    /** Rewrites year-of-era letters to proleptic year, which the strict resolver needs. */
    static String prolepticYears(String pattern) {
        StringBuilder out = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            }
            out.append(!quoted && c == 'y' ? 'u' : c);
        }
        return out.toString();
    }

    private static void flushLiteral(StringBuilder out, StringBuilder literal) {
        if (literal.length() == 0) {
            return;
        }
        out.append('\'').append(literal.toString().replace("'", "''")).append('\'');
        literal.setLength(0);
    }

    private static LocalDateTime tryParse(String text, DateTimeFormatter formatter) {
        try {
            TemporalAccessor parsed = formatter.parseBest(text, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof LocalDateTime dateTime) {
                return dateTime;
            }
            return ((LocalDate) parsed).atStartOfDay();
        } catch (DateTimeException ex) {
            return null;
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
