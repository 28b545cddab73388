package teranet.mapdev.propertyetl.transformer;

import lombok.extern.slf4j.Slf4j;
import teranet.mapdev.propertyetl.model.Dataset;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Field-level conversions shared by the transform steps.
 *
 * Every method accepts a missing value (null) and returns null for anything
 * it cannot convert, so a malformed cell never aborts a row.
 */
@Slf4j
public class TransformerUtils {

    // Anything that is not a digit or a decimal point
    private static final Pattern NON_PRICE_CHARS = Pattern.compile("[^\\d.]");

    private static final long SECONDS_PER_DAY = 86_400L;

    // Month-first for slash dates, matching the usual listing exports
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            dateWithOptionalTime("uuuu-MM-dd"),
            dateWithOptionalTime("uuuu/MM/dd"),
            dateWithOptionalTime("MM/dd/uuuu"));

    private TransformerUtils() {
    }

    /**
     * Trim surrounding whitespace and title-case: a letter is upper-cased when
     * the character before it is not a letter, lower-cased otherwise.
     * "  casa EN venta " becomes "Casa En Venta", "PROP-0001" becomes "Prop-0001".
     */
    public static String toTitleCase(String value) {
        if (value == null) {
            return null;
        }
        String stripped = value.strip();
        StringBuilder sb = new StringBuilder(stripped.length());
        boolean previousCased = false;
        for (int i = 0; i < stripped.length(); i++) {
            char c = stripped.charAt(i);
            boolean cased = isCased(c);
            if (cased) {
                sb.append(previousCased ? Character.toLowerCase(c) : Character.toTitleCase(c));
            } else {
                sb.append(c);
            }
            previousCased = cased;
        }
        return sb.toString();
    }

    private static boolean isCased(char c) {
        return Character.isUpperCase(c) || Character.isLowerCase(c) || Character.isTitleCase(c);
    }

    /**
     * Text form of a cell value. Floating-point numbers are written in plain
     * notation ("12345678.5", not "1.2345678E7") so later digit-based parsing
     * sees the same number.
     */
    public static String toText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (!Double.isFinite(number)) {
                return value.toString();
            }
            return BigDecimal.valueOf(number).toPlainString();
        }
        return value.toString();
    }

    /**
     * Keep only digits and decimal points of the value's text form, then parse.
     * "$ 250.000" becomes 250.000, "-10" becomes 10, "abc" and "1.2.3" become null.
     * Infinite and NaN values become null.
     */
    public static Double normalizePrice(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            double number = Math.abs(((Number) value).doubleValue());
            return Double.isFinite(number) ? number : null;
        }
        String digits = NON_PRICE_CHARS.matcher(toText(value)).replaceAll("");
        if (digits.isEmpty()) {
            return null;
        }
        try {
            double number = Double.parseDouble(digits);
            return Double.isFinite(number) ? number : null;
        } catch (NumberFormatException e) {
            log.debug("Unparseable price '{}' set to missing", value);
            return null;
        }
    }

    /**
     * Numeric view of a cell: numbers as-is, numeric text parsed, anything else
     * (including infinite and NaN values) missing.
     */
    public static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        double number;
        if (value instanceof Number) {
            number = ((Number) value).doubleValue();
        } else {
            try {
                number = Double.parseDouble(value.toString().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return Double.isFinite(number) ? number : null;
    }

    /**
     * price / area when both are present and area is positive, otherwise missing.
     */
    public static Double pricePerArea(Object price, Object area) {
        Double priceValue = toDouble(price);
        Double areaValue = toDouble(area);
        if (priceValue == null || areaValue == null || areaValue <= 0) {
            return null;
        }
        return priceValue / areaValue;
    }

    /**
     * Parse a publication date. Accepts date-times as-is, dates at midnight and
     * text in yyyy-MM-dd, yyyy/MM/dd or MM/dd/yyyy with an optional time part.
     */
    public static LocalDateTime parseDateTime(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        String text = value.toString().strip();
        if (text.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDateTime.parse(text, format);
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' does not match {}: {}", text, format, e.getMessage());
            }
        }
        log.debug("Unparseable date '{}' set to missing", text);
        return null;
    }

    /**
     * Whole days from {@code from} to {@code now}, rounded toward negative infinity.
     * Negative for dates after {@code now}.
     */
    public static Long daysBetween(LocalDateTime from, LocalDateTime now) {
        if (from == null || now == null) {
            return null;
        }
        long seconds = Duration.between(from, now).getSeconds();
        return Math.floorDiv(seconds, SECONDS_PER_DAY);
    }

    /**
     * A column is text-typed when at least one of its present values is a String.
     */
    public static boolean isTextColumn(Dataset dataset, String column) {
        for (Object value : dataset.getColumnValues(column)) {
            if (value instanceof String) {
                return true;
            }
        }
        return false;
    }

    private static DateTimeFormatter dateWithOptionalTime(String datePattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(datePattern)
                .optionalStart()
                .optionalStart().appendLiteral(' ').optionalEnd()
                .optionalStart().appendLiteral('T').optionalEnd()
                .appendPattern("HH:mm")
                .optionalStart().appendPattern(":ss").optionalEnd()
                .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
                .optionalEnd()
                .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
                .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
                .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
                .toFormatter(Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
