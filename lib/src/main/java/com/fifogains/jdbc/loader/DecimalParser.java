package com.fifogains.jdbc.loader;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Converts raw quantity and price values into {@link BigDecimal}. Strings may carry comma thousands
 * separators ({@code "1,234.50"}); the dot is always the decimal separator. Centralizing this keeps
 * quantity and price parsing consistent regardless of where the raw value came from.
 */
public final class DecimalParser {

    private DecimalParser() {}

    /**
     * Parses a numeric or textual value.
     *
     * @throws RowParseException for blank text, non-numeric text and non-finite numbers
     */
    public static BigDecimal parse(Object raw) throws RowParseException {
        if (raw == null) {
            throw new RowParseException("Missing numeric value");
        }
        if (raw instanceof BigDecimal decimal) {
            return decimal;
        }
        if (raw instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return BigDecimal.valueOf(((Number) raw).longValue());
        }
        if (raw instanceof Double || raw instanceof Float) {
            double value = ((Number) raw).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new RowParseException("Not a finite number: " + raw);
            }
            return new BigDecimal(raw.toString());
        }
        return parse(raw.toString());
    }

    public static BigDecimal parse(String text) throws RowParseException {
        if (text == null) {
            throw new RowParseException("Missing numeric value");
        }
        String cleaned = text.trim().replace(",", "");
        if (cleaned.isEmpty()) {
            throw new RowParseException("Invalid decimal: '" + text + "'");
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException ex) {
            throw new RowParseException("Invalid decimal: '" + text + "'", ex);
        }
    }
}
