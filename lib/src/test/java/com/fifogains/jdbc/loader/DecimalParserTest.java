package com.fifogains.jdbc.loader;

import static com.fifogains.jdbc.testing.TestTransactions.assertDecimal;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

final class DecimalParserTest {

    @Test
    void parsesDotDecimal() throws Exception {
        assertEquals(new BigDecimal("1234.56"), DecimalParser.parse("1234.56"));
    }

    @Test
    void stripsThousandsSeparators() throws Exception {
        assertEquals(new BigDecimal("1234567.50"), DecimalParser.parse("1,234,567.50"));
    }

    @Test
    void trimsWhitespaceAndKeepsSign() throws Exception {
        assertDecimal("-0.5", DecimalParser.parse("  -0.50 "));
    }

    @Test
    void acceptsNumericValues() throws Exception {
        assertDecimal("12", DecimalParser.parse(Integer.valueOf(12)));
        assertDecimal("2.5", DecimalParser.parse(Double.valueOf(2.5)));
        assertDecimal("7", DecimalParser.parse((Object) "7"));
    }

    @Test
    void rejectsBlankAndText() {
        assertThrows(RowParseException.class, () -> DecimalParser.parse("   "));
        assertThrows(RowParseException.class, () -> DecimalParser.parse("12abc"));
        assertThrows(RowParseException.class, () -> DecimalParser.parse((Object) null));
    }

    @Test
    void rejectsNonFiniteNumbers() {
        assertThrows(RowParseException.class, () -> DecimalParser.parse(Double.valueOf(Double.NaN)));
        assertThrows(
                RowParseException.class, () -> DecimalParser.parse(Double.valueOf(Double.POSITIVE_INFINITY)));
    }
}
