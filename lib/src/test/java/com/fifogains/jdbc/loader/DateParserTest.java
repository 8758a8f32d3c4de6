package com.fifogains.jdbc.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

final class DateParserTest {

    @Test
    void detectsIsoDates() {
        assertEquals(LocalDateTime.of(2024, 3, 5, 0, 0), DateParser.parse("2024-03-05", null));
        assertEquals(LocalDateTime.of(2024, 3, 5, 14, 30), DateParser.parse("2024-03-05 14:30:00", null));
        assertEquals(LocalDateTime.of(2024, 3, 5, 9, 15, 30), DateParser.parse("2024-03-05T09:15:30", null));
    }

    @Test
    void readsSlashDatesMonthFirst() {
        assertEquals(LocalDateTime.of(2024, 3, 5, 0, 0), DateParser.parse("03/05/2024", null));
    }

    @Test
    void detectsDottedAndNamedMonthLayouts() {
        assertEquals(LocalDateTime.of(2023, 12, 31, 0, 0), DateParser.parse("31.12.2023", null));
        assertEquals(LocalDateTime.of(2024, 3, 5, 0, 0), DateParser.parse("5 Mar 2024", null));
        assertEquals(LocalDateTime.of(2024, 3, 5, 0, 0), DateParser.parse("MAR 5, 2024", null));
    }

    @Test
    void explicitStrftimePatternWins() {
        assertEquals(LocalDateTime.of(2024, 3, 5, 0, 0), DateParser.parse("05/03/2024", "%d/%m/%Y"));
    }

    @Test
    void explicitJavaPattern() {
        assertEquals(LocalDateTime.of(2024, 3, 5, 0, 0), DateParser.parse("05.03.2024", "dd.MM.yyyy"));
    }

    @Test
    void returnsNullInsteadOfThrowing() {
        assertNull(DateParser.parse(null, null));
        assertNull(DateParser.parse("  ", null));
        assertNull(DateParser.parse("not a date", null));
        assertNull(DateParser.parse("2024-02-30", null));
        assertNull(DateParser.parse("2024-03-05", "%d/%m/%Y"));
        assertNull(DateParser.parse("2024-03-05", "%Q"));
    }

    @Test
    void acceptsTemporalValues() {
        assertEquals(LocalDateTime.of(2024, 1, 2, 0, 0), DateParser.parse(LocalDate.of(2024, 1, 2), null));
        LocalDateTime dateTime = LocalDateTime.of(2024, 1, 2, 3, 4);
        assertEquals(dateTime, DateParser.parse(dateTime, "%d/%m/%Y"));
    }

    @Test
    void translatesStrftimeWithQuotedLiterals() {
        assertEquals("yyyy'-'MM'-'dd", DateParser.translateStrftime("%Y-%m-%d"));
        assertEquals("dd'/'MM'/'yyyy' 'HH':'mm", DateParser.translateStrftime("%d/%m/%Y %H:%M"));
        assertEquals("'100%'", DateParser.translateStrftime("100%%"));
    }

    @Test
    void formatterRendersBothPatternStyles() {
        LocalDateTime date = LocalDateTime.of(2024, 3, 5, 0, 0);
        assertEquals("05/03/2024", DateParser.formatter("%d/%m/%Y").format(date));
        assertEquals("2024-03-05", DateParser.formatter("yyyy-MM-dd").format(date));
    }

    @Test
    void explicitPatternsRejectImpossibleDates() {
        assertNull(DateParser.parse("2024-02-30", "%Y-%m-%d"));
        assertNull(DateParser.parse("2023-04-31", "yyyy-MM-dd"));
        assertNull(DateParser.parse("2023-02-29", "%Y-%m-%d"));
        assertEquals(LocalDateTime.of(2024, 2, 29, 0, 0), DateParser.parse("2024-02-29", "%Y-%m-%d"));
    }

    @Test
    void explicitStrftimePatternAcceptsUnpaddedNumbers() {
        assertEquals(LocalDateTime.of(2024, 7, 5, 0, 0), DateParser.parse("5/7/2024", "%d/%m/%Y"));
        assertEquals(LocalDateTime.of(2024, 7, 5, 0, 0), DateParser.parse("05/07/2024", "%d/%m/%Y"));
        assertEquals(LocalDateTime.of(2024, 7, 5, 9, 5), DateParser.parse("5/7/2024 9:05", "%d/%m/%Y %H:%M"));
        assertEquals(LocalDateTime.of(2024, 3, 5, 0, 0), DateParser.parse("20240305", "%Y%m%d"));
    }

    @Test
    void parsePatternsUseProlepticYears() {
        assertEquals("d'/'M'/'uuuu", DateParser.translateStrftime("%d/%m/%Y", true));
        assertEquals("uuuuMMdd", DateParser.translateStrftime("%Y%m%d", true));
        assertEquals("dd.MM.uuuu 'yy'", DateParser.prolepticYears("dd.MM.yyyy 'yy'"));
    }
}
