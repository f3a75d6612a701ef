package com.runtree.xml;

import com.runtree.model.DataException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LegacyTimestampsTest {

    @Test
    void parse_fullValue() {
        assertEquals(LocalDateTime.of(2023, 1, 1, 12, 0, 1, 500_000_000), LegacyTimestamps.parse("20230101 12:00:01.500"));
    }

    @Test
    void parse_padsShortValues() {
        assertEquals(LocalDateTime.of(2023, 6, 15, 8, 30, 0), LegacyTimestamps.parse("20230615 08:30"));
        assertEquals(LocalDateTime.of(2023, 6, 15, 0, 0), LegacyTimestamps.parse("20230615"));
    }

    @Test
    void parse_notAvailableAndEmptyAreNull() {
        assertNull(LegacyTimestamps.parse("N/A"));
        assertNull(LegacyTimestamps.parse(""));
        assertNull(LegacyTimestamps.parse(null));
    }

    @Test
    void parse_invalidDigitsFail() {
        DataException e = assertThrows(DataException.class, () -> LegacyTimestamps.parse("2023xx01 12:00:00.000"));
        assertEquals("Invalid timestamp '2023xx01 12:00:00.000'.", e.getMessage());
        assertThrows(DataException.class, () -> LegacyTimestamps.parse("20231301 12:00:00.000"));
    }

    @Test
    void parseGenerated_prefersIsoAndFallsBackToLegacy() {
        assertEquals(LocalDateTime.of(2024, 5, 2, 10, 15, 30, 123_456_000),
                LegacyTimestamps.parseGenerated("2024-05-02T10:15:30.123456"));
        assertEquals(LocalDateTime.of(2020, 3, 4, 5, 6, 7, 890_000_000),
                LegacyTimestamps.parseGenerated("20200304 05:06:07.890"));
        assertNull(LegacyTimestamps.parseGenerated(""));
    }
}
