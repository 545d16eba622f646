package com.phonediag.analyzer.aggregate;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class SessionTimestampParserTest {

    @Test
    void parse_dropsSubSecondSuffix() {
        assertEquals(LocalDateTime.of(2025, 8, 23, 3, 20, 7),
                SessionTimestampParser.parse("23-Aug-25_03-20-07-44").orElseThrow());
    }

    @Test
    void parse_acceptsMissingSuffixAndSingleDigitDay() {
        assertEquals(LocalDateTime.of(2025, 9, 1, 23, 59, 0),
                SessionTimestampParser.parse("1-Sep-25_23-59-00").orElseThrow());
    }

    @Test
    void parse_monthIsCaseInsensitive() {
        assertTrue(SessionTimestampParser.parse("23-aug-25_03-20-07-44").isPresent());
    }

    @Test
    void parse_nonMatchingNameIsEmpty() {
        assertTrue(SessionTimestampParser.parse("not-a-timestamp").isEmpty());
        assertTrue(SessionTimestampParser.parse("2025-08-23_03-20-07").isEmpty());
        assertTrue(SessionTimestampParser.parse(null).isEmpty());
    }

    @Test
    void parse_impossibleDateIsEmpty() {
        assertTrue(SessionTimestampParser.parse("31-Feb-25_01-00-00-10").isEmpty());
        assertTrue(SessionTimestampParser.parse("23-Aug-25_25-00-00-10").isEmpty());
    }
}
