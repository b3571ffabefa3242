package com.conveyal.wtt.loader;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeCodecTest {

    /**
     * Clock values before 02:45 belong to the end of the traffic day and are moved past midnight.
     */
    @ParameterizedTest
    @MethodSource("createTimesAndMinutes")
    void canConvertCellsToTrafficDayMinutes(String cell, int expectedMinutes) {
        assertEquals(expectedMinutes, TimeCodec.toMinutes(cell), "Wrong minutes for " + cell);
    }

    private static Stream<Arguments> createTimesAndMinutes() {
        return Stream.of(
            Arguments.of("08:00", 480),
            Arguments.of("01:10", 1510),
            Arguments.of("02:44", 164 + 1440),
            Arguments.of("02:45", 165),
            Arguments.of("23:59", 1439),
            Arguments.of("0:05", 1445),
            Arguments.of("  7:15 ", 435),
            // Seconds are truncated.
            Arguments.of("08:00:59", 480),
            // Spreadsheet exports may prefix a date.
            Arguments.of("01/01/1900 05:30", 330)
        );
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "ARR", "93001", "24:10", "123:45", "12 CAR", "08:60"})
    void shouldNotReadNonTimes(String cell) {
        assertFalse(TimeCodec.isTime(cell), cell + " should not be read as a time");
        assertEquals(TimeCodec.NOT_A_TIME, TimeCodec.toMinutes(cell));
    }

    @Test
    void canFlagMalformedTimes() {
        assertTrue(TimeCodec.isMalformedTime("24:10"));
        assertTrue(TimeCodec.isMalformedTime("7:5"));
        assertFalse(TimeCodec.isMalformedTime("07:05"));
        assertFalse(TimeCodec.isMalformedTime("BDTS ARR."));
        assertFalse(TimeCodec.isMalformedTime(null));
    }

    @Test
    void canFormatMinutesAsWallClock() {
        assertThat(TimeCodec.format(480), equalTo("08:00"));
        assertThat(TimeCodec.format(1510), equalTo("01:10"));
        assertThat(TimeCodec.format(TimeCodec.NOT_A_TIME), equalTo("--:--"));
    }

    @Test
    void normalizedTimesAreOrderedAcrossMidnight() {
        int lateEvening = TimeCodec.toMinutes("23:50");
        int afterMidnight = TimeCodec.toMinutes("00:20");
        assertTrue(afterMidnight > lateEvening, "00:20 should come after 23:50 in the same traffic day");
    }

}
