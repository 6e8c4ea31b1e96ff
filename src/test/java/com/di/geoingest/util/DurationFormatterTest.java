package com.di.geoingest.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DurationFormatter Tests")
class DurationFormatterTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "16442 | 4 hours, 34 minutes, 2 seconds",
            "61    | 1 minute, 1 second",
            "3600  | 1 hour",
            "90061 | 1 day, 1 hour, 1 minute, 1 second",
            "0     | 0 seconds"
    })
    @DisplayName("Zero parts are left out")
    void testFormat(long seconds, String expected) {
        assertEquals(expected, DurationFormatter.format(Duration.ofSeconds(seconds)));
    }

    @Test
    @DisplayName("Sub-second, negative and missing durations read 0 seconds")
    void testFormat_Degenerate() {
        assertEquals("0 seconds", DurationFormatter.format(Duration.ofMillis(400)));
        assertEquals("0 seconds", DurationFormatter.format(Duration.ofSeconds(-5)));
        assertEquals("0 seconds", DurationFormatter.format(null));
    }
}
