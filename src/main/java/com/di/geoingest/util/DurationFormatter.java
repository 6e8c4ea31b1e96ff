package com.di.geoingest.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a job duration for the ledger, e.g. {@code 4 hours, 34 minutes, 2 seconds}.
 * Zero parts are left out; a sub-second duration reads {@code 0 seconds}.
 */
public final class DurationFormatter {

    private DurationFormatter() {}

    public static String format(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return "0 seconds";
        }
        long totalSeconds = duration.getSeconds();
        long days = totalSeconds / 86_400;
        long hours = (totalSeconds % 86_400) / 3_600;
        long minutes = (totalSeconds % 3_600) / 60;
        long seconds = totalSeconds % 60;

        List<String> parts = new ArrayList<>();
        append(parts, days, "day");
        append(parts, hours, "hour");
        append(parts, minutes, "minute");
        append(parts, seconds, "second");
        return parts.isEmpty() ? "0 seconds" : String.join(", ", parts);
    }

    private static void append(List<String> parts, long value, String unit) {
        if (value > 0) {
            parts.add(value + " " + unit + (value > 1 ? "s" : ""));
        }
    }
}
