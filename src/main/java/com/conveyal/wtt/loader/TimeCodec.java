package com.conveyal.wtt.loader;

import com.conveyal.wtt.model.Entity;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts clock values found in timetable cells into minutes since the start of the traffic day.
 *
 * The traffic day starts at 02:45. A clock value earlier than that belongs to the following calendar day and is
 * moved forward by one day, so that every event of one operating day falls on a single increasing scale without any
 * date handling. Seconds are truncated.
 */
public abstract class TimeCodec {

    /** 02:45, in minutes since midnight. */
    public static final int TRAFFIC_DAY_START = 165;

    public static final int MINUTES_PER_DAY = 1440;

    /** Returned for text that does not hold a clock value. */
    public static final int NOT_A_TIME = Entity.INT_MISSING;

    /**
     * A clock value at the end of a cell, optionally preceded by a date (spreadsheet exports sometimes carry one).
     * The look-behind keeps "123:45" from being read as 23:45.
     */
    private static final Pattern TIME_PATTERN = Pattern.compile(
        "(?<![\\d:])(?:\\d{1,2}/\\d{1,2}/\\d{2,4}\\s+)?([01]?\\d|2[0-3]):([0-5]\\d)(?::([0-5]\\d))?$"
    );

    /** Anything shaped like a clock value, valid or not. Used to report malformed times. */
    private static final Pattern CLOCK_SHAPE_PATTERN = Pattern.compile("^\\d{1,2}:\\d{1,2}(?::\\d{1,2})?$");

    public static boolean isTime (String text) {
        return text != null && TIME_PATTERN.matcher(text.trim()).find();
    }

    /**
     * @return true if the text looks like a clock value but cannot be read as one, e.g. "24:10" or "7:5".
     */
    public static boolean isMalformedTime (String text) {
        if (text == null) return false;
        String trimmed = text.trim();
        return CLOCK_SHAPE_PATTERN.matcher(trimmed).matches() && !isTime(trimmed);
    }

    /**
     * @return minutes since the start of the traffic day, or {@link #NOT_A_TIME}. Never throws: a cell without a
     * clock value simply carries no timing information.
     */
    public static int toMinutes (String text) {
        if (text == null) return NOT_A_TIME;
        Matcher matcher = TIME_PATTERN.matcher(text.trim());
        if (!matcher.find()) return NOT_A_TIME;
        int hours = Integer.parseInt(matcher.group(1));
        int minutes = Integer.parseInt(matcher.group(2));
        return normalize(hours * 60 + minutes);
    }

    /**
     * Apply the traffic day convention to a number of minutes since midnight.
     */
    public static int normalize (int minutesSinceMidnight) {
        if (minutesSinceMidnight < TRAFFIC_DAY_START) {
            return minutesSinceMidnight + MINUTES_PER_DAY;
        }
        return minutesSinceMidnight;
    }

    /**
     * Format minutes since the start of the traffic day as a wall clock value (HH:MM).
     */
    public static String format (int minutes) {
        if (minutes == NOT_A_TIME) return "--:--";
        int wallClock = minutes % MINUTES_PER_DAY;
        return String.format("%02d:%02d", wallClock / 60, wallClock % 60);
    }

}
