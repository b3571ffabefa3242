package com.conveyal.wtt.model;

/**
 * Each direction has its own grid in the working timetable.
 */
public enum Direction {
    /** Toward the reference terminus, e.g. VIRAR to CHURCHGATE. */
    UP,
    /** Away from the reference terminus. */
    DOWN
}
