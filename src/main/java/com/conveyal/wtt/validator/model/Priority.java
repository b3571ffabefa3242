package com.conveyal.wtt.validator.model;

/**
 * How much attention a problem found in a timetable deserves.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW,
    UNKNOWN
}
