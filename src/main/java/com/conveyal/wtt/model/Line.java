package com.conveyal.wtt.model;

/**
 * The line a service is declared to run on in the rake-link summary.
 */
public enum Line {
    FAST,
    SLOW
}
