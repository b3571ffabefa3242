package com.conveyal.wtt.model;

public enum RakeLinkStatus {
    /** The summary sequence agrees with the grid and every service on it has station events. */
    VALID,
    /** The summary declares identifiers missing from the grid, or a service on the link yields no events. */
    INVALID,
    /** The summary sequence and the sequence derived from the grid disagree beyond tolerance. */
    CONFLICTING
}
