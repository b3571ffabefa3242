package com.conveyal.wtt.error;

import com.conveyal.wtt.validator.model.Priority;

public enum NewWTTErrorType {
    // Grid and summary content.
    TIME_FORMAT(Priority.LOW, "A cell looked like a clock value but could not be read as HH:MM or HH:MM:SS."),
    CAR_COUNT_FORMAT(Priority.LOW, "A header cell mentions CAR but does not give a number of cars."),
    STATION_UNRESOLVED(Priority.MEDIUM, "A timed cell could not be associated with any station of the directory."),
    SERVICE_WITHOUT_TIMES(Priority.MEDIUM, "A service column has identifiers but no clock values."),
    DUPLICATE_SERVICE_ID(Priority.MEDIUM, "More than one service column declares the same identifier. The first one is used."),
    SUCCESSOR_UNKNOWN(Priority.LOW, "A service reverses into an identifier that no service in the grid declares."),
    CHAIN_CYCLE(Priority.HIGH, "Following reversals reached a service already on a chain, the chain was truncated."),

    // Reconciliation of the summary with the grid.
    LINK_WITHOUT_SERVICES(Priority.HIGH, "A link of the summary does not declare any service."),
    UNDEFINED_SERVICE_ID(Priority.HIGH, "The summary declares a service identifier that does not appear in the grid."),
    LINK_SEQUENCE_MISMATCH(Priority.HIGH, "The services of a link in the summary disagree with the chain derived from the grid."),
    SERVICE_ALREADY_ASSIGNED(Priority.HIGH, "A service is already performed by another rake-link."),
    SERVICE_WITHOUT_EVENTS(Priority.HIGH, "No station event could be extracted for a service on a link."),
    EVENT_TIME_DECREASING(Priority.MEDIUM, "A station event of a service is earlier than the event before it."),

    // Unknown errors.
    OTHER(Priority.LOW, "Other errors.");

    public final Priority priority;
    public final String englishMessage;

    NewWTTErrorType(Priority priority, String englishMessage) {
        this.priority = priority;
        this.englishMessage = englishMessage;
    }

}
