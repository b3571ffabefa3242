package com.conveyal.wtt.error;

/**
 * Thrown when the static configuration a reconciliation run depends on (the station directory with its alias and
 * abbreviation tables) is missing or malformed. This is the only condition that aborts a whole run; every problem in
 * the timetable data itself is recorded as a {@link NewWTTError} instead.
 */
public class ConfigurationException extends RuntimeException {

    /** This is the string that will make it out to the client, explaining what went wrong. */
    public final String badValue;

    public ConfigurationException(String message, String badValue) {
        super(message);
        this.badValue = badValue;
    }

    /** This is the constructor for wrapping unexpected exceptions while reading configuration. */
    public ConfigurationException(String message, Exception ex) {
        super(message, ex);
        // Expose the exception type and message to the outside world.
        badValue = ex.toString();
    }

}
