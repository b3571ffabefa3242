package com.conveyal.wtt.error;

import com.conveyal.wtt.model.Entity;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

/**
 * A problem found while extracting or reconciling a timetable. As in the rest of this library there is no class
 * hierarchy of errors: the type field carries severity and message, the remaining fields say where the problem is.
 * Errors never abort processing; they are collected in an {@link ErrorStorage}.
 */
public class NewWTTError implements Serializable {

    private static final long serialVersionUID = 1L;

    public final NewWTTErrorType errorType;

    /** The simple class name of the affected entity, or null for errors that concern the whole timetable. */
    public String entityType;

    /** Identifier of the affected entity (service identifier, link name or station label). */
    public String entityId;

    /** Grid row the problem was found on, or null. */
    public Integer row;

    /** The offending value, to be shown to end users. */
    public String badValue;

    /** Key-value pairs with additional detail. */
    public final Map<String, String> errorInfo = new HashMap<>();

    private NewWTTError(NewWTTErrorType errorType) {
        this.errorType = errorType;
    }

    /** An error that concerns a single entity. */
    public static NewWTTError forEntity(Entity entity, NewWTTErrorType errorType) {
        NewWTTError error = new NewWTTError(errorType);
        error.entityType = entity.getClass().getSimpleName();
        error.entityId = entity.getId();
        return error;
    }

    /** An error that concerns the timetable as a whole rather than one entity. */
    public static NewWTTError forTimetable(NewWTTErrorType errorType, String badValue) {
        return new NewWTTError(errorType).setBadValue(badValue);
    }

    public NewWTTError setBadValue(String badValue) {
        this.badValue = badValue;
        return this;
    }

    public NewWTTError setRow(int row) {
        this.row = row;
        return this;
    }

    public NewWTTError addInfo(String key, String value) {
        errorInfo.put(key, value);
        return this;
    }

    public String getMessageWithContext() {
        StringBuilder sb = new StringBuilder();
        sb.append(errorType.name());
        if (entityType != null) {
            sb.append(' ').append(entityType).append(' ').append(entityId);
        }
        if (row != null) {
            sb.append(" row ").append(row);
        }
        if (badValue != null) {
            sb.append(" '").append(badValue).append('\'');
        }
        sb.append(": ").append(errorType.englishMessage);
        return sb.toString();
    }

    @Override
    public String toString() {
        return "NewWTTError: " + getMessageWithContext();
    }

}
