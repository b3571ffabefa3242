package com.conveyal.wtt.validator;

import com.conveyal.wtt.error.ErrorStorage;
import com.conveyal.wtt.error.NewWTTError;
import com.conveyal.wtt.error.NewWTTErrorType;
import com.conveyal.wtt.model.Entity;

/**
 * A Validator examines the services and rake-links extracted from a timetable. It accumulates error messages for
 * problems it finds, and may degrade the entities it examines (a rake-link becomes invalid), but never throws on bad
 * data.
 */
public abstract class Validator {

    ErrorStorage errorStorage;

    public Validator(ErrorStorage errorStorage) {
        this.errorStorage = errorStorage;
    }

    /**
     * Store an error that affects a single entity. Wraps the underlying error factory method.
     */
    public void registerError(Entity entity, NewWTTErrorType errorType) {
        errorStorage.storeError(NewWTTError.forEntity(entity, errorType));
    }

    /**
     * Store an error that affects a single entity.
     * Add a bad value to it.
     */
    public void registerError(Entity entity, NewWTTErrorType errorType, Object badValue) {
        errorStorage.storeError(NewWTTError.forEntity(entity, errorType).setBadValue(badValue.toString()));
    }

    /**
     * Basic storage of user-constructed error.
     */
    public void registerError (NewWTTError error) {
        errorStorage.storeError(error);
    }

    /**
     * This method will be called after the validation process is complete.
     * This allows the implementation to perform any analysis or checking that uses accumulated information, and
     * provides a path to output that summary information (by saving it in the provided ValidationResult object).
     */
    public void complete (ValidationResult validationResult) {}

}
