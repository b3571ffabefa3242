package com.conveyal.wtt.error;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Stores extraction and reconciliation errors one by one. A reconciliation run is a single in-memory pass, so errors
 * are kept in a plain list in the order they were found.
 */
public class ErrorStorage {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorStorage.class);

    private final List<NewWTTError> errors = new ArrayList<>();

    public void storeError (NewWTTError error) {
        LOG.debug("{}", error);
        errors.add(error);
    }

    public void storeErrors (Collection<NewWTTError> newErrors) {
        for (NewWTTError error : newErrors) {
            storeError(error);
        }
    }

    public List<NewWTTError> getErrors () {
        return ImmutableList.copyOf(errors);
    }

    public List<NewWTTError> getErrors (NewWTTErrorType errorType) {
        return errors.stream().filter(e -> e.errorType == errorType).collect(Collectors.toList());
    }

    public int getErrorCount () {
        return errors.size();
    }

    /** @return the number of errors of each type that was encountered at least once. */
    public Map<NewWTTErrorType, Integer> getErrorCountsByType () {
        Map<NewWTTErrorType, Integer> counts = new EnumMap<>(NewWTTErrorType.class);
        for (NewWTTError error : errors) {
            counts.merge(error.errorType, 1, Integer::sum);
        }
        return counts;
    }

}
