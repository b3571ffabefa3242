package com.conveyal.wtt.validator;

import com.conveyal.wtt.error.ErrorStorage;
import com.conveyal.wtt.model.Service;

/**
 * Unlike the reconciler, which works on the whole set of rake-links, these validators are run against one sequenced
 * service at a time.
 */
public abstract class ServiceValidator extends Validator {

    public ServiceValidator(ErrorStorage errorStorage) {
        super(errorStorage);
    }

    /**
     * This method will be called on each service that carries station events.
     */
    public abstract void validateService (Service service);

}
