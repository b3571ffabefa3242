package com.conveyal.wtt.filter.conditions;

import com.conveyal.wtt.model.Service;

/**
 * One constraint of a query, checked against a single service that carries events. A query hides a service as soon
 * as any of its conditions does not pass.
 */
public abstract class ServiceCondition {

    /**
     * All sub classes must implement this method. It is only called for services with at least one event.
     */
    public abstract boolean passes(Service service);

}
