package com.conveyal.wtt.filter.conditions;

import com.conveyal.wtt.filter.AcFilter;
import com.conveyal.wtt.model.Service;

/**
 * Keeps services by the AC requirement read from their header.
 */
public class AcCondition extends ServiceCondition {

    private final AcFilter filter;

    public AcCondition(AcFilter filter) {
        this.filter = filter;
    }

    @Override
    public boolean passes(Service service) {
        return filter.accepts(service.needsAcRake);
    }
}
