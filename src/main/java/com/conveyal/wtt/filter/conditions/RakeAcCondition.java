package com.conveyal.wtt.filter.conditions;

import com.conveyal.wtt.filter.AcFilter;
import com.conveyal.wtt.model.RakeLink;

/**
 * Keeps links by the AC flag of the rake assigned to them. A link without a rake never passes.
 */
public class RakeAcCondition extends LinkCondition {

    private final AcFilter filter;

    public RakeAcCondition(AcFilter filter) {
        this.filter = filter;
    }

    @Override
    public boolean passes(RakeLink link) {
        return link.rake != null && filter.accepts(link.rake.ac);
    }
}
