package com.conveyal.wtt.filter.conditions;

import com.conveyal.wtt.model.RakeLink;

/**
 * One constraint of a query on whole rake-links. A link that does not pass is hidden together with its services.
 */
public abstract class LinkCondition {

    /**
     * Only called for renderable links.
     */
    public abstract boolean passes(RakeLink link);

}
