package com.conveyal.wtt.model;

import com.google.common.collect.ImmutableList;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One row of the rake-link summary: the name of a link and the ordered identifiers of the services its rake performs.
 * A placeholder such as "ETY 3" may stand in for a non-revenue movement.
 */
public class SummaryEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    public final String linkName;
    public final List<String> serviceIds;
    /** Declared line for each identifier, same length as serviceIds. Entries are null where none was given. */
    public final List<Line> lines;

    public SummaryEntry(String linkName, List<String> serviceIds, List<Line> lines) {
        if (serviceIds.size() != lines.size()) {
            throw new IllegalArgumentException("Each declared service needs a (possibly null) line entry.");
        }
        this.linkName = linkName;
        this.serviceIds = ImmutableList.copyOf(serviceIds);
        // ImmutableList rejects nulls.
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    @Override
    public String toString() {
        return linkName + " " + serviceIds;
    }
}
