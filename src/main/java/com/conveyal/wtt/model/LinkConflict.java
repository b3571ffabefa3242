package com.conveyal.wtt.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.io.Serializable;
import java.util.List;

/**
 * A disagreement between the identifier sequence declared for a link in the summary and the sequence derived by
 * following "reversed as" references through the grid. Kept for reporting only.
 */
public class LinkConflict implements Serializable {

    private static final long serialVersionUID = 1L;

    public final String linkName;
    public final List<String> declaredIds;
    /** Empty when no chain could be derived at all. */
    public final List<String> derivedIds;

    @JsonCreator
    public LinkConflict(@JsonProperty("linkName") String linkName,
                        @JsonProperty("declaredIds") List<String> declaredIds,
                        @JsonProperty("derivedIds") List<String> derivedIds) {
        this.linkName = linkName;
        this.declaredIds = ImmutableList.copyOf(declaredIds);
        this.derivedIds = ImmutableList.copyOf(derivedIds);
    }

    @Override
    public String toString() {
        return String.format("Link %s summary: %s wtt: %s", linkName, declaredIds, derivedIds);
    }
}
