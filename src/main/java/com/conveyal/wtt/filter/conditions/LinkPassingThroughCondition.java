package com.conveyal.wtt.filter.conditions;

import com.conveyal.wtt.model.RakeLink;
import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.model.StationEvent;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Some service of the link must call at each of the given stations inside the time window.
 */
public class LinkPassingThroughCondition extends LinkCondition {

    private final List<String> stationNames;
    private final int windowStart;
    private final int windowEnd;

    public LinkPassingThroughCondition(List<String> stationNames, int windowStart, int windowEnd) {
        this.stationNames = stationNames;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
    }

    @Override
    public boolean passes(RakeLink link) {
        Set<String> seen = new HashSet<>();
        for (Service service : link.getServicePath()) {
            for (StationEvent event : service.events) {
                if (event.time >= windowStart && event.time <= windowEnd) seen.add(event.getStationName());
            }
        }
        return seen.containsAll(stationNames);
    }
}
