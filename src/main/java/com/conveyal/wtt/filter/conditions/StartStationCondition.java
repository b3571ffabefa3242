package com.conveyal.wtt.filter.conditions;

import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.model.StationEvent;

/**
 * The service must start at the given station, inside the time window.
 */
public class StartStationCondition extends ServiceCondition {

    private final String stationName;
    private final int windowStart;
    private final int windowEnd;

    public StartStationCondition(String stationName, int windowStart, int windowEnd) {
        this.stationName = stationName;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
    }

    @Override
    public boolean passes(Service service) {
        StationEvent first = service.firstEvent();
        return first.getStationName().equals(stationName) && windowStart <= first.time && first.time <= windowEnd;
    }
}
