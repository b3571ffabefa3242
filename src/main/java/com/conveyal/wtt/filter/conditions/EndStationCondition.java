package com.conveyal.wtt.filter.conditions;

import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.model.StationEvent;

/**
 * The service must end at the given station, inside the time window.
 */
public class EndStationCondition extends ServiceCondition {

    private final String stationName;
    private final int windowStart;
    private final int windowEnd;

    public EndStationCondition(String stationName, int windowStart, int windowEnd) {
        this.stationName = stationName;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
    }

    @Override
    public boolean passes(Service service) {
        StationEvent last = service.lastEvent();
        return last.getStationName().equals(stationName) && windowStart <= last.time && last.time <= windowEnd;
    }
}
