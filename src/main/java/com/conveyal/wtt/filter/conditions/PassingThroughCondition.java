package com.conveyal.wtt.filter.conditions;

import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.model.StationEvent;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The service must call at every one of the given stations inside the time window. When a service has several events
 * at a station (arrival and departure) the last one counts.
 */
public class PassingThroughCondition extends ServiceCondition {

    private final List<String> stationNames;
    private final int windowStart;
    private final int windowEnd;

    public PassingThroughCondition(List<String> stationNames, int windowStart, int windowEnd) {
        this.stationNames = stationNames;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
    }

    @Override
    public boolean passes(Service service) {
        Map<String, Integer> lastTimeAtStation = new HashMap<>();
        for (StationEvent event : service.events) {
            lastTimeAtStation.put(event.getStationName(), event.time);
        }
        for (String stationName : stationNames) {
            Integer time = lastTimeAtStation.get(stationName);
            if (time == null || time < windowStart || time > windowEnd) return false;
        }
        return true;
    }
}
