package com.conveyal.wtt.filter;

import com.conveyal.wtt.loader.TimeCodec;
import com.conveyal.wtt.model.Direction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A structured query against a reconciled timetable. Station names may be given in any case and under any alias
 * known to the station directory. Every field except the time window is optional; an empty list or null means "no
 * constraint".
 */
public class FilterQuery {

    /** The default window covers one whole traffic day: 02:45 to 02:45 on the next day. */
    public static final int DEFAULT_WINDOW_START = TimeCodec.TRAFFIC_DAY_START;
    public static final int DEFAULT_WINDOW_END = TimeCodec.TRAFFIC_DAY_START + TimeCodec.MINUTES_PER_DAY;

    public FilterType type = FilterType.SERVICE;

    public String startStation;
    public String endStation;
    public List<String> passingThrough = new ArrayList<>();

    /** Inclusive bounds, in minutes since the start of the traffic day. */
    public int windowStart = DEFAULT_WINDOW_START;
    public int windowEnd = DEFAULT_WINDOW_END;

    public AcFilter ac = AcFilter.ALL;
    public Set<Direction> directions = EnumSet.noneOf(Direction.class);

    public List<String> selectedLinks = new ArrayList<>();
    public List<String> selectedServices = new ArrayList<>();

    public FilterQuery() { }

    public FilterQuery(FilterType type) {
        this.type = type;
    }

    public boolean inWindow (int time) {
        return windowStart <= time && time <= windowEnd;
    }

    public FilterQuery between (int windowStart, int windowEnd) {
        if (windowStart > windowEnd) {
            throw new IllegalArgumentException("Time window starts after it ends.");
        }
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        return this;
    }

    public FilterQuery from (String startStation) {
        this.startStation = startStation;
        return this;
    }

    public FilterQuery to (String endStation) {
        this.endStation = endStation;
        return this;
    }

    public FilterQuery passingThrough (String... stations) {
        this.passingThrough.addAll(Arrays.asList(stations));
        return this;
    }

    public FilterQuery inDirections (Direction... directions) {
        this.directions.addAll(Arrays.asList(directions));
        return this;
    }

    public FilterQuery withAc (AcFilter ac) {
        this.ac = ac;
        return this;
    }

    public FilterQuery selectLinks (String... linkNames) {
        this.selectedLinks.addAll(Arrays.asList(linkNames));
        return this;
    }

    public FilterQuery selectServices (String... serviceIds) {
        this.selectedServices.addAll(Arrays.asList(serviceIds));
        return this;
    }

    @Override
    public String toString() {
        return String.format("FilterQuery %s %s->%s via %s [%s, %s] %s %s links %s services %s", type, startStation,
            endStation, passingThrough, TimeCodec.format(windowStart), TimeCodec.format(windowEnd), ac, directions,
            selectedLinks, selectedServices);
    }

}
