package com.conveyal.wtt.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One visit of a service to a station. Events are immutable. Their order within a service is the order in which they
 * were found while walking down the service column, which is taken to be chronological.
 */
public class StationEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    public final Station station;
    /** Minutes since the start of the traffic day, see {@link com.conveyal.wtt.loader.TimeCodec}. */
    public final int time;
    public final EventType type;
    /** Index of the owning service in the timetable's service list. */
    public final int serviceIndex;
    /** Zero-based position of this event within the owning service. */
    public final int sequence;

    public StationEvent(Station station, int time, EventType type, int serviceIndex, int sequence) {
        this.station = station;
        this.time = time;
        this.type = type;
        this.serviceIndex = serviceIndex;
        this.sequence = sequence;
    }

    public String getStationName() {
        return station.name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StationEvent that = (StationEvent) o;
        return time == that.time &&
            serviceIndex == that.serviceIndex &&
            sequence == that.sequence &&
            type == that.type &&
            station.equals(that.station);
    }

    @Override
    public int hashCode() {
        return Objects.hash(station, time, type, serviceIndex, sequence);
    }

    @Override
    public String toString() {
        return String.format("%s %s %d", station.name, type, time);
    }
}
