package com.conveyal.wtt.model;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One working extracted from a single column of the working timetable grid.
 *
 * The kind of working is a closed set of variants ({@link Regular}, {@link Stabling}, {@link MultiIdentifier}),
 * each holding only the identifiers that make sense for it. Everything else is common to all variants.
 *
 * Services are created by the extractor, gain station events during reconciliation if (and only if) they end up on a
 * valid rake-link, and are by convention read-only once the timetable has been built. Query-specific state such as
 * visibility is never stored here.
 */
public abstract class Service extends Entity implements Cloneable {

    private static final long serialVersionUID = 1L;

    /** Position of this service in the timetable's service list. Graph edges and events refer to services by index. */
    public int index;
    /** Zero-based grid column the service was extracted from. */
    public int column;
    public Direction direction;
    public ServiceZone zone;
    public boolean needsAcRake;
    /** Car count required by the header ("12 CAR"), or INT_MISSING when the header does not say. */
    public int carCount = INT_MISSING;
    /** Identifier of the service this train becomes after reversing at its last station, or null. */
    public String successorId;
    /** The cells of this column that carry a clock value, top to bottom. */
    public List<TimedCell> timedCells = new ArrayList<>();

    public Station initStation;
    public Station finalStation;

    /** Station visits in chronological order. Empty unless the service is on a valid rake-link. */
    public List<StationEvent> events = Collections.emptyList();
    public double lengthKm;

    public abstract ServiceType getType();

    /** @return every identifier declared in the header of this service's column, possibly none. */
    public abstract List<String> getIds();

    /**
     * @return the identifier used to name this service in sequences and reports. Stabling workings have no
     * identifier, so a positional name is produced for them.
     */
    @Override
    public String getId() {
        List<String> ids = getIds();
        return ids.isEmpty() ? String.format("STABLING-%s-%d", direction, column) : ids.get(0);
    }

    public boolean carries(String id) {
        return getIds().contains(id);
    }

    public boolean hasEvents() {
        return !events.isEmpty();
    }

    public StationEvent firstEvent() {
        return events.isEmpty() ? null : events.get(0);
    }

    public StationEvent lastEvent() {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    /**
     * Sum of the absolute chainage differences between consecutive events. Pairs touching a station outside the
     * network contribute nothing. Zero events yield zero.
     */
    public double computeLengthKm() {
        double length = 0;
        for (int i = 1; i < events.size(); i++) {
            Station previous = events.get(i - 1).station;
            Station current = events.get(i).station;
            if (!previous.isOnNetwork() || !current.isOnNetwork()) continue;
            length += Math.abs(current.chainageKm - previous.chainageKm);
        }
        return length;
    }

    /**
     * Build the variant matching the number of identifiers found in a column header.
     */
    public static Service forIdentifiers(List<String> ids) {
        if (ids.isEmpty()) return new Stabling();
        if (ids.size() == 1) return new Regular(ids.get(0));
        return new MultiIdentifier(ids);
    }

    @Override
    public Service clone() {
        try {
            Service copy = (Service) super.clone();
            copy.timedCells = new ArrayList<>(timedCells);
            copy.events = ImmutableList.copyOf(events);
            return copy;
        } catch (CloneNotSupportedException e) {
            // Service is Cloneable, so this cannot happen.
            throw new AssertionError(e);
        }
    }

    @Override
    public String toString() {
        String ids = getIds().isEmpty() ? "None" : String.join(",", getIds());
        String init = initStation == null ? "?" : initStation.name;
        String fin = finalStation == null ? "?" : finalStation.name;
        String rake = carCount == INT_MISSING ? "?" : carCount + "-CAR";
        return String.format("<Service %s (%s, %s, %s, %s) %s->%s linked:%s>", ids, direction, zone,
            needsAcRake ? "AC" : "NON-AC", rake, init, fin, successorId == null ? "None" : successorId);
    }

    /** A working with exactly one identifier. */
    public static final class Regular extends Service {
        private static final long serialVersionUID = 1L;
        public final String serviceId;

        public Regular(String serviceId) {
            this.serviceId = serviceId;
        }

        @Override
        public ServiceType getType() {
            return ServiceType.REGULAR;
        }

        @Override
        public List<String> getIds() {
            return Collections.singletonList(serviceId);
        }
    }

    /** A non-revenue working without any identifier. */
    public static final class Stabling extends Service {
        private static final long serialVersionUID = 1L;

        @Override
        public ServiceType getType() {
            return ServiceType.STABLING;
        }

        @Override
        public List<String> getIds() {
            return Collections.emptyList();
        }
    }

    /** A column carrying several identifiers, typically for date-restricted variants of the same working. */
    public static final class MultiIdentifier extends Service {
        private static final long serialVersionUID = 1L;
        public final List<String> serviceIds;

        public MultiIdentifier(List<String> serviceIds) {
            this.serviceIds = ImmutableList.copyOf(serviceIds);
        }

        @Override
        public ServiceType getType() {
            return ServiceType.MULTI_SERVICE;
        }

        @Override
        public List<String> getIds() {
            return serviceIds;
        }
    }
}
