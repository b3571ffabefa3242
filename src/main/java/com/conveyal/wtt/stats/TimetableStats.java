package com.conveyal.wtt.stats;

import com.conveyal.wtt.Timetable;
import com.conveyal.wtt.filter.Visibility;
import com.conveyal.wtt.model.Direction;
import com.conveyal.wtt.model.RakeLink;
import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.model.StationEvent;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Summary figures for a reconciled timetable as seen through one query.
 */
public class TimetableStats {

    private final Timetable timetable;
    private final Visibility visibility;
    /** Visible events by canonical station name. */
    private final ListMultimap<String, StationEvent> eventsAtStation = ArrayListMultimap.create();

    public TimetableStats(Timetable timetable, Visibility visibility) {
        this.timetable = timetable;
        this.visibility = visibility;
        for (Service service : timetable.getSequencedServices()) {
            for (StationEvent event : service.events) {
                if (visibility.isVisible(event)) eventsAtStation.put(event.getStationName(), event);
            }
        }
    }

    public Integer getServiceCount() {
        return timetable.getServices().size();
    }

    public Integer getServiceCount(Direction direction) {
        return timetable.getServices(direction).size();
    }

    public Integer getSequencedServiceCount() {
        return timetable.getSequencedServices().size();
    }

    public Integer getVisibleServiceCount() {
        return visibility.visibleServiceCount();
    }

    public Integer getVisibleAcServiceCount() {
        return (int) timetable.getSequencedServices().stream()
            .filter(s -> s.needsAcRake && visibility.isVisible(s))
            .count();
    }

    public Integer getLinkCount() {
        return timetable.getLinks().size();
    }

    public Integer getValidLinkCount() {
        return timetable.getValidLinks().size();
    }

    public Integer getConflictCount() {
        return timetable.getConflicts().size();
    }

    public Integer getVisibleLinkCount() {
        return visibility.visibleLinkCount();
    }

    /** @return up to n visible links with a non-zero length, shortest first. */
    public List<RakeLink> getShortestLinks(int n) {
        return visibleLinksByLength(Comparator.comparingDouble(l -> l.lengthKm), n);
    }

    /** @return up to n visible links with a non-zero length, longest first. */
    public List<RakeLink> getLongestLinks(int n) {
        return visibleLinksByLength(Comparator.<RakeLink>comparingDouble(l -> l.lengthKm).reversed(), n);
    }

    private List<RakeLink> visibleLinksByLength(Comparator<RakeLink> order, int n) {
        return timetable.getValidLinks().stream()
            .filter(l -> l.lengthKm > 0 && visibility.isVisible(l))
            .sorted(order)
            .limit(n)
            .collect(Collectors.toList());
    }

    /**
     * @return the sorted times of the visible events at a station, given under any of its labels.
     */
    public TIntList getEventTimes(String stationName) {
        TIntList times = new TIntArrayList();
        String name = timetable.getDirectory().canonicalize(stationName);
        for (StationEvent event : eventsAtStation.get(name)) times.add(event.time);
        times.sort();
        return times;
    }

    /**
     * Count the headway gaps at a station: consecutive visible events inside the window that are more than
     * thresholdMinutes apart.
     */
    public int countGaps(String stationName, int thresholdMinutes, int windowStart, int windowEnd) {
        TIntList times = getEventTimes(stationName);
        int gaps = 0;
        int previous = Integer.MIN_VALUE;
        for (int i = 0; i < times.size(); i++) {
            int time = times.get(i);
            if (time < windowStart || time > windowEnd) continue;
            if (previous != Integer.MIN_VALUE && time - previous > thresholdMinutes) gaps += 1;
            previous = time;
        }
        return gaps;
    }

}
