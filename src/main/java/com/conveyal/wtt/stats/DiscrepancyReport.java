package com.conveyal.wtt.stats;

import com.conveyal.wtt.Timetable;
import com.conveyal.wtt.filter.FilterQuery;
import com.conveyal.wtt.filter.Visibility;
import com.conveyal.wtt.loader.TimeCodec;
import com.conveyal.wtt.model.LinkConflict;
import com.conveyal.wtt.model.RakeLink;
import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.model.StationEvent;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Plain text report for people checking a timetable: where the summary and the grid disagree, which links are shown
 * for a query, and when the visible services pass the queried stations.
 */
public class DiscrepancyReport {

    private final Timetable timetable;
    private final FilterQuery query;
    private final Visibility visibility;

    public DiscrepancyReport(Timetable timetable, FilterQuery query, Visibility visibility) {
        this.timetable = timetable;
        this.query = query;
        this.visibility = visibility;
    }

    public String write () {
        StringBuilder sb = new StringBuilder();
        sb.append("Rake-link conflicts: ").append(timetable.getConflicts().size()).append('\n');
        for (LinkConflict conflict : timetable.getConflicts()) {
            sb.append("  ").append(conflict.linkName).append('\n');
            sb.append("    summary: ").append(StringUtils.join(conflict.declaredIds, " ")).append('\n');
            sb.append("    wtt:     ").append(StringUtils.join(conflict.derivedIds, " ")).append('\n');
        }
        sb.append("Undefined services:\n");
        for (RakeLink link : timetable.getLinks()) {
            if (link.undefinedIds.isEmpty()) continue;
            sb.append("  ").append(link.linkName).append(": ")
                .append(StringUtils.join(link.undefinedIds, " ")).append('\n');
        }
        sb.append("Visible rake-links: ").append(visibility.visibleLinkCount()).append('\n');
        for (RakeLink link : timetable.getValidLinks()) {
            if (!visibility.isVisible(link)) continue;
            sb.append(String.format("  %-3s %-24s %6.1f km  %s -> %s%n", link.linkName, link.rake,
                link.lengthKm, link.firstStation().name, link.lastStation().name));
        }
        for (String stationLabel : query.passingThrough) {
            String stationName = timetable.getDirectory().canonicalize(stationLabel);
            sb.append("Passing through ").append(stationName).append(":\n");
            for (PassingTime passing : passingTimes(stationName)) {
                sb.append(String.format("  %s %-6s %-5s %s%n", TimeCodec.format(passing.time),
                    passing.service.getId(), passing.service.direction,
                    passing.link == null ? "" : passing.link.linkName));
            }
        }
        return sb.toString();
    }

    /** Visible services calling at the station, ordered by their last visible time there. */
    private List<PassingTime> passingTimes (String stationName) {
        List<PassingTime> passingTimes = new ArrayList<>();
        for (Service service : timetable.getSequencedServices()) {
            if (!visibility.isVisible(service)) continue;
            int last = TimeCodec.NOT_A_TIME;
            for (StationEvent event : service.events) {
                if (event.getStationName().equals(stationName) && visibility.isVisible(event)) last = event.time;
            }
            if (last != TimeCodec.NOT_A_TIME) {
                passingTimes.add(new PassingTime(service, timetable.getLinkFor(service), last));
            }
        }
        passingTimes.sort(Comparator.comparingInt(p -> p.time));
        return passingTimes;
    }

    private static class PassingTime {
        final Service service;
        final RakeLink link;
        final int time;

        PassingTime(Service service, RakeLink link, int time) {
            this.service = service;
            this.link = link;
            this.time = time;
        }
    }

}
