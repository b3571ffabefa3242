package com.conveyal.wtt.filter;

import com.conveyal.wtt.Timetable;
import com.conveyal.wtt.filter.conditions.AcCondition;
import com.conveyal.wtt.filter.conditions.DirectionCondition;
import com.conveyal.wtt.filter.conditions.EndStationCondition;
import com.conveyal.wtt.filter.conditions.LinkCondition;
import com.conveyal.wtt.filter.conditions.LinkPassingThroughCondition;
import com.conveyal.wtt.filter.conditions.PassingThroughCondition;
import com.conveyal.wtt.filter.conditions.RakeAcCondition;
import com.conveyal.wtt.filter.conditions.ServiceCondition;
import com.conveyal.wtt.filter.conditions.StartStationCondition;
import com.conveyal.wtt.filter.conditions.TerminalStationsCondition;
import com.conveyal.wtt.loader.StationDirectory;
import com.conveyal.wtt.model.RakeLink;
import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.model.StationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Evaluates queries against a reconciled timetable. The evaluator holds no per-query state and never touches the
 * timetable, so one instance can serve concurrent queries and evaluating the same query twice gives equal results.
 */
public class VisibilityEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(VisibilityEvaluator.class);

    private final Timetable timetable;

    public VisibilityEvaluator(Timetable timetable) {
        this.timetable = timetable;
    }

    public Visibility evaluate (FilterQuery query) {
        Visibility.Builder builder = new Visibility.Builder(timetable.getServices(), timetable.getLinks());
        switch (query.type) {
            case RAKELINK:
                applyLinkConditions(builder, query);
                break;
            case STATION:
                applyStationConditions(builder, query);
                break;
            default:
                applyServiceConditions(builder, serviceConditions(query));
        }
        applySelections(builder, query);
        Visibility visibility = builder.build();
        LOG.debug("{} -> {}", query, visibility);
        return visibility;
    }

    /** Every condition the query sets, in the order they are checked. */
    List<ServiceCondition> serviceConditions (FilterQuery query) {
        List<ServiceCondition> conditions = new ArrayList<>();
        if (!query.directions.isEmpty()) conditions.add(new DirectionCondition(query.directions));
        if (query.ac != AcFilter.ALL) conditions.add(new AcCondition(query.ac));
        String start = canonicalize(query.startStation);
        if (start != null) conditions.add(new StartStationCondition(start, query.windowStart, query.windowEnd));
        String end = canonicalize(query.endStation);
        if (end != null) conditions.add(new EndStationCondition(end, query.windowStart, query.windowEnd));
        List<String> passing = canonicalize(query.passingThrough);
        if (!passing.isEmpty()) {
            conditions.add(new PassingThroughCondition(passing, query.windowStart, query.windowEnd));
        }
        return conditions;
    }

    private void applyServiceConditions (Visibility.Builder builder, List<ServiceCondition> conditions) {
        for (Service service : timetable.getSequencedServices()) {
            for (ServiceCondition condition : conditions) {
                if (!condition.passes(service)) {
                    builder.hideService(service);
                    break;
                }
            }
        }
    }

    /**
     * Events outside the window are hidden one by one. Services themselves are only filtered on their AC requirement.
     */
    private void applyStationConditions (Visibility.Builder builder, FilterQuery query) {
        for (Service service : timetable.getSequencedServices()) {
            for (StationEvent event : service.events) {
                if (!query.inWindow(event.time)) builder.hideEvent(event);
            }
        }
        if (query.ac != AcFilter.ALL) {
            List<ServiceCondition> conditions = new ArrayList<>();
            conditions.add(new AcCondition(query.ac));
            applyServiceConditions(builder, conditions);
        }
    }

    private void applyLinkConditions (Visibility.Builder builder, FilterQuery query) {
        List<LinkCondition> conditions = new ArrayList<>();
        String start = canonicalize(query.startStation);
        String end = canonicalize(query.endStation);
        if (start != null || end != null) conditions.add(new TerminalStationsCondition(start, end));
        List<String> passing = canonicalize(query.passingThrough);
        if (!passing.isEmpty()) {
            conditions.add(new LinkPassingThroughCondition(passing, query.windowStart, query.windowEnd));
        }
        if (query.ac != AcFilter.ALL) conditions.add(new RakeAcCondition(query.ac));

        for (RakeLink link : timetable.getLinks()) {
            if (!link.isRenderable()) continue;
            for (LinkCondition condition : conditions) {
                if (!condition.passes(link)) {
                    builder.hideLink(link);
                    break;
                }
            }
        }
    }

    private void applySelections (Visibility.Builder builder, FilterQuery query) {
        if (!query.selectedServices.isEmpty()) {
            for (Service service : timetable.getSequencedServices()) {
                if (service.getIds().stream().noneMatch(query.selectedServices::contains)) {
                    builder.hideService(service);
                }
            }
        }
        if (!query.selectedLinks.isEmpty()) {
            for (RakeLink link : timetable.getLinks()) {
                if (!query.selectedLinks.contains(link.linkName)) builder.hideLink(link);
            }
        }
    }

    private String canonicalize (String stationName) {
        return directory().canonicalize(stationName);
    }

    private List<String> canonicalize (List<String> stationNames) {
        return stationNames.stream()
            .map(this::canonicalize)
            .filter(name -> name != null)
            .collect(Collectors.toList());
    }

    private StationDirectory directory () {
        return timetable.getDirectory();
    }

}
