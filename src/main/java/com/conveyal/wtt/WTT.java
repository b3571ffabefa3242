package com.conveyal.wtt;

import com.conveyal.wtt.error.ConfigurationException;
import com.conveyal.wtt.error.ErrorStorage;
import com.conveyal.wtt.filter.FilterQuery;
import com.conveyal.wtt.filter.Visibility;
import com.conveyal.wtt.filter.VisibilityEvaluator;
import com.conveyal.wtt.loader.EventSequencer;
import com.conveyal.wtt.loader.ScheduleGrid;
import com.conveyal.wtt.loader.ServiceExtractor;
import com.conveyal.wtt.loader.StationDirectory;
import com.conveyal.wtt.loader.SummaryParser;
import com.conveyal.wtt.loader.SummaryTable;
import com.conveyal.wtt.model.Direction;
import com.conveyal.wtt.model.RakeLink;
import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.model.SummaryEntry;
import com.conveyal.wtt.stats.DiscrepancyReport;
import com.conveyal.wtt.validator.EventTimesValidator;
import com.conveyal.wtt.validator.RakeLinkReconciler;
import com.conveyal.wtt.validator.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.conveyal.wtt.util.Util.human;

/**
 * This is the public interface to wtt-lib. Other projects should only use the library through the methods in this
 * class and the data model objects in the model package.
 *
 * Reconciliation is a single synchronous pass: extract services from both grids, link them, check the summary
 * against the links, sequence the services of valid links and assign rakes. Queries are then evaluated against the
 * resulting timetable as often as needed.
 */
public abstract class WTT {

    private static final Logger LOG = LoggerFactory.getLogger(WTT.class);

    /**
     * Reconcile the two directions of a working timetable with its rake-link summary.
     *
     * @throws ConfigurationException if no station directory is supplied. Problems in the grids or the summary never
     * throw, they end up in the timetable's errors and conflicts.
     */
    public static Timetable reconcile (ScheduleGrid upGrid, ScheduleGrid downGrid, SummaryTable summary,
                                       StationDirectory directory) {
        return reconcile(upGrid, downGrid, new SummaryParser().parse(summary), directory);
    }

    public static Timetable reconcile (ScheduleGrid upGrid, ScheduleGrid downGrid, List<SummaryEntry> entries,
                                       StationDirectory directory) {
        if (directory == null) {
            throw new ConfigurationException("A station directory is required before extraction can start.", "null");
        }
        if (upGrid.direction != Direction.UP || downGrid.direction != Direction.DOWN) {
            throw new IllegalArgumentException("Grids must be supplied as UP then DOWN.");
        }
        long startTime = System.currentTimeMillis();
        ErrorStorage errorStorage = new ErrorStorage();

        ServiceExtractor extractor = new ServiceExtractor(directory, errorStorage);
        List<Service> services = new ArrayList<>();
        services.addAll(extractor.extractServices(upGrid));
        services.addAll(extractor.extractServices(downGrid));
        for (int i = 0; i < services.size(); i++) services.get(i).index = i;
        LOG.info("Extracted {} services in total.", human(services.size()));

        LinkageGraph graph = new LinkageGraph(services, errorStorage);
        Map<Direction, ScheduleGrid> grids = new EnumMap<>(Direction.class);
        grids.put(Direction.UP, upGrid);
        grids.put(Direction.DOWN, downGrid);
        RakeLinkReconciler reconciler =
            new RakeLinkReconciler(graph, new EventSequencer(directory, errorStorage), grids, errorStorage);
        List<RakeLink> links = reconciler.reconcile(entries);
        new RakeAssigner().assignRakes(links);

        EventTimesValidator eventTimesValidator = new EventTimesValidator(errorStorage);
        for (Service service : services) {
            if (service.hasEvents()) eventTimesValidator.validateService(service);
        }

        ValidationResult result = new ValidationResult();
        result.chainCount = graph.getChains().size();
        reconciler.complete(result);
        eventTimesValidator.complete(result);
        for (Service service : services) {
            result.serviceCount += 1;
            if (service.direction == Direction.UP) result.upServiceCount += 1;
            else result.downServiceCount += 1;
            if (service.hasEvents()) result.sequencedServiceCount += 1;
        }
        for (RakeLink link : links) {
            if (!link.undefinedIds.isEmpty()) result.undefinedIds.put(link.linkName, new ArrayList<>(link.undefinedIds));
            if (link.isValid()) result.totalValidLinkLengthKm += link.lengthKm;
        }
        result.errorCount = errorStorage.getErrorCount();
        result.errorCountsByType.putAll(errorStorage.getErrorCountsByType());
        result.validationTime = System.currentTimeMillis() - startTime;
        LOG.info("Reconciliation finished in {} ms with {} errors.", result.validationTime, result.errorCount);

        return new Timetable(directory, services, links, reconciler.getConflicts(), errorStorage.getErrors(), result);
    }

    /**
     * Evaluate a query against a timetable. Safe to call from several threads on the same timetable.
     */
    public static Visibility evaluate (Timetable timetable, FilterQuery query) {
        return new VisibilityEvaluator(timetable).evaluate(query);
    }

    /**
     * Plain text listing of the conflicts, the links visible under the query and the services passing through the
     * queried stations.
     */
    public static String discrepancyReport (Timetable timetable, FilterQuery query) {
        return new DiscrepancyReport(timetable, query, evaluate(timetable, query)).write();
    }

}
