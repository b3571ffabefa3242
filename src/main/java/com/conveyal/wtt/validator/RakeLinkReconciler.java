package com.conveyal.wtt.validator;

import com.conveyal.wtt.LinkageGraph;
import com.conveyal.wtt.error.ErrorStorage;
import com.conveyal.wtt.error.NewWTTError;
import com.conveyal.wtt.error.NewWTTErrorType;
import com.conveyal.wtt.loader.EventSequencer;
import com.conveyal.wtt.loader.ScheduleGrid;
import com.conveyal.wtt.loader.ServiceExtractor;
import com.conveyal.wtt.model.Direction;
import com.conveyal.wtt.model.LinkConflict;
import com.conveyal.wtt.model.RakeLink;
import com.conveyal.wtt.model.RakeLinkStatus;
import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.model.StationEvent;
import com.conveyal.wtt.model.SummaryEntry;
import gnu.trove.list.TIntList;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Cross-checks the rake-links declared in the summary against the chains of services derived from the grid.
 *
 * For each declared link, in order:
 * <ol>
 *     <li>A declared identifier that no service carries makes the link INVALID. Nothing else is checked.</li>
 *     <li>If the first declared identifier is the successor of some other service, the first service is not a chain
 *     start and the grid cannot be followed. The declared sequence is trusted and the path is looked up identifier
 *     by identifier.</li>
 *     <li>Otherwise the chain starting at the first declared service must carry the declared identifiers in order.
 *     Up to {@link #MAX_TOLERATED_PLACEHOLDERS} trailing declared entries may be missing from the chain if they are
 *     all empty-movement placeholders. Any other difference makes the link CONFLICTING.</li>
 *     <li>Every service on the path is sequenced. A service already on another link, or one without events, takes
 *     the whole link out of the active set.</li>
 * </ol>
 * Services only receive events, end stations and lengths once their whole link is known to be valid.
 */
public class RakeLinkReconciler extends Validator {

    private static final Logger LOG = LoggerFactory.getLogger(RakeLinkReconciler.class);

    public static final int MAX_TOLERATED_PLACEHOLDERS = 2;

    private static final int MISMATCH = -1;

    private final LinkageGraph graph;
    private final EventSequencer sequencer;
    private final Map<Direction, ScheduleGrid> grids;

    private final List<RakeLink> links = new ArrayList<>();
    private final List<LinkConflict> conflicts = new ArrayList<>();
    /** Link name for every service already placed on a valid link. */
    private final TIntObjectMap<String> linkForService = new TIntObjectHashMap<>();

    public RakeLinkReconciler(LinkageGraph graph, EventSequencer sequencer, Map<Direction, ScheduleGrid> grids,
                              ErrorStorage errorStorage) {
        super(errorStorage);
        this.graph = graph;
        this.sequencer = sequencer;
        this.grids = grids;
    }

    /**
     * Reconcile every declared link. Links are returned in declaration order, whatever their status.
     */
    public List<RakeLink> reconcile (List<SummaryEntry> entries) {
        for (SummaryEntry entry : entries) {
            RakeLink link = new RakeLink(entry);
            reconcileLink(link);
            links.add(link);
        }
        long valid = links.stream().filter(RakeLink::isValid).count();
        LOG.info("Reconciled {} rake-links: {} valid, {} conflicting.", links.size(), valid, conflicts.size());
        return Collections.unmodifiableList(links);
    }

    private void reconcileLink (RakeLink link) {
        if (link.declaredIds.isEmpty()) {
            registerError(link, NewWTTErrorType.LINK_WITHOUT_SERVICES);
            link.status = RakeLinkStatus.INVALID;
            return;
        }
        for (String id : link.declaredIds) {
            if (graph.indexOf(id) < 0) {
                link.undefinedIds.add(id);
                registerError(link, NewWTTErrorType.UNDEFINED_SERVICE_ID, id);
            }
        }
        if (!link.undefinedIds.isEmpty()) {
            LOG.debug("Services {} are not defined in the grid. Discarding link {}.", link.undefinedIds, link.linkName);
            link.status = RakeLinkStatus.INVALID;
            return;
        }

        String firstId = link.declaredIds.get(0);
        int first = graph.indexOf(firstId);
        List<Service> path;
        if (graph.isSuccessorOfAnother(firstId)) {
            LOG.debug("Service {} is reversed into by another service, trusting the summary for link {}.",
                firstId, link.linkName);
            path = new ArrayList<>();
            for (String id : link.declaredIds) {
                path.add(graph.getService(graph.indexOf(id)));
            }
        } else {
            TIntList chain = graph.chainFrom(first);
            List<Service> chainServices = chain == null
                ? Collections.singletonList(graph.getService(first))
                : graph.servicesOf(chain);
            int tolerated = countToleratedPlaceholders(link.declaredIds, chainServices);
            if (tolerated == MISMATCH) {
                recordConflict(link, chainServices, NewWTTErrorType.LINK_SEQUENCE_MISMATCH);
                return;
            }
            int matched = link.declaredIds.size() - tolerated;
            link.toleratedIds.addAll(link.declaredIds.subList(matched, link.declaredIds.size()));
            path = chainServices;
        }

        for (Service service : path) {
            String owner = linkForService.get(service.index);
            if (owner != null || Collections.frequency(path, service) > 1) {
                LOG.warn("Service {} of link {} is already performed by link {}.", service.getId(), link.linkName,
                    owner == null ? link.linkName : owner);
                recordConflict(link, path, NewWTTErrorType.SERVICE_ALREADY_ASSIGNED);
                return;
            }
        }

        // Sequence everything first so that an invalid link leaves its services untouched.
        Map<Service, List<StationEvent>> eventsForService = new HashMap<>();
        for (Service service : path) {
            List<StationEvent> events = sequencer.sequence(service, grids.get(service.direction));
            if (events.isEmpty()) {
                registerError(NewWTTError.forEntity(service, NewWTTErrorType.SERVICE_WITHOUT_EVENTS)
                    .addInfo("link", link.linkName));
                link.status = RakeLinkStatus.INVALID;
                return;
            }
            eventsForService.put(service, events);
        }
        for (Service service : path) {
            service.events = eventsForService.get(service);
            service.initStation = service.firstEvent().station;
            service.finalStation = service.lastEvent().station;
            service.lengthKm = service.computeLengthKm();
            linkForService.put(service.index, link.linkName);
        }
        link.setServicePath(path);
        link.lengthKm = link.computeLengthKm();
        link.status = RakeLinkStatus.VALID;
        LOG.debug("Length of {} = {} km", link.linkName, link.lengthKm);
    }

    private void recordConflict (RakeLink link, List<Service> derived, NewWTTErrorType errorType) {
        List<String> derivedIds = derived.stream().map(Service::getId).collect(Collectors.toList());
        LinkConflict conflict = new LinkConflict(link.linkName, link.declaredIds, derivedIds);
        conflicts.add(conflict);
        registerError(NewWTTError.forEntity(link, errorType)
            .setBadValue(StringUtils.join(derivedIds, " "))
            .addInfo("declared", StringUtils.join(link.declaredIds, " ")));
        link.status = RakeLinkStatus.CONFLICTING;
        LOG.warn("Unable to match rake-link {} to the grid. {}", link.linkName, conflict);
    }

    /**
     * Compare a declared identifier sequence with a derived chain of services.
     *
     * @return the number of trailing declared placeholders the chain does not contain (0 for an exact match), or -1
     * if the two do not match within tolerance. A mix of placeholders and real identifiers in the unmatched tail is
     * a mismatch.
     */
    public static int countToleratedPlaceholders (List<String> declaredIds, List<Service> chain) {
        for (int tolerated = 0; tolerated <= MAX_TOLERATED_PLACEHOLDERS; tolerated++) {
            int matched = declaredIds.size() - tolerated;
            if (matched != chain.size()) continue;
            for (int i = 0; i < matched; i++) {
                if (!chain.get(i).carries(declaredIds.get(i))) return MISMATCH;
            }
            for (int i = matched; i < declaredIds.size(); i++) {
                if (!ServiceExtractor.isPlaceholder(declaredIds.get(i))) return MISMATCH;
            }
            return tolerated;
        }
        return MISMATCH;
    }

    public List<LinkConflict> getConflicts () {
        return Collections.unmodifiableList(conflicts);
    }

    @Override
    public void complete (ValidationResult validationResult) {
        validationResult.linkCount = links.size();
        for (RakeLink link : links) {
            switch (link.status) {
                case VALID: validationResult.validLinkCount += 1; break;
                case INVALID: validationResult.invalidLinkCount += 1; break;
                case CONFLICTING: validationResult.conflictingLinkCount += 1; break;
            }
        }
        validationResult.conflicts.addAll(conflicts);
    }

}
