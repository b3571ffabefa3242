package com.conveyal.wtt;

import com.conveyal.wtt.error.NewWTTError;
import com.conveyal.wtt.loader.StationDirectory;
import com.conveyal.wtt.model.Direction;
import com.conveyal.wtt.model.LinkConflict;
import com.conveyal.wtt.model.RakeLink;
import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.validator.ValidationResult;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The result of reconciling a working timetable with its rake-link summary: every extracted service, every declared
 * rake-link whatever its status, the conflicts between the two sources and the errors found along the way.
 *
 * A timetable is not modified once built. Operations that change it, such as {@link #convertToAc(Collection)},
 * return a new timetable and leave this one as it was.
 */
public class Timetable {

    private static final Logger LOG = LoggerFactory.getLogger(Timetable.class);

    private final StationDirectory directory;
    private final List<Service> services;
    private final List<RakeLink> links;
    private final List<LinkConflict> conflicts;
    private final List<NewWTTError> errors;
    private final ValidationResult validationResult;
    private final Map<Integer, RakeLink> linkForService = new HashMap<>();

    public Timetable(StationDirectory directory, List<Service> services, List<RakeLink> links,
                     List<LinkConflict> conflicts, List<NewWTTError> errors, ValidationResult validationResult) {
        this.directory = directory;
        this.services = ImmutableList.copyOf(services);
        this.links = ImmutableList.copyOf(links);
        this.conflicts = ImmutableList.copyOf(conflicts);
        this.errors = ImmutableList.copyOf(errors);
        this.validationResult = validationResult;
        for (RakeLink link : links) {
            for (Service service : link.getServicePath()) linkForService.put(service.index, link);
        }
    }

    public StationDirectory getDirectory () {
        return directory;
    }

    public List<Service> getServices () {
        return services;
    }

    public List<Service> getServices (Direction direction) {
        return services.stream().filter(s -> s.direction == direction).collect(Collectors.toList());
    }

    public Service getService (int index) {
        return services.get(index);
    }

    /** @return the services placed on a valid rake-link, the only ones carrying events. */
    public List<Service> getSequencedServices () {
        return services.stream().filter(Service::hasEvents).collect(Collectors.toList());
    }

    /** @return every declared rake-link in declaration order, including invalid and conflicting ones. */
    public List<RakeLink> getLinks () {
        return links;
    }

    public List<RakeLink> getValidLinks () {
        return links.stream().filter(RakeLink::isValid).collect(Collectors.toList());
    }

    /** @return the first link declared under the given name, or null. */
    public RakeLink getLink (String linkName) {
        for (RakeLink link : links) {
            if (link.linkName.equals(linkName)) return link;
        }
        return null;
    }

    /** @return the valid link performing the given service, or null. */
    public RakeLink getLinkFor (Service service) {
        return linkForService.get(service.index);
    }

    public List<LinkConflict> getConflicts () {
        return conflicts;
    }

    public List<NewWTTError> getErrors () {
        return errors;
    }

    public ValidationResult getValidationResult () {
        return validationResult;
    }

    /**
     * Make the named valid links run with AC rakes. Links whose rake is already AC are left alone.
     *
     * @return a copy of this timetable with the conversion applied, and the names of the links that were converted.
     */
    public AcConversion convertToAc (Collection<String> linkNames) {
        List<Service> serviceCopies = new ArrayList<>(services.size());
        for (Service service : services) serviceCopies.add(service.clone());
        List<RakeLink> linkCopies = new ArrayList<>(links.size());
        List<String> converted = new ArrayList<>();
        for (RakeLink link : links) {
            List<Service> copiedPath = link.getServicePath().stream()
                .map(s -> serviceCopies.get(s.index))
                .collect(Collectors.toList());
            RakeLink copy = link.copyOnto(copiedPath);
            linkCopies.add(copy);
            if (!copy.isValid() || !linkNames.contains(copy.linkName) || copy.rake == null || copy.rake.ac) continue;
            copy.rake.ac = true;
            for (Service service : copiedPath) service.needsAcRake = true;
            converted.add(copy.linkName);
        }
        LOG.info("Converted {} of {} requested links to AC.", converted.size(), linkNames.size());
        Timetable timetable = new Timetable(directory, serviceCopies, linkCopies, conflicts, errors, validationResult);
        return new AcConversion(timetable, converted);
    }

    /** The outcome of {@link #convertToAc(Collection)}. */
    public static class AcConversion {
        public final Timetable timetable;
        public final List<String> convertedLinks;

        AcConversion(Timetable timetable, List<String> convertedLinks) {
            this.timetable = timetable;
            this.convertedLinks = ImmutableList.copyOf(convertedLinks);
        }
    }

}
