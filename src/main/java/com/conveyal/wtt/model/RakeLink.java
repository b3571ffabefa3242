package com.conveyal.wtt.model;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rake-link (rake cycle): the ordered services one rake performs during a day, named in the summary ("A", "AK").
 *
 * The service path refers to services held by the timetable; services are never duplicated. It is assigned once,
 * after which length and end stations can be derived.
 */
public class RakeLink extends Entity {

    private static final long serialVersionUID = 1L;

    public final String linkName;
    /** Identifier sequence declared in the summary. */
    public final List<String> declaredIds;
    public final List<Line> lines;
    /** Declared identifiers that match no service in the grid. */
    public final List<String> undefinedIds = new ArrayList<>();
    /** Trailing placeholder identifiers accepted without a matching service on the path. */
    public final List<String> toleratedIds = new ArrayList<>();

    public RakeLinkStatus status = RakeLinkStatus.VALID;
    public Rake rake;
    public double lengthKm;

    private List<Service> servicePath;

    public RakeLink(SummaryEntry entry) {
        this.linkName = entry.linkName;
        this.declaredIds = entry.serviceIds;
        this.lines = entry.lines;
    }

    @Override
    public String getId() {
        return linkName;
    }

    public List<Service> getServicePath() {
        return servicePath == null ? Collections.emptyList() : servicePath;
    }

    public void setServicePath(List<Service> path) {
        if (servicePath != null) {
            throw new IllegalStateException("Service path of link " + linkName + " has already been assigned.");
        }
        servicePath = ImmutableList.copyOf(path);
    }

    public boolean isValid() {
        return status == RakeLinkStatus.VALID;
    }

    /** A link can only be drawn if it has services, and those services have events. */
    public boolean isRenderable() {
        return servicePath != null && !servicePath.isEmpty() && servicePath.get(0).hasEvents();
    }

    public Station firstStation() {
        if (!isRenderable()) return null;
        return servicePath.get(0).firstEvent().station;
    }

    public Station lastStation() {
        if (!isRenderable()) return null;
        return servicePath.get(servicePath.size() - 1).lastEvent().station;
    }

    /** Sum of the lengths of the services on the path, in path order. */
    public double computeLengthKm() {
        double length = 0;
        for (Service service : getServicePath()) {
            length += service.computeLengthKm();
        }
        return length;
    }

    /**
     * Copy this link onto the supplied path, which must contain copies of this link's services in the same order.
     */
    public RakeLink copyOnto(List<Service> copiedPath) {
        RakeLink copy = new RakeLink(new SummaryEntry(linkName, declaredIds, lines));
        copy.undefinedIds.addAll(undefinedIds);
        copy.toleratedIds.addAll(toleratedIds);
        copy.status = status;
        copy.lengthKm = lengthKm;
        copy.rake = rake == null ? null : rake.copy();
        if (servicePath != null) copy.setServicePath(copiedPath);
        return copy;
    }

    @Override
    public String toString() {
        String start = isRenderable() ? firstStation().name : "?";
        String end = isRenderable() ? lastStation().name : "?";
        return String.format("<RakeLink %s (%d services, %.1fKm) %s->%s>",
            linkName, getServicePath().size(), lengthKm, start, end);
    }
}
