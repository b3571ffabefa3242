package com.conveyal.wtt.filter;

import com.conveyal.wtt.model.RakeLink;
import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.model.StationEvent;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The outcome of evaluating one query: which services, rake-links and station events are visible. The timetable
 * itself carries no visibility state, so any number of queries can be evaluated against it concurrently.
 *
 * A link is visible iff at least one of its services is. An event is visible iff its service is and it was not
 * hidden on its own.
 */
public final class Visibility {

    private final ImmutableSet<Integer> visibleServices;
    private final ImmutableSet<String> visibleLinks;
    private final ImmutableSet<StationEvent> hiddenEvents;

    private Visibility(Builder builder) {
        this.visibleServices = ImmutableSet.copyOf(builder.visibleServices);
        Set<String> links = new HashSet<>();
        for (Map.Entry<String, List<Integer>> entry : builder.servicesOfLink.entrySet()) {
            for (int index : entry.getValue()) {
                if (visibleServices.contains(index)) {
                    links.add(entry.getKey());
                    break;
                }
            }
        }
        this.visibleLinks = ImmutableSet.copyOf(links);
        this.hiddenEvents = ImmutableSet.copyOf(builder.hiddenEvents);
    }

    public boolean isVisible (Service service) {
        return visibleServices.contains(service.index);
    }

    public boolean isVisible (RakeLink link) {
        return visibleLinks.contains(link.linkName);
    }

    public boolean isVisible (StationEvent event) {
        return visibleServices.contains(event.serviceIndex) && !hiddenEvents.contains(event);
    }

    public Set<Integer> getVisibleServiceIndexes () {
        return visibleServices;
    }

    public Set<String> getVisibleLinkNames () {
        return visibleLinks;
    }

    public int visibleServiceCount () {
        return visibleServices.size();
    }

    public int visibleLinkCount () {
        return visibleLinks.size();
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Visibility that = (Visibility) o;
        return visibleServices.equals(that.visibleServices) &&
            visibleLinks.equals(that.visibleLinks) &&
            hiddenEvents.equals(that.hiddenEvents);
    }

    @Override
    public int hashCode () {
        return Objects.hash(visibleServices, visibleLinks, hiddenEvents);
    }

    @Override
    public String toString () {
        return String.format("Visibility: %d services, %d links, %d hidden events", visibleServices.size(),
            visibleLinks.size(), hiddenEvents.size());
    }

    /**
     * Starts from everything that can be shown (services with events, renderable links) and only ever hides. Once
     * hidden, nothing can be made visible again.
     */
    public static class Builder {
        private final Set<Integer> visibleServices = new HashSet<>();
        private final Map<String, List<Integer>> servicesOfLink = new LinkedHashMap<>();
        private final Set<StationEvent> hiddenEvents = new HashSet<>();

        public Builder(Iterable<Service> services, Iterable<RakeLink> links) {
            for (Service service : services) {
                if (service.hasEvents()) visibleServices.add(service.index);
            }
            for (RakeLink link : links) {
                if (!link.isRenderable()) continue;
                List<Integer> indexes = new ArrayList<>();
                for (Service service : link.getServicePath()) indexes.add(service.index);
                servicesOfLink.put(link.linkName, indexes);
            }
        }

        public boolean isVisible (Service service) {
            return visibleServices.contains(service.index);
        }

        public Builder hideService (Service service) {
            visibleServices.remove(service.index);
            return this;
        }

        /** Hide a link by hiding every one of its services. */
        public Builder hideLink (RakeLink link) {
            for (Service service : link.getServicePath()) hideService(service);
            return this;
        }

        public Builder hideEvent (StationEvent event) {
            hiddenEvents.add(event);
            return this;
        }

        public Visibility build () {
            return new Visibility(this);
        }
    }

}
