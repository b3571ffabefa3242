package com.conveyal.wtt.filter;

/**
 * What a query is about: whole rake-links, individual services, or the events at stations.
 */
public enum FilterType {
    RAKELINK,
    SERVICE,
    STATION
}
