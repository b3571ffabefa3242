package com.conveyal.wtt.model;

/**
 * The kind of working a grid column describes, determined by how many identifiers appear in its header.
 */
public enum ServiceType {
    /** Exactly one identifier. */
    REGULAR,
    /** No identifier: a non-revenue movement such as an empty stock working. */
    STABLING,
    /** More than one identifier, usually workings that only run on some dates. */
    MULTI_SERVICE
}
