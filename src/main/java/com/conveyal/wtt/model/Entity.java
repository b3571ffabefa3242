package com.conveyal.wtt.model;

import java.io.Serializable;

/**
 * Base class for everything parsed out of a working timetable (WTT) or its rake-link summary.
 */
public abstract class Entity implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Marks an integer field that was not present in the source cells. */
    public static final int INT_MISSING = Integer.MIN_VALUE;

    /**
     * @return the identifier used to refer to this entity in errors and reports. Not necessarily unique.
     */
    public abstract String getId();

}
