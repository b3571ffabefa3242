package com.conveyal.wtt.model;

import java.io.Serializable;

/**
 * A physical train set. One rake is created for each valid rake-link.
 */
public class Rake implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Car count used when no service on the link says otherwise. */
    public static final int DEFAULT_CAR_COUNT = 15;

    public final int rakeId;
    public boolean ac;
    public int carCount = DEFAULT_CAR_COUNT;

    public Rake(int rakeId) {
        this.rakeId = rakeId;
    }

    public Rake copy() {
        Rake copy = new Rake(rakeId);
        copy.ac = ac;
        copy.carCount = carCount;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("<Rake %d (%s, %d-car)>", rakeId, ac ? "AC" : "NON-AC", carCount);
    }
}
