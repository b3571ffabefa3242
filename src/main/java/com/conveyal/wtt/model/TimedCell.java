package com.conveyal.wtt.model;

import java.io.Serializable;

/**
 * A cell of a service column whose text matched the clock pattern, with the grid row it was found on.
 */
public class TimedCell implements Serializable {

    private static final long serialVersionUID = 1L;

    public final int row;
    public final String text;

    public TimedCell(int row, String text) {
        this.row = row;
        this.text = text;
    }

    @Override
    public String toString() {
        return row + ":" + text;
    }
}
