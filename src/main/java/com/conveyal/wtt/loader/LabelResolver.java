package com.conveyal.wtt.loader;

import com.conveyal.wtt.model.Station;

/**
 * Associates grid rows with stations. Times are often written on a row below the station label (departure rows,
 * wrapped labels), so a blank label is looked up on the rows above, at most {@link #MAX_LOOKBACK} rows up.
 */
public class LabelResolver {

    public static final int MAX_LOOKBACK = 2;

    /** Label of the row carrying the departure time at a terminal reversal, and the next working's identifier. */
    public static final String REVERSED_AS_LABEL = "Reversed as";

    private final StationDirectory directory;

    public LabelResolver(StationDirectory directory) {
        this.directory = directory;
    }

    /**
     * @return the nearest non-blank station label at or above the given row, or null.
     */
    public String labelFor (ScheduleGrid grid, int row) {
        for (int r = row; r >= 0 && r >= row - MAX_LOOKBACK; r--) {
            String label = grid.stationLabel(r);
            if (!label.isEmpty()) return label;
        }
        return null;
    }

    /**
     * @return the station named by the label for the given row, or null if the label is blank or unknown.
     */
    public Station stationFor (ScheduleGrid grid, int row) {
        return directory.resolve(labelFor(grid, row));
    }

    public static boolean isReversedLabel (String label) {
        return label != null && label.toUpperCase().contains("REVERSED");
    }

}
