package com.conveyal.wtt.loader;

import com.conveyal.wtt.model.Direction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One direction of a working timetable as a rectangular table of cell text. Column 0 holds the station labels,
 * column 1 the arrival/departure indicators ("A" / "D") and every further column describes one working. The first
 * {@link #HEADER_ROWS} rows of a column form its header (identifiers, car count, AC remarks).
 *
 * Missing cells read as the empty string. A grid never changes after construction.
 */
public class ScheduleGrid {

    public static final int STATION_COLUMN = 0;
    public static final int INDICATOR_COLUMN = 1;
    public static final int FIRST_SERVICE_COLUMN = 2;
    public static final int HEADER_ROWS = 6;

    public final Direction direction;
    private final List<List<String>> rows;
    private final int columnCount;

    public ScheduleGrid(Direction direction, List<List<String>> rows) {
        this.direction = direction;
        List<List<String>> copy = new ArrayList<>(rows.size());
        int widest = 0;
        for (List<String> row : rows) {
            List<String> cells = new ArrayList<>(row.size());
            for (String cell : row) cells.add(cell == null ? "" : cell);
            copy.add(Collections.unmodifiableList(cells));
            widest = Math.max(widest, cells.size());
        }
        this.rows = Collections.unmodifiableList(copy);
        this.columnCount = widest;
    }

    /** Convenience constructor for grids written out as arrays, mostly in tests. */
    public static ScheduleGrid of (Direction direction, String[][] cells) {
        List<List<String>> rows = new ArrayList<>(cells.length);
        for (String[] row : cells) {
            List<String> list = new ArrayList<>(row.length);
            Collections.addAll(list, row);
            rows.add(list);
        }
        return new ScheduleGrid(direction, rows);
    }

    public int rowCount () {
        return rows.size();
    }

    public int columnCount () {
        return columnCount;
    }

    /** @return the trimmed text of a cell, or the empty string outside the grid. */
    public String cell (int row, int column) {
        if (row < 0 || row >= rows.size()) return "";
        List<String> cells = rows.get(row);
        if (column < 0 || column >= cells.size()) return "";
        return cells.get(column).trim();
    }

    public boolean isBlank (int row, int column) {
        return cell(row, column).isEmpty();
    }

    public String stationLabel (int row) {
        return cell(row, STATION_COLUMN);
    }

    /** @return the arrival/departure indicator of a row, upper case, or the empty string. */
    public String indicator (int row) {
        return cell(row, INDICATOR_COLUMN).toUpperCase();
    }

    public List<String> column (int column) {
        List<String> cells = new ArrayList<>(rows.size());
        for (int row = 0; row < rows.size(); row++) cells.add(cell(row, column));
        return cells;
    }

    /**
     * @return the first row whose station label contains the given text, ignoring case, or -1.
     */
    public int findLabelRow (String text) {
        String needle = text.toUpperCase();
        for (int row = 0; row < rows.size(); row++) {
            if (stationLabel(row).toUpperCase().contains(needle)) return row;
        }
        return -1;
    }

}
