package com.conveyal.wtt.loader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The rake-link summary as a table of cell text. Rows that are entirely blank are dropped on construction, so "two
 * rows below" in the summary layout always counts rows that carry content.
 */
public class SummaryTable {

    private final List<List<String>> rows;

    public SummaryTable(List<List<String>> rows) {
        List<List<String>> kept = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> cells = new ArrayList<>(row.size());
            boolean blank = true;
            for (String cell : row) {
                String text = cell == null ? "" : cell.trim();
                if (!text.isEmpty()) blank = false;
                cells.add(text);
            }
            if (!blank) kept.add(Collections.unmodifiableList(cells));
        }
        this.rows = Collections.unmodifiableList(kept);
    }

    public static SummaryTable of (String[][] cells) {
        List<List<String>> rows = new ArrayList<>(cells.length);
        for (String[] row : cells) {
            List<String> list = new ArrayList<>(row.length);
            Collections.addAll(list, row);
            rows.add(list);
        }
        return new SummaryTable(rows);
    }

    public int rowCount () {
        return rows.size();
    }

    public int columnCount (int row) {
        return row < 0 || row >= rows.size() ? 0 : rows.get(row).size();
    }

    public String cell (int row, int column) {
        if (row < 0 || row >= rows.size()) return "";
        List<String> cells = rows.get(row);
        return column < 0 || column >= cells.size() ? "" : cells.get(column);
    }

}
