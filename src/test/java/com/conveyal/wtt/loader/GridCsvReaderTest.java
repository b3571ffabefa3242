package com.conveyal.wtt.loader;

import com.conveyal.wtt.model.Direction;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

public class GridCsvReaderTest {

    @Test
    public void keepsRowPositionsOfGrid() throws IOException {
        ScheduleGrid grid;
        try (InputStream in = getClass().getResourceAsStream("/fake-wtt/up.csv")) {
            grid = GridCsvReader.readGrid(in, Direction.UP);
        }
        assertThat(grid.direction, equalTo(Direction.UP));
        assertThat(grid.rowCount(), equalTo(15));
        assertThat(grid.columnCount(), equalTo(10));
        assertThat(grid.stationLabel(0), equalTo("STATIONS"));
        assertThat(grid.cell(1, 2), equalTo("12 CAR"));
        assertThat(grid.findLabelRow("reversed AS"), equalTo(13));
        assertThat(grid.indicator(7), equalTo("A"));
        assertThat(grid.cell(40, 40), equalTo(""));
    }

    @Test
    public void stripsByteOrderMarkFromSummary() throws IOException {
        SummaryTable table;
        try (InputStream in = getClass().getResourceAsStream("/fake-wtt/summary.csv")) {
            table = GridCsvReader.readSummary(in);
        }
        // The first cell would start with a BOM if it were not removed.
        assertThat(table.cell(0, 0), equalTo(""));
        assertThat(table.cell(0, 1), equalTo("LINK"));
        // One blank row is dropped.
        assertThat(table.rowCount(), equalTo(22));
    }

}
