package com.conveyal.wtt.loader;

import com.conveyal.wtt.model.Direction;
import com.csvreader.CsvReader;
import org.apache.commons.io.input.BOMInputStream;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads timetable sheets exported as CSV. Empty records are kept so that row positions match the spreadsheet.
 */
public abstract class GridCsvReader {

    public static ScheduleGrid readGrid (File file, Direction direction) throws IOException {
        try (InputStream in = new FileInputStream(file)) {
            return readGrid(in, direction);
        }
    }

    public static ScheduleGrid readGrid (InputStream inputStream, Direction direction) throws IOException {
        return new ScheduleGrid(direction, readRows(inputStream));
    }

    public static SummaryTable readSummary (File file) throws IOException {
        try (InputStream in = new FileInputStream(file)) {
            return readSummary(in);
        }
    }

    public static SummaryTable readSummary (InputStream inputStream) throws IOException {
        return new SummaryTable(readRows(inputStream));
    }

    private static List<List<String>> readRows (InputStream inputStream) throws IOException {
        CsvReader reader = new CsvReader(new BOMInputStream(inputStream), ',', StandardCharsets.UTF_8);
        reader.setSkipEmptyRecords(false);
        List<List<String>> rows = new ArrayList<>();
        try {
            while (reader.readRecord()) {
                rows.add(new ArrayList<>(Arrays.asList(reader.getValues())));
            }
        } finally {
            reader.close();
        }
        return rows;
    }

}
