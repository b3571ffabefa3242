package com.conveyal.wtt;

import com.conveyal.wtt.loader.ScheduleGrid;
import com.conveyal.wtt.loader.StationDirectory;
import com.conveyal.wtt.loader.SummaryTable;
import com.conveyal.wtt.model.Direction;
import com.conveyal.wtt.model.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A small hand-made working timetable used throughout the tests.
 *
 * UP (VIRAR to CHURCHGATE) and DOWN (CHURCHGATE to VIRAR) grids, with these workings:
 * <ul>
 *     <li>93001 (12 car) reverses at CHURCHGATE into 93002.</li>
 *     <li>93003 is an AC working with no reversal.</li>
 *     <li>93005 reverses into 93006.</li>
 *     <li>93011 runs after midnight and reverses into 93012.</li>
 *     <li>ETY 1 is an empty movement without times.</li>
 *     <li>93010 has no reversal, but 93009 in the DOWN grid reverses into it.</li>
 *     <li>93013 ends at BANDRA through an "ARR" marker.</li>
 * </ul>
 * The summary declares links A (93001 93002), B (93011 93012 ETY 1), C (93003 99999, undefined), D (93005 93006
 * 93013, disagrees with the grid), E (93010 93013, first service reversed into), F (93003) and G (93009 93010,
 * 93010 already on E).
 */
public abstract class TestGrids {

    public static final int ROWS = 15;

    private static final String[] UP_LABELS = {
        "STATIONS", "", "", "", "", "",
        "VIRAR", "BORIVALI", "", "ANDHERI", "BANDRA", "DADAR", "CHURCHGATE", "Reversed as", ""
    };
    private static final String[] UP_INDICATORS = {
        "", "", "", "", "", "",
        "D", "A", "D", "", "", "", "A", "", ""
    };
    private static final String[] DOWN_LABELS = {
        "STATIONS", "", "", "", "", "",
        "CHURCHGATE", "DADAR", "BANDRA", "ANDHERI", "", "BORIVALI", "VIRAR", "", "Reversed as"
    };
    private static final String[] DOWN_INDICATORS = {
        "", "", "", "", "", "",
        "D", "", "", "A", "D", "", "A", "D", ""
    };

    public static StationDirectory directory () {
        return StationDirectory.westernSuburban();
    }

    public static ScheduleGrid upGrid () {
        return grid(Direction.UP, UP_LABELS, UP_INDICATORS,
            column(0, "93001", 1, "12 CAR", 6, "04:00", 7, "04:40", 8, "04:42", 9, "04:58", 10, "05:05",
                11, "05:10", 12, "05:20", 13, "05:30", 14, "93002"),
            column(0, "93003", 2, "Air Conditioned", 3, "AC", 7, "06:00", 8, "06:01", 9, "06:15", 10, "06:22",
                11, "06:28", 12, "06:40"),
            column(0, "93005", 6, "07:00", 7, "07:40", 8, "07:41", 9, "07:55", 12, "08:20", 13, "08:30",
                14, "93006"),
            column(0, "93011", 9, "01:10", 10, "01:15", 12, "01:30", 13, "01:40", 14, "93012"),
            column(0, "ETY 1", 1, "EMPTY RAKE"),
            column(0, "93010", 9, "09:00", 12, "09:30"),
            // A repeated indicator column, not a working.
            column(7, "A", 8, "D", 12, "A"),
            column()
        );
    }

    public static ScheduleGrid downGrid () {
        return grid(Direction.DOWN, DOWN_LABELS, DOWN_INDICATORS,
            column(0, "93002", 6, "05:30", 7, "05:40", 8, "05:45", 9, "05:52", 10, "05:54", 11, "06:10",
                12, "06:50"),
            column(0, "93006", 6, "08:30", 7, "08:40", 9, "08:52", 10, "08:53", 12, "09:40"),
            column(0, "93012", 6, "01:45", 8, "02:00", 9, "02:10", 10, "02:11", 12, "02:40"),
            column(0, "93013", 6, "10:00", 7, "10:10", 8, "BDTS ARR."),
            column(0, "93009", 6, "08:00", 12, "08:50", 13, "08:55", 14, "93010")
        );
    }

    public static SummaryTable summary () {
        return SummaryTable.of(new String[][] {
            {"", "LINK", "SERVICES"},
            {"", "A", "93001", "93002"},
            {"", "", "VR 04:00", "CCG 05:30"},
            {"", "", "FAST", "SLOW"},
            {"", "B", "93011", "93012", "ETY 1"},
            {"", "", "ADH", "CCG", "VR"},
            {"", "", "", "", ""},
            {"", "", "SLOW", "SLOW", ""},
            {"", "C", "93003", "99999"},
            {"", "", "BVI", "CCG"},
            {"", "", "SLOW", "SLOW"},
            {"", "D", "93005", "93006", "93013"},
            {"", "", "VR", "CCG", "CCG"},
            {"", "", "FAST", "FAST", "SLOW"},
            {"", "E†", "93010", "93013"},
            {"", "", "ADH", "CCG"},
            {"", "", "SLOW", "SLOW"},
            {"", "F", "93003"},
            {"", "", "BVI"},
            {"", "", "SLOW"},
            {"", "G", "93009", "93010"},
            {"", "", "CCG", "ADH"},
            {"", "", "FAST", "SLOW"},
        });
    }

    public static Timetable reconcile () {
        return WTT.reconcile(upGrid(), downGrid(), summary(), directory());
    }

    /**
     * @param rowValuePairs alternating row numbers and cell text.
     */
    public static String[] column (Object... rowValuePairs) {
        String[] cells = new String[ROWS];
        for (int i = 0; i < ROWS; i++) cells[i] = "";
        for (int i = 0; i < rowValuePairs.length; i += 2) {
            cells[(Integer) rowValuePairs[i]] = (String) rowValuePairs[i + 1];
        }
        return cells;
    }

    /**
     * Assemble a grid from its label column, indicator column and service columns.
     */
    public static ScheduleGrid grid (Direction direction, String[] labels, String[] indicators, String[]... columns) {
        List<List<String>> rows = new ArrayList<>();
        for (int row = 0; row < labels.length; row++) {
            List<String> cells = new ArrayList<>();
            cells.add(labels[row]);
            cells.add(indicators[row]);
            for (String[] column : columns) cells.add(column[row]);
            rows.add(cells);
        }
        return new ScheduleGrid(direction, rows);
    }

    /** A regular service that is not backed by any grid, optionally reversing into another one. */
    public static Service service (String id, String successorId) {
        Service service = Service.forIdentifiers(Arrays.asList(id));
        service.direction = Direction.UP;
        service.successorId = successorId;
        return service;
    }

    /** Number the services by their position, as reconciliation does. */
    public static List<Service> indexed (Service... services) {
        List<Service> list = new ArrayList<>(Arrays.asList(services));
        for (int i = 0; i < list.size(); i++) list.get(i).index = i;
        return list;
    }

    public static ScheduleGrid upGridWith (String[]... columns) {
        return grid(Direction.UP, UP_LABELS, UP_INDICATORS, columns);
    }

    public static ScheduleGrid downGridWith (String[]... columns) {
        return grid(Direction.DOWN, DOWN_LABELS, DOWN_INDICATORS, columns);
    }

}
