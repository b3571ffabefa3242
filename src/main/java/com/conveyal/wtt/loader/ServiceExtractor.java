package com.conveyal.wtt.loader;

import com.conveyal.wtt.error.ErrorStorage;
import com.conveyal.wtt.error.NewWTTError;
import com.conveyal.wtt.error.NewWTTErrorType;
import com.conveyal.wtt.model.Direction;
import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.model.ServiceZone;
import com.conveyal.wtt.model.Station;
import com.conveyal.wtt.model.TimedCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the columns of a {@link ScheduleGrid} into {@link Service}s. Everything that can be read from a single column
 * and the two label columns is extracted here: identifiers, car count and AC requirement from the header, the
 * identifier of the working this train reverses into, the first and last station, and the cells that carry times.
 * Station events are not produced here, see {@link EventSequencer}.
 */
public class ServiceExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ServiceExtractor.class);

    public static final int SERVICE_ID_LENGTH = 5;

    private static final Pattern SERVICE_ID_PATTERN = Pattern.compile("^\\s*(\\d{5})(?:\\b.*)?$");
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\bETY\\s*(\\d+)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CENTRAL_RAILWAY_PATTERN = Pattern.compile("^[Cc]\\.\\s*[Rr][Ll][Yy]\\.?$");
    private static final Pattern CAR_COUNT_PATTERN = Pattern.compile("(\\d+)\\s*CAR", Pattern.CASE_INSENSITIVE);
    private static final Pattern AC_PATTERN = Pattern.compile("\\bAC\\b");
    private static final Pattern ARRIVAL_MARKER_PATTERN = Pattern.compile("\\bARRL?\\b", Pattern.CASE_INSENSITIVE);

    /** AC workings are marked by remarks in the header. One mention is not enough, two are. */
    private static final int AC_KEYWORD_HITS = 2;

    private final StationDirectory directory;
    private final LabelResolver labelResolver;
    private final ErrorStorage errorStorage;

    public ServiceExtractor(StationDirectory directory, ErrorStorage errorStorage) {
        this.directory = directory;
        this.labelResolver = new LabelResolver(directory);
        this.errorStorage = errorStorage;
    }

    /**
     * Extract one service per service column of the grid, left to right. Blank columns, repeated station label
     * columns and extra arrival/departure indicator columns are skipped.
     */
    public List<Service> extractServices (ScheduleGrid grid) {
        List<Service> services = new ArrayList<>();
        for (int column = ScheduleGrid.FIRST_SERVICE_COLUMN; column < grid.columnCount(); column++) {
            if (!isServiceColumn(grid, column)) continue;
            services.add(extractService(grid, column));
        }
        LOG.info("Extracted {} {} services from {} grid columns.", services.size(), grid.direction, grid.columnCount());
        return services;
    }

    /**
     * A column describes a working unless it is blank, repeats the station labels, or is an indicator column (an
     * "A" immediately followed by a "D" among its non-blank cells).
     */
    public static boolean isServiceColumn (ScheduleGrid grid, int column) {
        List<String> values = new ArrayList<>();
        for (String cell : grid.column(column)) {
            if (!cell.isEmpty()) values.add(cell.toUpperCase());
        }
        if (values.isEmpty()) return false;
        if ("STATIONS".equalsIgnoreCase(grid.cell(0, column))) return false;
        for (int i = 1; i < values.size(); i++) {
            if (values.get(i - 1).equals("A") && values.get(i).equals("D")) return false;
        }
        return true;
    }

    public Service extractService (ScheduleGrid grid, int column) {
        List<String> ids = new ArrayList<>();
        for (int row = 0; row < ScheduleGrid.HEADER_ROWS; row++) {
            String id = parseIdentifier(grid.cell(row, column));
            if (id != null) ids.add(id);
        }
        Service service = Service.forIdentifiers(ids);
        service.direction = grid.direction;
        service.column = column;
        readHeader(grid, column, service);
        service.needsAcRake = requiresAc(grid, column);
        service.successorId = extractSuccessorId(grid, column);

        for (int row = 0; row < grid.rowCount(); row++) {
            String text = grid.cell(row, column);
            if (TimeCodec.isTime(text)) {
                service.timedCells.add(new TimedCell(row, text));
            } else if (TimeCodec.isMalformedTime(text)) {
                errorStorage.storeError(NewWTTError.forEntity(service, NewWTTErrorType.TIME_FORMAT)
                    .setRow(row).setBadValue(text));
            }
        }
        if (service.timedCells.isEmpty()) {
            if (!ids.isEmpty()) {
                errorStorage.storeError(NewWTTError.forEntity(service, NewWTTErrorType.SERVICE_WITHOUT_TIMES));
            }
            return service;
        }
        service.initStation = extractInitStation(grid, service);
        service.finalStation = extractFinalStation(grid, column, service);
        if (service.initStation == null || service.finalStation == null) {
            errorStorage.storeError(NewWTTError.forEntity(service, NewWTTErrorType.STATION_UNRESOLVED)
                .setBadValue(service.initStation == null ? "first station" : "last station"));
        }
        return service;
    }

    /** Zone and car count. */
    private void readHeader (ScheduleGrid grid, int column, Service service) {
        for (int row = 0; row < ScheduleGrid.HEADER_ROWS; row++) {
            String cell = grid.cell(row, column);
            if (CENTRAL_RAILWAY_PATTERN.matcher(cell).matches()) {
                service.zone = ServiceZone.CENTRAL;
            }
            Matcher idMatcher = SERVICE_ID_PATTERN.matcher(cell);
            if (idMatcher.matches() && !PLACEHOLDER_PATTERN.matcher(cell).find() && cell.startsWith("9")) {
                service.zone = ServiceZone.SUBURBAN;
            }
            if (cell.toUpperCase().contains("CAR")) {
                Matcher carMatcher = CAR_COUNT_PATTERN.matcher(cell);
                if (carMatcher.find()) {
                    service.carCount = Integer.parseInt(carMatcher.group(1));
                } else {
                    errorStorage.storeError(NewWTTError.forEntity(service, NewWTTErrorType.CAR_COUNT_FORMAT)
                        .setRow(row).setBadValue(cell));
                }
            }
        }
    }

    /**
     * Count header cells mentioning air conditioning. Matching is case sensitive: "AC" must be written in capitals
     * and stand as a word of its own.
     */
    private static boolean requiresAc (ScheduleGrid grid, int column) {
        int hits = 0;
        for (int row = 0; row < ScheduleGrid.HEADER_ROWS; row++) {
            String cell = grid.cell(row, column);
            if (cell.contains("Air") || cell.contains("Condition") || AC_PATTERN.matcher(cell).find()) {
                hits += 1;
                if (hits >= AC_KEYWORD_HITS) return true;
            }
        }
        return false;
    }

    /**
     * In the UP grid the reversal time sits on the "Reversed as" row and the next identifier on the row below it.
     * In the DOWN grid both are one row higher. Only a bare 5 digit identifier is accepted.
     */
    private static String extractSuccessorId (ScheduleGrid grid, int column) {
        int labelRow = grid.findLabelRow(LabelResolver.REVERSED_AS_LABEL);
        if (labelRow < 0) return null;
        int timeRow = grid.direction == Direction.UP ? labelRow : labelRow - 1;
        int idRow = timeRow + 1;
        String time = grid.cell(timeRow, column);
        String id = grid.cell(idRow, column);
        if (time.isEmpty() || id.length() != SERVICE_ID_LENGTH) return null;
        for (char c : id.toCharArray()) {
            if (!Character.isDigit(c)) return null;
        }
        return id;
    }

    private Station extractInitStation (ScheduleGrid grid, Service service) {
        int row = service.timedCells.get(0).row;
        return labelResolver.stationFor(grid, row);
    }

    /**
     * An explicit "ARR" marker names the last station through an abbreviation in the marker cell or right next to
     * it. Without one, the last timed cell whose label resolves decides.
     */
    private Station extractFinalStation (ScheduleGrid grid, int column, Service service) {
        for (int row = 0; row < grid.rowCount(); row++) {
            if (!ARRIVAL_MARKER_PATTERN.matcher(grid.cell(row, column)).find()) continue;
            for (int r : new int[] {row, row - 1, row + 1}) {
                Station station = directory.resolveAbbreviation(grid.cell(r, column));
                if (station != null) return station;
            }
            LOG.debug("No station abbreviation near arrival marker of {} on row {}", service.getId(), row);
            break;
        }
        for (int i = service.timedCells.size() - 1; i >= 0; i--) {
            int row = service.timedCells.get(i).row;
            String label = labelResolver.labelFor(grid, row);
            Station station = directory.resolve(label);
            if (station != null) return station;
            if (LabelResolver.isReversedLabel(label)) {
                // The reversal time belongs to the station above the label.
                return labelResolver.stationFor(grid, row - 1);
            }
        }
        return null;
    }

    /**
     * @return the identifier written in a header or summary cell: the leading 5 digits of "93232 L/SPL", or a
     * placeholder normalized to "ETY n". Null if the cell holds no identifier.
     */
    public static String parseIdentifier (String cell) {
        if (cell == null || cell.trim().isEmpty()) return null;
        Matcher placeholder = PLACEHOLDER_PATTERN.matcher(cell);
        if (placeholder.find()) {
            return "ETY " + Integer.parseInt(placeholder.group(1));
        }
        Matcher id = SERVICE_ID_PATTERN.matcher(cell);
        return id.matches() ? id.group(1) : null;
    }

    /** @return true for the identifiers of non-revenue empty movements ("ETY 3"). */
    public static boolean isPlaceholder (String id) {
        return id != null && PLACEHOLDER_PATTERN.matcher(id).find();
    }

}
