package com.conveyal.wtt.loader;

import com.conveyal.wtt.error.ErrorStorage;
import com.conveyal.wtt.error.NewWTTError;
import com.conveyal.wtt.error.NewWTTErrorType;
import com.conveyal.wtt.model.EventType;
import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.model.Station;
import com.conveyal.wtt.model.StationEvent;
import com.conveyal.wtt.model.TimedCell;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks the timed cells of a service top to bottom and produces its station events.
 *
 * A row marked "A" is an arrival. If the row right below it is marked "D" and carries a time in the same column, that
 * time is the departure from the same station and the row is consumed. Any other timed row yields a single event of
 * arrival kind (the dwell is too short to be printed). Events keep row order, which is the chronological order.
 */
public class EventSequencer {

    private static final Logger LOG = LoggerFactory.getLogger(EventSequencer.class);

    public static final String ARRIVAL_INDICATOR = "A";
    public static final String DEPARTURE_INDICATOR = "D";

    private final StationDirectory directory;
    private final LabelResolver labelResolver;
    private final ErrorStorage errorStorage;

    public EventSequencer(StationDirectory directory, ErrorStorage errorStorage) {
        this.directory = directory;
        this.labelResolver = new LabelResolver(directory);
        this.errorStorage = errorStorage;
    }

    /**
     * Produce the events of a service without modifying it. Cells whose station cannot be resolved are skipped and
     * reported. The result is empty only if no cell could be placed at a station.
     *
     * @param grid the grid the service was extracted from.
     */
    public List<StationEvent> sequence (Service service, ScheduleGrid grid) {
        List<StationEvent> events = new ArrayList<>();
        int consumedRow = -1;
        for (TimedCell cell : service.timedCells) {
            if (cell.row == consumedRow) continue;
            int time = TimeCodec.toMinutes(cell.text);
            if (time == TimeCodec.NOT_A_TIME) continue;

            Station station = resolveStation(grid, cell.row, events);
            if (station == null) {
                errorStorage.storeError(NewWTTError.forEntity(service, NewWTTErrorType.STATION_UNRESOLVED)
                    .setRow(cell.row)
                    .setBadValue(String.valueOf(labelResolver.labelFor(grid, cell.row))));
                continue;
            }
            if (ARRIVAL_INDICATOR.equals(grid.indicator(cell.row))) {
                events.add(new StationEvent(station, time, EventType.ARRIVAL, service.index, events.size()));
                int nextRow = cell.row + 1;
                int departure = TimeCodec.toMinutes(grid.cell(nextRow, service.column));
                if (DEPARTURE_INDICATOR.equals(grid.indicator(nextRow)) && departure != TimeCodec.NOT_A_TIME) {
                    events.add(new StationEvent(station, departure, EventType.DEPARTURE, service.index, events.size()));
                    consumedRow = nextRow;
                }
            } else {
                events.add(new StationEvent(station, time, EventType.ARRIVAL, service.index, events.size()));
            }
        }
        LOG.debug("Sequenced {} events for service {}", events.size(), service.getId());
        return ImmutableList.copyOf(events);
    }

    /**
     * A time on a "Reversed as" row belongs to the station of the event before it, not to the label.
     */
    private Station resolveStation (ScheduleGrid grid, int row, List<StationEvent> eventsSoFar) {
        String label = labelResolver.labelFor(grid, row);
        if (LabelResolver.isReversedLabel(label)) {
            return eventsSoFar.isEmpty() ? null : eventsSoFar.get(eventsSoFar.size() - 1).station;
        }
        return directory.resolve(label);
    }

}
