package com.conveyal.wtt.validator;

import com.conveyal.wtt.TestGrids;
import com.conveyal.wtt.error.ErrorStorage;
import com.conveyal.wtt.error.NewWTTError;
import com.conveyal.wtt.error.NewWTTErrorType;
import com.conveyal.wtt.model.EventType;
import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.model.Station;
import com.conveyal.wtt.model.StationEvent;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;

public class EventTimesValidatorTest {

    private static final Station DADAR = new Station("DADAR", 11);
    private static final Station BANDRA = new Station("BANDRA", 15);
    private static final Station ANDHERI = new Station("ANDHERI", 22);

    @Test
    public void recordsTimesGoingBackwards() {
        ErrorStorage errorStorage = new ErrorStorage();
        EventTimesValidator validator = new EventTimesValidator(errorStorage);

        Service ordered = TestGrids.service("93001", null);
        ordered.events = Arrays.asList(event(DADAR, 600, 0), event(BANDRA, 605, 1), event(ANDHERI, 612, 2));
        Service backwards = TestGrids.service("93002", null);
        backwards.events = Arrays.asList(event(DADAR, 600, 0), event(BANDRA, 590, 1), event(ANDHERI, 612, 2));
        validator.validateService(ordered);
        validator.validateService(backwards);

        ValidationResult result = new ValidationResult();
        validator.complete(result);
        assertThat(result.servicesWithDecreasingTimes, equalTo(1));

        List<NewWTTError> errors = errorStorage.getErrors(NewWTTErrorType.EVENT_TIME_DECREASING);
        assertThat(errors, hasSize(1));
        NewWTTError error = errors.get(0);
        assertThat(error.entityId, equalTo("93002"));
        assertThat(error.badValue, equalTo("09:50"));
        assertThat(error.errorInfo.get("station"), equalTo("BANDRA"));
        assertThat(error.errorInfo.get("previousTime"), equalTo("10:00"));
        // Event order is never changed.
        assertThat(backwards.events.get(1).station, equalTo(BANDRA));
    }

    private static StationEvent event(Station station, int time, int sequence) {
        return new StationEvent(station, time, EventType.ARRIVAL, 0, sequence);
    }

}
