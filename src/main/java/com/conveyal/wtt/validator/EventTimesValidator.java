package com.conveyal.wtt.validator;

import com.conveyal.wtt.error.ErrorStorage;
import com.conveyal.wtt.error.NewWTTError;
import com.conveyal.wtt.error.NewWTTErrorType;
import com.conveyal.wtt.loader.TimeCodec;
import com.conveyal.wtt.model.Service;
import com.conveyal.wtt.model.StationEvent;

/**
 * Check that the events of a service do not go back in time. Event order is never changed, the problem is only
 * recorded.
 */
public class EventTimesValidator extends ServiceValidator {

    private int servicesWithDecreasingTimes = 0;

    public EventTimesValidator(ErrorStorage errorStorage) {
        super(errorStorage);
    }

    @Override
    public void validateService (Service service) {
        boolean decreasing = false;
        for (int i = 1; i < service.events.size(); i++) {
            StationEvent previous = service.events.get(i - 1);
            StationEvent current = service.events.get(i);
            if (current.time < previous.time) {
                registerError(NewWTTError.forEntity(service, NewWTTErrorType.EVENT_TIME_DECREASING)
                    .setBadValue(TimeCodec.format(current.time))
                    .addInfo("station", current.getStationName())
                    .addInfo("previousTime", TimeCodec.format(previous.time)));
                decreasing = true;
            }
        }
        if (decreasing) servicesWithDecreasingTimes += 1;
    }

    @Override
    public void complete (ValidationResult validationResult) {
        validationResult.servicesWithDecreasingTimes = servicesWithDecreasingTimes;
    }

}
