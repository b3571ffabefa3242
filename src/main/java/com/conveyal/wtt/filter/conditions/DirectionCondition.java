package com.conveyal.wtt.filter.conditions;

import com.conveyal.wtt.model.Direction;
import com.conveyal.wtt.model.Service;

import java.util.EnumSet;
import java.util.Set;

public class DirectionCondition extends ServiceCondition {

    private final Set<Direction> directions;

    public DirectionCondition(Set<Direction> directions) {
        this.directions = EnumSet.copyOf(directions);
    }

    @Override
    public boolean passes(Service service) {
        return directions.contains(service.direction);
    }
}
