package com.conveyal.wtt.filter.conditions;

import com.conveyal.wtt.model.RakeLink;

/**
 * The link must start and/or end at the given stations. Either station may be null.
 */
public class TerminalStationsCondition extends LinkCondition {

    private final String startStationName;
    private final String endStationName;

    public TerminalStationsCondition(String startStationName, String endStationName) {
        this.startStationName = startStationName;
        this.endStationName = endStationName;
    }

    @Override
    public boolean passes(RakeLink link) {
        if (startStationName != null && !startStationName.equals(link.firstStation().name)) return false;
        return endStationName == null || endStationName.equals(link.lastStation().name);
    }
}
