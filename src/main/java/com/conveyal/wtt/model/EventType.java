package com.conveyal.wtt.model;

public enum EventType {
    ARRIVAL,
    DEPARTURE
}
