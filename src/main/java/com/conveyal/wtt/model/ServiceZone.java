package com.conveyal.wtt.model;

public enum ServiceZone {
    SUBURBAN,
    CENTRAL
}
