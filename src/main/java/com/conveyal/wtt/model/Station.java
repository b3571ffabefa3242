package com.conveyal.wtt.model;

import java.util.Objects;

/**
 * A station of the network. Stations are reference data: they are created once when the station directory is loaded
 * and never change afterward.
 */
public class Station extends Entity {

    private static final long serialVersionUID = 1L;

    /** Canonical upper case name, e.g. "BORIVALI". */
    public final String name;

    /**
     * Distance in kilometers from the reference terminus of the network. NaN for stations outside the network that
     * are only known through abbreviations (e.g. a terminus on another railway).
     */
    public final double chainageKm;

    public Station(String name, double chainageKm) {
        this.name = name;
        this.chainageKm = chainageKm;
    }

    public boolean isOnNetwork() {
        return !Double.isNaN(chainageKm);
    }

    @Override
    public String getId() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Station station = (Station) o;
        return name.equals(station.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return isOnNetwork() ? String.format("%s (%.1f km)", name, chainageKm) : name;
    }
}
