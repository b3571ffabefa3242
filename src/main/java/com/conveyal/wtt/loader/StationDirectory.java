package com.conveyal.wtt.loader;

import com.conveyal.wtt.error.ConfigurationException;
import com.conveyal.wtt.model.Station;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * The fixed reference data a timetable is read against: the stations of the network with their chainage, an alias
 * table mapping non-canonical station labels onto canonical names, and the abbreviations used next to "ARR" markers.
 *
 * All label canonicalization happens in {@link #canonicalize(String)}. A directory is immutable and can be shared by
 * any number of reconciliation runs and threads.
 */
public class StationDirectory {

    private static final Logger LOG = LoggerFactory.getLogger(StationDirectory.class);

    public static final String WESTERN_SUBURBAN_RESOURCE = "/stations/western-suburban.json";

    public final String networkName;

    /** Canonical name to station, in network order. */
    private final Map<String, Station> stations;
    /** Upper case label to canonical name. */
    private final Map<String, String> aliases;
    /** Abbreviation to station. Abbreviations may name stations outside the network. */
    private final Map<String, Station> abbreviations;
    /** Whole-word patterns for the abbreviations, longest abbreviation first. */
    private final Map<String, Pattern> abbreviationPatterns;

    private StationDirectory(Builder builder) {
        this.networkName = builder.networkName;
        this.stations = ImmutableMap.copyOf(builder.stations);
        this.aliases = ImmutableMap.copyOf(builder.aliases);
        this.abbreviations = ImmutableMap.copyOf(builder.abbreviations);
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        builder.abbreviations.keySet().stream()
            .sorted((a, b) -> b.length() - a.length())
            .forEach(abbr -> patterns.put(abbr, Pattern.compile("\\b" + Pattern.quote(abbr) + "\\b")));
        this.abbreviationPatterns = patterns;
    }

    /**
     * Load the directory of the Western Railway suburban network shipped with this library.
     */
    public static StationDirectory westernSuburban () {
        InputStream stream = StationDirectory.class.getResourceAsStream(WESTERN_SUBURBAN_RESOURCE);
        if (stream == null) {
            throw new ConfigurationException("Station directory resource is missing.", WESTERN_SUBURBAN_RESOURCE);
        }
        try (InputStream in = stream) {
            return fromJson(in);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read station directory resource.", e);
        }
    }

    /**
     * Read a directory from JSON of the form
     * <pre>{"name": ..., "stations": [{"name": ..., "chainageKm": ...}], "aliases": {label: name},
     * "abbreviations": {abbr: name}, "externalStations": [name]}</pre>
     * Abbreviations must name either a station or an external station.
     *
     * @throws ConfigurationException if the JSON is unreadable or inconsistent.
     */
    public static StationDirectory fromJson (InputStream inputStream) {
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Station directory is not valid JSON.", e);
        }
        if (root == null || !root.has("stations") || !root.get("stations").isArray()) {
            throw new ConfigurationException("Station directory must contain a stations array.", "stations");
        }
        Builder builder = new Builder(root.path("name").asText("unnamed network"));
        for (JsonNode stationNode : root.get("stations")) {
            JsonNode chainage = stationNode.get("chainageKm");
            if (!stationNode.hasNonNull("name") || chainage == null || !chainage.isNumber()) {
                throw new ConfigurationException("Each station needs a name and a numeric chainageKm.",
                    stationNode.toString());
            }
            builder.addStation(stationNode.get("name").asText(), chainage.asDouble());
        }
        for (JsonNode external : root.path("externalStations")) {
            builder.addExternalStation(external.asText());
        }
        Iterator<Map.Entry<String, JsonNode>> aliasFields = root.path("aliases").fields();
        while (aliasFields.hasNext()) {
            Map.Entry<String, JsonNode> alias = aliasFields.next();
            builder.addAlias(alias.getKey(), alias.getValue().asText());
        }
        Iterator<Map.Entry<String, JsonNode>> abbreviationFields = root.path("abbreviations").fields();
        while (abbreviationFields.hasNext()) {
            Map.Entry<String, JsonNode> abbreviation = abbreviationFields.next();
            builder.addAbbreviation(abbreviation.getKey(), abbreviation.getValue().asText());
        }
        StationDirectory directory = builder.build();
        LOG.info("Loaded station directory {} with {} stations, {} aliases and {} abbreviations.",
            directory.networkName, directory.stations.size(), directory.aliases.size(),
            directory.abbreviations.size());
        return directory;
    }

    /**
     * @return the canonical upper case name for a station label, or null for a blank label. Labels that are not known
     * aliases are returned trimmed and upper cased, whether or not they name a station.
     */
    public String canonicalize (String label) {
        if (label == null) return null;
        String name = label.trim().toUpperCase();
        if (name.isEmpty()) return null;
        return aliases.getOrDefault(name, name);
    }

    /**
     * @return the station a grid label refers to, or null if the label does not name a station of the network.
     */
    public Station resolve (String label) {
        String name = canonicalize(label);
        return name == null ? null : stations.get(name);
    }

    /**
     * Find a station abbreviation appearing as a whole word in the given cell text, e.g. "BDTS" in "BDTS ARR.".
     * @return the station, or null if the text contains no known abbreviation.
     */
    public Station resolveAbbreviation (String text) {
        if (text == null) return null;
        String upper = text.toUpperCase();
        for (Map.Entry<String, Pattern> entry : abbreviationPatterns.entrySet()) {
            if (entry.getValue().matcher(upper).find()) {
                return abbreviations.get(entry.getKey());
            }
        }
        return null;
    }

    public Station getStation (String canonicalName) {
        return stations.get(canonicalName);
    }

    public Collection<Station> getStations () {
        return stations.values();
    }

    public boolean contains (String label) {
        return resolve(label) != null;
    }

    /**
     * Assembles a directory programmatically. Stations must be added before the aliases and abbreviations that
     * refer to them.
     */
    public static class Builder {
        private final String networkName;
        private final Map<String, Station> stations = new LinkedHashMap<>();
        private final Map<String, Station> externalStations = new LinkedHashMap<>();
        private final Map<String, String> aliases = new LinkedHashMap<>();
        private final Map<String, Station> abbreviations = new LinkedHashMap<>();

        public Builder(String networkName) {
            this.networkName = networkName;
        }

        public Builder addStation (String name, double chainageKm) {
            String key = name.trim().toUpperCase();
            if (stations.containsKey(key)) {
                throw new ConfigurationException("Station is listed twice in the directory.", key);
            }
            stations.put(key, new Station(key, chainageKm));
            return this;
        }

        /** A station outside the network, only reachable through abbreviations. It has no chainage. */
        public Builder addExternalStation (String name) {
            String key = name.trim().toUpperCase();
            externalStations.put(key, new Station(key, Double.NaN));
            return this;
        }

        public Builder addAlias (String label, String canonicalName) {
            String target = canonicalName.trim().toUpperCase();
            if (!stations.containsKey(target)) {
                throw new ConfigurationException("Alias refers to an unknown station.", label + " -> " + target);
            }
            aliases.put(label.trim().toUpperCase(), target);
            return this;
        }

        public Builder addAbbreviation (String abbreviation, String stationName) {
            String target = stationName.trim().toUpperCase();
            Station station = stations.containsKey(target) ? stations.get(target) : externalStations.get(target);
            if (station == null) {
                throw new ConfigurationException("Abbreviation refers to an unknown station.",
                    abbreviation + " -> " + target);
            }
            abbreviations.put(abbreviation.trim().toUpperCase(), station);
            return this;
        }

        public StationDirectory build () {
            if (stations.isEmpty()) {
                throw new ConfigurationException("A station directory needs at least one station.", networkName);
            }
            return new StationDirectory(this);
        }
    }

}
