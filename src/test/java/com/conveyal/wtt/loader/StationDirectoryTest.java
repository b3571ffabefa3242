package com.conveyal.wtt.loader;

import com.conveyal.wtt.error.ConfigurationException;
import com.conveyal.wtt.model.Station;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Station lookups against the bundled Western Railway directory and directories read from JSON.
 */
public class StationDirectoryTest {

    private static StationDirectory directory;

    @BeforeAll
    public static void setUpClass() {
        directory = StationDirectory.westernSuburban();
    }

    @Test
    public void canLoadBundledDirectory() {
        assertThat(directory.getStations().size(), equalTo(29));
        assertEquals(0, directory.getStation("CHURCHGATE").chainageKm, 0.001);
        assertEquals(60, directory.getStation("VIRAR").chainageKm, 0.001);
    }

    @Test
    public void canonicalizesLabels() {
        assertThat(directory.canonicalize("  borivali "), equalTo("BORIVALI"));
        assertThat(directory.canonicalize("Kandivli"), equalTo("KANDIVALI"));
        assertThat(directory.canonicalize("M'BAI CENTRAL (L)"), equalTo("M'BAI CENTRAL(L)"));
        assertThat(directory.canonicalize(""), nullValue());
        // Unknown labels are still normalized, they just do not resolve.
        assertThat(directory.canonicalize("nowhere"), equalTo("NOWHERE"));
        assertThat(directory.resolve("nowhere"), nullValue());
    }

    @Test
    public void resolvesAbbreviationsAsWholeWords() {
        assertThat(directory.resolveAbbreviation("BDTS ARR.").name, equalTo("BANDRA"));
        assertThat(directory.resolveAbbreviation("ARR BVI").name, equalTo("BORIVALI"));
        // "BA" must not be found inside "BAY".
        assertThat(directory.resolveAbbreviation("BAY ARR"), nullValue());
        Station csmt = directory.resolveAbbreviation("CSMT ARRL");
        assertThat(csmt.name, equalTo("CHATTRAPATI SHIVAJI MAHARAJ TERMINUS"));
        assertFalse(csmt.isOnNetwork());
        assertFalse(directory.contains("PANVEL"));
    }

    @Test
    public void canReadDirectoryFromJson() {
        String json = "{\"name\": \"test line\", \"stations\": [{\"name\": \"North\", \"chainageKm\": 0}," +
            "{\"name\": \"South\", \"chainageKm\": 7.5}], \"aliases\": {\"STH\": \"SOUTH\"}," +
            "\"abbreviations\": {\"N\": \"NORTH\"}}";
        StationDirectory custom = StationDirectory.fromJson(stream(json));
        assertThat(custom.networkName, equalTo("test line"));
        assertTrue(custom.contains("sth"));
        assertEquals(7.5, custom.resolve("STH").chainageKm, 0.001);
        assertThat(custom.resolveAbbreviation("N ARR").name, equalTo("NORTH"));
    }

    @Test
    public void rejectsBrokenConfiguration() {
        assertThrows(ConfigurationException.class, () -> StationDirectory.fromJson(stream("{not json")));
        assertThrows(ConfigurationException.class, () -> StationDirectory.fromJson(stream("{\"name\": \"x\"}")));
        ConfigurationException badAlias = assertThrows(ConfigurationException.class, () -> StationDirectory.fromJson(
            stream("{\"stations\": [{\"name\": \"A\", \"chainageKm\": 0}], \"aliases\": {\"B\": \"C\"}}")));
        assertThat(badAlias.badValue, equalTo("B -> C"));
        assertThrows(ConfigurationException.class, () -> new StationDirectory.Builder("empty").build());
    }

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }

}
