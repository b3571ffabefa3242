package com.conveyal.wtt;

import com.conveyal.wtt.model.Rake;
import com.conveyal.wtt.model.RakeLink;
import com.conveyal.wtt.model.Service;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.conveyal.wtt.TestGrids.service;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RakeAssignerTest {

    @Test
    public void numbersRakesOfValidLinks() {
        Timetable timetable = TestGrids.reconcile();
        Rake a = timetable.getLink("A").rake;
        assertThat(a.rakeId, equalTo(1));
        assertThat(a.carCount, equalTo(12));
        assertFalse(a.ac);
        assertThat(timetable.getLink("B").rake.rakeId, equalTo(2));
        assertThat(timetable.getLink("C").rake, nullValue());
        assertThat(timetable.getLink("D").rake, nullValue());
        assertThat(timetable.getLink("E").rake.rakeId, equalTo(3));

        Rake f = timetable.getLink("F").rake;
        assertThat(f.rakeId, equalTo(4));
        assertTrue(f.ac);
        assertThat(f.carCount, equalTo(Rake.DEFAULT_CAR_COUNT));
        assertThat(timetable.getValidLinks().stream().filter(l -> l.rake != null).count(), equalTo(4L));
        for (RakeLink link : timetable.getLinks()) {
            assertThat(link.rake != null, equalTo(link.isValid()));
        }
    }

    @Test
    public void firstServiceSetsCarCountAndFirstAcServiceMakesRakeAc() {
        Service plain = service("93001", null);
        Service twelveCar = service("93002", null);
        twelveCar.carCount = 12;
        Service ac = service("93003", null);
        ac.needsAcRake = true;
        ac.carCount = 9;

        Rake rake = RakeAssigner.rakeFor(7, Arrays.asList(twelveCar, plain, ac));
        assertThat(rake.rakeId, equalTo(7));
        assertTrue(rake.ac);
        assertThat(rake.carCount, equalTo(12));

        Rake defaults = RakeAssigner.rakeFor(8, Arrays.asList(plain));
        assertFalse(defaults.ac);
        assertThat(defaults.carCount, equalTo(Rake.DEFAULT_CAR_COUNT));
    }

    /** A first service without a CAR token asks for the default rake, which a later service cannot change. */
    @Test
    public void laterCarCountDoesNotOverrideDefaultOfFirstService() {
        Service plain = service("93101", null);
        Service twelveCar = service("93102", null);
        twelveCar.carCount = 12;

        Rake rake = RakeAssigner.rakeFor(1, Arrays.asList(plain, twelveCar));
        assertThat(rake.carCount, equalTo(Rake.DEFAULT_CAR_COUNT));
        assertFalse(rake.ac);
    }

}
