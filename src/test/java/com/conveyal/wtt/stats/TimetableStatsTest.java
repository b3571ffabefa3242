package com.conveyal.wtt.stats;

import com.conveyal.wtt.TestGrids;
import com.conveyal.wtt.Timetable;
import com.conveyal.wtt.WTT;
import com.conveyal.wtt.filter.FilterQuery;
import com.conveyal.wtt.filter.FilterType;
import com.conveyal.wtt.model.Direction;
import com.conveyal.wtt.model.RakeLink;
import gnu.trove.list.TIntList;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;

public class TimetableStatsTest {

    private static Timetable timetable;
    private static TimetableStats stats;

    @BeforeAll
    public static void setUpClass() {
        timetable = TestGrids.reconcile();
        FilterQuery query = new FilterQuery(FilterType.RAKELINK);
        stats = new TimetableStats(timetable, WTT.evaluate(timetable, query));
    }

    @Test
    public void canCountServicesAndLinks() {
        assertThat(stats.getServiceCount(), equalTo(11));
        assertThat(stats.getServiceCount(Direction.UP), equalTo(6));
        assertThat(stats.getServiceCount(Direction.DOWN), equalTo(5));
        assertThat(stats.getSequencedServiceCount(), equalTo(7));
        assertThat(stats.getVisibleServiceCount(), equalTo(7));
        assertThat(stats.getVisibleAcServiceCount(), equalTo(1));
        assertThat(stats.getLinkCount(), equalTo(7));
        assertThat(stats.getValidLinkCount(), equalTo(4));
        assertThat(stats.getConflictCount(), equalTo(2));
        assertThat(stats.getVisibleLinkCount(), equalTo(4));
    }

    @Test
    public void canRankLinksByLength() {
        assertThat(names(stats.getLongestLinks(2)), contains("A", "B"));
        assertThat(names(stats.getShortestLinks(1)), contains("E"));
        assertThat(names(stats.getShortestLinks(10)), contains("E", "F", "B", "A"));
    }

    @Test
    public void canListEventTimesAtStation() {
        TIntList times = stats.getEventTimes("Churchgate");
        assertArrayEquals(new int[] {320, 330, 330, 400, 570, 600, 1530, 1540, 1545}, times.toArray());
    }

    @Test
    public void canCountGaps() {
        // Gaps longer than an hour: 05:30 to 06:40, 06:40 to 09:30 and 10:00 to 01:30.
        assertThat(stats.countGaps("CHURCHGATE", 60, FilterQuery.DEFAULT_WINDOW_START,
            FilterQuery.DEFAULT_WINDOW_END), equalTo(3));
        assertThat(stats.countGaps("CHURCHGATE", 60, 300, 700), equalTo(2));
        assertThat(stats.countGaps("CHURCHGATE", 1000, 300, 700), equalTo(0));
        assertThat(stats.countGaps("ATLANTIS", 10, 300, 700), equalTo(0));
    }

    @Test
    public void onlyCountsVisibleEvents() {
        FilterQuery query = new FilterQuery(FilterType.STATION).between(300, 400);
        TimetableStats windowed = new TimetableStats(timetable, WTT.evaluate(timetable, query));
        assertArrayEquals(new int[] {320, 330, 330, 400}, windowed.getEventTimes("CHURCHGATE").toArray());
    }

    private static List<String> names(List<RakeLink> links) {
        return links.stream().map(l -> l.linkName).collect(Collectors.toList());
    }

}
