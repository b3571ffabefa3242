package com.conveyal.wtt.loader;

import com.conveyal.wtt.model.Line;
import com.conveyal.wtt.model.SummaryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads rake-link declarations out of a {@link SummaryTable}. A declaration row has the link name in column 1 (one or
 * two capital letters, optionally followed by a dagger) and identifier cells from column 2 on. The line each service
 * runs on (FAST or SLOW) is written two rows below its identifier.
 */
public class SummaryParser {

    private static final Logger LOG = LoggerFactory.getLogger(SummaryParser.class);

    public static final int LINK_NAME_COLUMN = 1;
    public static final int FIRST_ID_COLUMN = 2;
    public static final int LINE_ROW_OFFSET = 2;

    private static final Pattern LINK_NAME_PATTERN = Pattern.compile("^\\s*([A-Z]{1,2})\\s*(?:†)?\\s*$");

    public List<SummaryEntry> parse (SummaryTable table) {
        List<SummaryEntry> entries = new ArrayList<>();
        for (int row = 0; row < table.rowCount(); row++) {
            String linkName = parseLinkName(table.cell(row, LINK_NAME_COLUMN));
            if (linkName == null) continue;
            List<String> ids = new ArrayList<>();
            List<Line> lines = new ArrayList<>();
            for (int column = FIRST_ID_COLUMN; column < table.columnCount(row); column++) {
                String id = ServiceExtractor.parseIdentifier(table.cell(row, column));
                if (id == null) continue;
                ids.add(id);
                lines.add(parseLine(table.cell(row + LINE_ROW_OFFSET, column)));
            }
            if (ids.isEmpty()) continue;
            entries.add(new SummaryEntry(linkName, ids, lines));
        }
        LOG.info("Read {} rake-link declarations from the summary.", entries.size());
        return entries;
    }

    /** @return the link name without its dagger, or null if the cell does not name a link. */
    public static String parseLinkName (String cell) {
        if (cell == null) return null;
        Matcher matcher = LINK_NAME_PATTERN.matcher(cell.trim().toUpperCase());
        return matcher.matches() ? matcher.group(1) : null;
    }

    private static Line parseLine (String cell) {
        String upper = cell.toUpperCase();
        if (upper.contains("FAST")) return Line.FAST;
        if (upper.contains("SLOW")) return Line.SLOW;
        return null;
    }

}
