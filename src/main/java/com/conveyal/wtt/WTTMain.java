package com.conveyal.wtt;

import com.conveyal.wtt.filter.FilterQuery;
import com.conveyal.wtt.filter.FilterType;
import com.conveyal.wtt.loader.GridCsvReader;
import com.conveyal.wtt.loader.StationDirectory;
import com.conveyal.wtt.model.Direction;
import com.conveyal.wtt.model.RakeLink;
import com.conveyal.wtt.stats.TimetableStats;
import com.conveyal.wtt.util.json.JsonManager;
import com.conveyal.wtt.validator.ValidationResult;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static com.conveyal.wtt.util.Util.humanKm;

public class WTTMain {

    private static final Logger LOG = LoggerFactory.getLogger(WTTMain.class);

    public static void main (String[] args) throws Exception {
        Options options = getOptions();
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse( options, args);
        String[] arguments = cmd.getArgs();
        if (cmd.hasOption("help")) {
            printHelp(options);
            return;
        }
        if (arguments.length < 3) {
            System.out.println("Please specify the UP grid, the DOWN grid and the rake-link summary.");
            printHelp(options);
            System.exit(1);
        }

        StationDirectory directory;
        if (cmd.hasOption("stations")) {
            try (InputStream in = new FileInputStream(cmd.getOptionValue("stations"))) {
                directory = StationDirectory.fromJson(in);
            }
        } else {
            directory = StationDirectory.westernSuburban();
        }

        Timetable timetable = WTT.reconcile(
            GridCsvReader.readGrid(new File(arguments[0]), Direction.UP),
            GridCsvReader.readGrid(new File(arguments[1]), Direction.DOWN),
            GridCsvReader.readSummary(new File(arguments[2])),
            directory
        );

        FilterQuery query = new FilterQuery(FilterType.RAKELINK);
        TimetableStats stats = new TimetableStats(timetable, WTT.evaluate(timetable, query));
        LOG.info("  {} services ({} up, {} down), {} sequenced", stats.getServiceCount(),
            stats.getServiceCount(Direction.UP), stats.getServiceCount(Direction.DOWN),
            stats.getSequencedServiceCount());
        LOG.info("  {} rake-links, {} valid, {} conflicts", stats.getLinkCount(), stats.getValidLinkCount(),
            stats.getConflictCount());
        for (RakeLink link : stats.getLongestLinks(3)) {
            LOG.info("  longest: {} ({})", link.linkName, humanKm(link.lengthKm));
        }
        for (RakeLink link : stats.getShortestLinks(3)) {
            LOG.info("  shortest: {} ({})", link.linkName, humanKm(link.lengthKm));
        }

        if (cmd.hasOption("json")) {
            JsonManager<ValidationResult> json = new JsonManager<>(ValidationResult.class);
            String resultString = json.writePretty(timetable.getValidationResult());
            File resultFile = new File(cmd.getOptionValue("json"));
            FileUtils.writeStringToFile(resultFile, resultString, StandardCharsets.UTF_8);
            LOG.info("Storing validation result at: {}", resultFile.getAbsolutePath());
        }
        if (cmd.hasOption("report")) {
            System.out.print(WTT.discrepancyReport(timetable, query));
        }
    }

    private static void printHelp(Options options) {
        final String HELP = String.join("\n",
                "java -jar wtt-lib.jar [options] UP.csv DOWN.csv SUMMARY.csv",
                "Reconcile a working timetable (both directions, exported as CSV) with its",
                "rake-link summary and report the links that do not agree.",
                "", // blank lines for legibility
                ""
        );
        HelpFormatter formatter = new HelpFormatter();
        System.out.println(); // blank line for legibility
        formatter.printHelp( HELP, options );
        System.out.println(); // blank line for legibility
    }

    private static Options getOptions () {
        Options options = new Options();
        Option help = new Option("help", false, "print this message");
        Option stations = new Option("stations", true, "read the station directory from a JSON file instead of the built-in Western Railway one");
        Option json = new Option("json", true, "write the validation result as JSON to the given file");
        Option report = new Option("report", false, "print the rake-link discrepancy report");
        options.addOption(help);
        options.addOption(stations);
        options.addOption(json);
        options.addOption(report);
        return options;
    }

}
