package at.sv.milkyway;

import at.sv.milkyway.ephemeris.SuncalcEphemerisProvider;
import at.sv.milkyway.ephemeris.SuncalcLunarProvider;
import at.sv.milkyway.rating.VisibilityRating;
import at.sv.milkyway.time.CachingTimezoneResolver;
import at.sv.milkyway.time.LongitudeTimezoneResolver;
import at.sv.milkyway.time.TimezoneResolver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Command(name = "MilkyWayPlanner", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false)
public final class MilkyWayPlanner implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(MilkyWayPlanner.class);
    static final int MAX_DAYS = 366;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180].")
    double longitude;
    @Option(names = "--elevation", paramLabel = "<meters>",
            defaultValue = "${env:ELEVATION:-0.0}",
            description = "The optional elevation (in meters) of your location, " +
                          "used to provide more accurate twilight and moon times.")
    double elevation;
    @Option(names = "--date", paramLabel = "<yyyy-MM-dd>",
            defaultValue = "${env:DATE}",
            description = "The calendar day the first night starts on. Default: today in the resolved zone.")
    LocalDate date;
    @Option(names = "--days", paramLabel = "<nights>",
            defaultValue = "${env:DAYS:-7}",
            description = "The number of consecutive nights to plan [1..366]. Default: ${DEFAULT-VALUE}")
    int days;
    @Option(names = "--zone", paramLabel = "<zone id>",
            defaultValue = "${env:ZONE}",
            description = "The IANA time zone of your location, e.g. Europe/Vienna. " +
                          "If omitted, a fixed offset is derived from the longitude.")
    String zone;
    @Option(names = "--quality-threshold", paramLabel = "<score>",
            defaultValue = "${env:QUALITY_THRESHOLD:-0.3}",
            description = "The minimum visibility score (0..1] for a period to count as a quality viewing period. " +
                          "Default: ${DEFAULT-VALUE}")
    double qualityThreshold;
    @Option(names = "--threads", paramLabel = "<threads>",
            defaultValue = "${env:THREADS:-1}",
            description = "The number of nights calculated in parallel. Default: ${DEFAULT-VALUE}")
    int threads;
    @Option(names = "--format", paramLabel = "<format>",
            defaultValue = "${env:FORMAT:-JSON}",
            description = "The output format, one of: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    OutputFormat format;

    public static void main(String[] args) {
        int execute = new CommandLine(new MilkyWayPlanner()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        try {
            assertConfigurationParameters();
            plan();
        } finally {
            MDC.remove("context");
        }
    }

    private void plan() {
        Location location = Location.of(latitude, longitude);
        TimezoneResolver timezoneResolver = createTimezoneResolver();
        ZoneId zoneId = timezoneResolver.resolve(location);
        LocalDate firstNight = date != null ? date : LocalDate.now(zoneId);
        LOG.info("Planning {} night(s) starting {} at {} ({})", days, firstNight, location, zoneId);

        NightReportCalculator calculator = NightReportCalculator.create(new SuncalcEphemerisProvider(elevation),
                new SuncalcLunarProvider(elevation), timezoneResolver, qualityThreshold);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<NightReport> reports = new NightCalendar(calculator, executor)
                    .calculate(firstNight, days, location, zoneId);
            print(reports, zoneId);
        } finally {
            executor.shutdownNow();
        }
    }

    private TimezoneResolver createTimezoneResolver() {
        if (zone != null) {
            ZoneId fixedZone = ZoneId.of(zone);
            return location -> fixedZone;
        }
        return CachingTimezoneResolver.withDefaultCache(new LongitudeTimezoneResolver());
    }

    private void assertConfigurationParameters() {
        assertGeographicConfigurations();
        assertPlanningConfigurations();
    }

    private void assertGeographicConfigurations() {
        if (latitude < -90 || latitude > 90 || Double.isNaN(latitude)) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180 || Double.isNaN(longitude)) {
            fail("--long must be between -180 and 180 degrees");
        }
        if (zone != null) {
            try {
                ZoneId.of(zone);
            } catch (DateTimeException e) {
                fail("--zone '" + zone + "' is not a valid time zone id");
            }
        }
    }

    private void assertPlanningConfigurations() {
        if (days < 1 || days > MAX_DAYS) {
            fail("--days must be within [1," + MAX_DAYS + "]");
        }
        if (qualityThreshold <= 0 || qualityThreshold > 1) {
            fail("--quality-threshold must be within (0,1]");
        }
        if (threads < 1) {
            fail("--threads must be > 0");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    private void print(List<NightReport> reports, ZoneId zoneId) {
        PrintWriter out = getOut();
        if (format == OutputFormat.TEXT) {
            reports.forEach(report -> out.println(toText(report, zoneId)));
        } else {
            out.println(toJson(reports));
        }
        out.flush();
    }

    private PrintWriter getOut() {
        if (spec != null) {
            return spec.commandLine().getOut();
        }
        return new PrintWriter(System.out);
    }

    static String toJson(List<NightReport> reports) {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        try {
            return mapper.writeValueAsString(reports);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize night reports: " + e.getLocalizedMessage(), e);
        }
    }

    static String toText(NightReport report, ZoneId zoneId) {
        VisibilityRating stars = report.getVisibilityRating();
        String window = report.getOptimalWindow().getStartTime() == null
                ? report.getOptimalWindow().getDescription()
                : FormatUtil.formatWindowStart(report.getOptimalWindow(), zoneId) + " for " +
                  FormatUtil.formatWindowDuration(report.getOptimalWindow()) + ", " +
                  report.getOptimalWindow().getDescription();
        return report.getDate() +
               " | rating " + report.getRating() + "/4: " + report.getReason() +
               " | " + stars.stars() + " stars: " + stars.description() +
               " | core rises " + FormatUtil.formatCoreRise(report.getGalacticCore(), zoneId) +
               ", dark overlap " + FormatUtil.formatDarkOverlap(report.getGalacticCore(), report.getNight()) +
               " | moon " + report.getMoon().getPhaseName() +
               " (" + Math.round(report.getMoon().getIllumination() * 100) + "%)" +
               " | window " + window;
    }

    enum OutputFormat {
        JSON, TEXT
    }
}
