package at.sv.milkyway;

import at.sv.milkyway.core.GalacticCoreLocator;
import at.sv.milkyway.core.GalacticCoreState;
import at.sv.milkyway.ephemeris.EphemerisProvider;
import at.sv.milkyway.ephemeris.LunarProvider;
import at.sv.milkyway.moon.LunarLocator;
import at.sv.milkyway.moon.LunarState;
import at.sv.milkyway.rating.VisibilityRating;
import at.sv.milkyway.rating.VisibilityRatingConverter;
import at.sv.milkyway.scoring.ObservationScore;
import at.sv.milkyway.scoring.ObservationScorer;
import at.sv.milkyway.scoring.SkyFunctions;
import at.sv.milkyway.time.NightWindow;
import at.sv.milkyway.time.TimezoneResolver;
import at.sv.milkyway.time.TwilightLocator;
import at.sv.milkyway.window.OptimalWindow;
import at.sv.milkyway.window.OptimalWindowCalculator;
import at.sv.milkyway.window.WindowSynthesizer;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Runs the locators, the scorer and both rating paths for a single night.
 */
@Slf4j
public final class NightReportCalculator {

    /**
     * Used as reference time if there is no astronomical dusk.
     */
    static final LocalTime EVENING = LocalTime.of(18, 0);

    private final GalacticCoreLocator coreLocator;
    private final LunarLocator lunarLocator;
    private final TwilightLocator twilightLocator;
    private final SkyFunctions skyFunctions;
    private final ObservationScorer scorer;
    private final OptimalWindowCalculator windowCalculator;
    private final VisibilityRatingConverter ratingConverter;
    private final double qualityThreshold;

    public NightReportCalculator(GalacticCoreLocator coreLocator, LunarLocator lunarLocator,
                                 TwilightLocator twilightLocator, SkyFunctions skyFunctions, ObservationScorer scorer,
                                 OptimalWindowCalculator windowCalculator, VisibilityRatingConverter ratingConverter,
                                 double qualityThreshold) {
        this.coreLocator = coreLocator;
        this.lunarLocator = lunarLocator;
        this.twilightLocator = twilightLocator;
        this.skyFunctions = skyFunctions;
        this.scorer = scorer;
        this.windowCalculator = windowCalculator;
        this.ratingConverter = ratingConverter;
        this.qualityThreshold = qualityThreshold;
    }

    public static NightReportCalculator create(EphemerisProvider ephemeris, LunarProvider lunarProvider,
                                               TimezoneResolver timezoneResolver, double qualityThreshold) {
        SkyFunctions skyFunctions = new SkyFunctions(ephemeris, lunarProvider);
        return new NightReportCalculator(
                new GalacticCoreLocator(ephemeris),
                new LunarLocator(lunarProvider),
                new TwilightLocator(ephemeris),
                skyFunctions,
                new ObservationScorer(),
                new OptimalWindowCalculator(skyFunctions, new WindowSynthesizer()),
                new VisibilityRatingConverter(timezoneResolver),
                qualityThreshold);
    }

    /**
     * The galactic core and the moon are located relative to astronomical dusk, so that the first rise found is the
     * one relevant for the coming night.
     *
     * @param date the calendar day on which the night starts
     * @param zone the zone the calendar day is interpreted in
     */
    public NightReport calculate(LocalDate date, Location location, ZoneId zone) {
        NightWindow night = twilightLocator.locate(date.atTime(LocalTime.NOON).atZone(zone), location);
        ZonedDateTime reference = night.getNight() != null ? night.getNight() : date.atTime(EVENING).atZone(zone);
        log.trace("Twilight for {}:\n{}", date, twilightLocator.toDebugString(night));

        GalacticCoreState core = coreLocator.locate(reference, location);
        LunarState moon = lunarLocator.locate(reference, location);
        ObservationScore observation = scorer.score(
                windowCalculator.createInputs(location, reference, core, moon, night));
        OptimalWindow window = windowCalculator.calculate(observation, core, night, qualityThreshold);
        VisibilityRating visibilityRating = ratingConverter.convert(getCoreAltitude(core, window, location), moon,
                night, window, location);
        log.debug("{}: rating={} ({}), stars={}, window={}", date, observation.rating(), observation.reason(),
                visibilityRating.stars(), window.getDescription());

        return NightReport.builder()
                          .date(date)
                          .location(location)
                          .zone(zone)
                          .galacticCore(core)
                          .moon(moon)
                          .night(night)
                          .observation(observation)
                          .optimalWindow(window)
                          .visibilityRating(visibilityRating)
                          .build();
    }

    private double getCoreAltitude(GalacticCoreState core, OptimalWindow window, Location location) {
        if (window.getStartTime() == null) {
            return core.getAltitude();
        }
        try {
            return skyFunctions.gcAltitude(location).applyAsDouble(window.getStartTime());
        } catch (Exception e) {
            log.error("Failed to calculate core altitude at window start {}: {}", window.getStartTime(),
                    e.getLocalizedMessage(), e);
            return core.getAltitude();
        }
    }
}
