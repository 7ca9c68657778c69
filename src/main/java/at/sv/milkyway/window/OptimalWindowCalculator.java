package at.sv.milkyway.window;

import at.sv.milkyway.Location;
import at.sv.milkyway.core.GalacticCoreState;
import at.sv.milkyway.moon.LunarState;
import at.sv.milkyway.scoring.ObservationInputs;
import at.sv.milkyway.scoring.ObservationScore;
import at.sv.milkyway.scoring.SkyFunctions;
import at.sv.milkyway.time.NightWindow;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Combines the located states with the observation score into the recommended window for one night.
 */
@Slf4j
public final class OptimalWindowCalculator {

    static final String NO_OPPORTUNITY = "No viewing opportunity available";
    static final String BASIC_OVERLAP_ONLY = "Poor viewing conditions (basic time overlap only)";
    static final double BASIC_OVERLAP_SCORE = 0.1;
    private static final Duration ASSUMED_VISIBILITY = Duration.ofHours(8);

    private final SkyFunctions skyFunctions;
    private final WindowSynthesizer synthesizer;

    public OptimalWindowCalculator(SkyFunctions skyFunctions, WindowSynthesizer synthesizer) {
        this.skyFunctions = skyFunctions;
        this.synthesizer = synthesizer;
    }

    public ObservationInputs createInputs(Location location, ZonedDateTime date, GalacticCoreState core,
                                          LunarState moon, NightWindow night) {
        return ObservationInputs.builder()
                                .latitude(location.lat())
                                .longitude(location.lng())
                                .date(date)
                                .nightStart(night.getNight())
                                .nightEnd(night.getDayEnd())
                                .moonRise(moon.getRise())
                                .moonSet(moon.getSet())
                                .moonIllumination(moon.getIllumination())
                                .gcRise(core.getRiseTime())
                                .gcSet(core.getSetTime())
                                .gcAltitude(skyFunctions.gcAltitude(location))
                                .moonAltitude(skyFunctions.moonAltitude(location))
                                .gcMoonAngle(skyFunctions.gcMoonAngle(location))
                                .build();
    }

    /**
     * Falls back to the plain overlap of darkness and core visibility, flagged with a low score, if the scored curve
     * does not yield a window.
     */
    public OptimalWindow calculate(ObservationScore score, GalacticCoreState core, NightWindow night,
                                   double qualityThreshold) {
        if (core.getRiseTime() == null || !night.hasDarkness()) {
            return OptimalWindow.empty(NO_OPPORTUNITY);
        }

        OptimalWindow integrated = core.getSetTime() == null
                ? OptimalWindow.empty(NO_OPPORTUNITY)
                : synthesizer.synthesize(score.curve(), score.bestTime(), qualityThreshold);
        if (integrated.isViable()) {
            return integrated;
        }

        ZonedDateTime coreEnd = core.getSetTime() != null ? core.getSetTime() : core.getRiseTime().plus(ASSUMED_VISIBILITY);
        ZonedDateTime windowStart = latest(core.getRiseTime(), night.getNight());
        ZonedDateTime windowEnd = earliest(coreEnd, night.getDayEnd());
        if (!windowStart.isBefore(windowEnd)) {
            return integrated;
        }
        log.debug("No quality window found, using basic overlap {} - {}", windowStart, windowEnd);
        return OptimalWindow.builder()
                            .startTime(windowStart)
                            .endTime(windowEnd)
                            .duration(Duration.between(windowStart, windowEnd).toMillis() / 3_600_000.0)
                            .averageScore(BASIC_OVERLAP_SCORE)
                            .bestTime(integrated.getBestTime())
                            .qualityPeriods(List.of())
                            .description(BASIC_OVERLAP_ONLY)
                            .build();
    }

    private static ZonedDateTime latest(ZonedDateTime a, ZonedDateTime b) {
        return a.isAfter(b) ? a : b;
    }

    private static ZonedDateTime earliest(ZonedDateTime a, ZonedDateTime b) {
        return a.isBefore(b) ? a : b;
    }
}
