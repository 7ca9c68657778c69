package at.sv.milkyway.scoring;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Integrates the observation quality over the intersection of astronomical night and galactic core visibility.
 * <p>
 * Each sample scores 1.0 if the moon is down. A moon brighter than 60% caps the score at {@code (1-illumination)*0.2},
 * a dimmer one scales {@code 1-illumination} by its angular distance to the core (full effect at 90°).
 * Samples are two minutes apart within 30 minutes of the window edges and eight minutes apart in between.
 */
@Slf4j
public final class ObservationScorer {

    public static final String NEVER_VISIBLE_AT_LATITUDE = "Galactic Center never visible at this latitude";
    public static final String NO_ASTRONOMICAL_DARKNESS = "No astronomical darkness (sun never reaches -18°)";
    public static final String DOES_NOT_RISE = "Galactic Center does not rise above 15°";
    public static final String WINDOW_TOO_SHORT = "Observation window too short (< 30 minutes)";
    public static final String NO_TIME_ABOVE_CUTOFF = "No observation time when Galactic Center is above 15°";
    public static final String SCORING_FAILED = "Observation score could not be computed";

    static final double MAX_LATITUDE = 61;
    static final double ALTITUDE_CUTOFF = 15;
    static final double MIN_WINDOW_MINUTES = 30;
    static final double FULL_WINDOW_MINUTES = 120;
    static final double MIN_LENGTH_MULTIPLIER = 0.7;
    static final double BRIGHT_MOON_ILLUMINATION = 0.6;

    private static final int EDGE_SPAN_MINUTES = 30;
    private static final int EDGE_STEP_MINUTES = 2;
    private static final int MIDDLE_STEP_MINUTES = 8;

    private final RatingRules ratingRules;

    public ObservationScorer() {
        this(RatingRules.DEFAULT);
    }

    public ObservationScorer(RatingRules ratingRules) {
        this.ratingRules = ratingRules;
    }

    /**
     * @return the rating with its visibility curve; never throws
     */
    public ObservationScore score(ObservationInputs inputs) {
        try {
            return computeScore(inputs);
        } catch (Exception e) {
            log.error("Failed to compute observation score for {}: {}", inputs.getDate(), e.getLocalizedMessage(), e);
            return ObservationScore.notVisible(SCORING_FAILED);
        }
    }

    private ObservationScore computeScore(ObservationInputs inputs) {
        if (Math.abs(inputs.getLatitude()) > MAX_LATITUDE) {
            return ObservationScore.notVisible(NEVER_VISIBLE_AT_LATITUDE);
        }
        if (inputs.getNightStart() == null || inputs.getNightEnd() == null) {
            return ObservationScore.notVisible(NO_ASTRONOMICAL_DARKNESS);
        }
        if (inputs.getGcRise() == null || inputs.getGcSet() == null) {
            return ObservationScore.notVisible(DOES_NOT_RISE);
        }

        ZonedDateTime windowStart = latest(inputs.getNightStart(), inputs.getGcRise());
        ZonedDateTime windowEnd = earliest(inputs.getNightEnd(), inputs.getGcSet());
        double windowLengthMinutes = Duration.between(windowStart, windowEnd).toMillis() / 60_000.0;
        if (windowLengthMinutes < MIN_WINDOW_MINUTES) {
            return ObservationScore.notVisible(WINDOW_TOO_SHORT);
        }

        List<VisibilitySample> curve = new ArrayList<>();
        double accumulatedScore = 0;
        double totalMinutes = 0;
        ZonedDateTime bestTime = null;
        double bestScore = Double.NEGATIVE_INFINITY;

        for (Segment segment : createSegments(windowStart, windowEnd)) {
            for (ZonedDateTime t = segment.start(); !t.isAfter(segment.end()); t = t.plusMinutes(segment.step())) {
                double altitudeGC = inputs.getGcAltitude().applyAsDouble(t);
                if (altitudeGC < ALTITUDE_CUTOFF) {
                    continue;
                }
                double moonAltitude = inputs.getMoonAltitude().applyAsDouble(t);
                double moonAngle = inputs.getGcMoonAngle().applyAsDouble(t);
                double score = sampleScore(moonAltitude, inputs.getMoonIllumination(), moonAngle);

                curve.add(new VisibilitySample(t, score, altitudeGC, moonAltitude, moonAngle));
                accumulatedScore += score * segment.step();
                totalMinutes += segment.step();
                if (score > bestScore) {
                    bestScore = score;
                    bestTime = t;
                }
            }
        }

        if (totalMinutes == 0) {
            return new ObservationScore(null, 0, curve, NO_TIME_ABOVE_CUTOFF);
        }

        double averageScore = accumulatedScore / totalMinutes;
        double finalScore = averageScore * lengthMultiplier(windowLengthMinutes);
        RatingRules.Rated rated = ratingRules.evaluate(
                new ScoreSummary(inputs.getMoonIllumination(), windowLengthMinutes, averageScore, finalScore));
        log.debug("Scored {} samples between {} and {}: average={}, final={}, rating={}", curve.size(), windowStart,
                windowEnd, averageScore, finalScore, rated.rating());
        return new ObservationScore(bestTime, rated.rating(), curve, rated.reason());
    }

    static double sampleScore(double moonAltitude, double moonIllumination, double moonAngle) {
        if (moonAltitude <= 0) {
            return 1.0;
        }
        if (moonIllumination > BRIGHT_MOON_ILLUMINATION) {
            return (1 - moonIllumination) * 0.2;
        }
        return (1 - moonIllumination) * Math.min(moonAngle / 90, 1.0);
    }

    /**
     * Scales linearly from 0.7 for a 30 minute window up to 1.0 for two hours or more.
     */
    static double lengthMultiplier(double windowLengthMinutes) {
        double scaled = (windowLengthMinutes - MIN_WINDOW_MINUTES) / (FULL_WINDOW_MINUTES - MIN_WINDOW_MINUTES)
                        * (1 - MIN_LENGTH_MULTIPLIER) + MIN_LENGTH_MULTIPLIER;
        return Math.max(MIN_LENGTH_MULTIPLIER, Math.min(scaled, 1));
    }

    private static List<Segment> createSegments(ZonedDateTime windowStart, ZonedDateTime windowEnd) {
        List<Segment> segments = new ArrayList<>();
        addSegment(segments, windowStart, windowStart.plusMinutes(EDGE_SPAN_MINUTES), EDGE_STEP_MINUTES);
        addSegment(segments, windowStart.plusMinutes(EDGE_SPAN_MINUTES), windowEnd.minusMinutes(EDGE_SPAN_MINUTES),
                MIDDLE_STEP_MINUTES);
        addSegment(segments, windowEnd.minusMinutes(EDGE_SPAN_MINUTES), windowEnd, EDGE_STEP_MINUTES);
        return segments;
    }

    private static void addSegment(List<Segment> segments, ZonedDateTime start, ZonedDateTime end, int step) {
        if (end.isAfter(start)) {
            segments.add(new Segment(start, end, step));
        }
    }

    private static ZonedDateTime latest(ZonedDateTime a, ZonedDateTime b) {
        return a.isAfter(b) ? a : b;
    }

    private static ZonedDateTime earliest(ZonedDateTime a, ZonedDateTime b) {
        return a.isBefore(b) ? a : b;
    }

    private record Segment(ZonedDateTime start, ZonedDateTime end, int step) {
    }
}
