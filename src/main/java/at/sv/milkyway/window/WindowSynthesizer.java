package at.sv.milkyway.window;

import at.sv.milkyway.scoring.VisibilitySample;
import org.jetbrains.annotations.Nullable;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a visibility curve into a single recommended observation window.
 */
public final class WindowSynthesizer {

    public static final double DEFAULT_QUALITY_THRESHOLD = 0.5;
    static final double MIN_PERIOD_HOURS = 0.25;
    static final double[] FALLBACK_MIN_DURATIONS = {0.25, 0.5, 1.0};
    /**
     * Average sample spacing of the scorer in minutes, used to estimate how many samples a duration spans.
     */
    private static final int AVERAGE_STEP_MINUTES = 8;

    /**
     * Synthesizes with {@link #DEFAULT_QUALITY_THRESHOLD}.
     */
    public OptimalWindow synthesize(@Nullable List<VisibilitySample> curve, @Nullable ZonedDateTime bestTime) {
        return synthesize(curve, bestTime, DEFAULT_QUALITY_THRESHOLD);
    }

    /**
     * Picks the period above the threshold with the highest {@code averageScore * duration}. If no period of at least
     * 15 minutes reaches the threshold, the best available period of at least 15, 30 or 60 minutes is reported
     * instead.
     *
     * @param curve     chronologically ordered samples
     * @param bestTime  the time of the best sample, reported as is
     * @param threshold the minimum score of a quality period
     * @return the window; never throws
     */
    public OptimalWindow synthesize(@Nullable List<VisibilitySample> curve, @Nullable ZonedDateTime bestTime,
                                    double threshold) {
        if (curve == null || curve.isEmpty()) {
            return OptimalWindow.empty("No viable observation time");
        }

        List<QualityPeriod> qualityPeriods = findQualityPeriods(curve, threshold);
        if (qualityPeriods.isEmpty()) {
            QualityPeriod bestPeriod = findBestAvailablePeriod(curve);
            if (bestPeriod == null) {
                return OptimalWindow.empty("Poor viewing conditions throughout");
            }
            return toWindow(bestPeriod, bestTime, List.of(bestPeriod),
                    "Limited viewing opportunity (" + bestPeriod.quality().label() + ")");
        }

        QualityPeriod primary = qualityPeriods.get(0);
        for (QualityPeriod period : qualityPeriods) {
            if (period.weight() > primary.weight()) {
                primary = period;
            }
        }
        return toWindow(primary, bestTime, qualityPeriods, primary.quality().capitalizedLabel() + " viewing window");
    }

    private static OptimalWindow toWindow(QualityPeriod period, ZonedDateTime bestTime, List<QualityPeriod> periods,
                                          String description) {
        return OptimalWindow.builder()
                            .startTime(period.start())
                            .endTime(period.end())
                            .duration(period.duration())
                            .averageScore(period.averageScore())
                            .bestTime(bestTime)
                            .qualityPeriods(periods)
                            .description(description)
                            .build();
    }

    /**
     * @return all maximal runs of samples with a score at or above the threshold lasting at least 15 minutes
     */
    List<QualityPeriod> findQualityPeriods(List<VisibilitySample> curve, double threshold) {
        List<QualityPeriod> periods = new ArrayList<>();
        List<VisibilitySample> current = new ArrayList<>();
        for (VisibilitySample sample : curve) {
            if (sample.score() >= threshold) {
                current.add(sample);
            } else {
                addIfLongEnough(periods, current);
                current = new ArrayList<>();
            }
        }
        addIfLongEnough(periods, current);
        return periods;
    }

    private static void addIfLongEnough(List<QualityPeriod> periods, List<VisibilitySample> samples) {
        if (samples.isEmpty()) {
            return;
        }
        QualityPeriod period = QualityPeriod.of(samples);
        if (period.duration() >= MIN_PERIOD_HOURS) {
            periods.add(period);
        }
    }

    QualityPeriod findBestAvailablePeriod(List<VisibilitySample> curve) {
        QualityPeriod bestPeriod = null;
        double bestWeight = 0;
        for (double minDuration : FALLBACK_MIN_DURATIONS) {
            QualityPeriod period = findBestPeriodWithMinDuration(curve, minDuration);
            if (period != null && period.weight() > bestWeight) {
                bestWeight = period.weight();
                bestPeriod = period;
            }
        }
        return bestPeriod;
    }

    /**
     * @return the sub-range of at least {@code minDurationHours} with the highest average score, or {@code null}
     */
    private static QualityPeriod findBestPeriodWithMinDuration(List<VisibilitySample> curve, double minDurationHours) {
        int minSamples = Math.max(1, (int) Math.floor(minDurationHours * 60 / AVERAGE_STEP_MINUTES));
        QualityPeriod bestPeriod = null;
        double bestScore = 0;
        for (int i = 0; i <= curve.size() - minSamples; i++) {
            double sum = 0;
            for (int j = i; j < curve.size(); j++) {
                sum += curve.get(j).score();
                if (j < i + minSamples - 1) {
                    continue;
                }
                double averageScore = sum / (j - i + 1);
                if (averageScore <= bestScore) {
                    continue;
                }
                QualityPeriod period = QualityPeriod.of(curve.get(i), curve.get(j), averageScore);
                if (period.duration() >= minDurationHours) {
                    bestScore = averageScore;
                    bestPeriod = period;
                }
            }
        }
        return bestPeriod;
    }
}
