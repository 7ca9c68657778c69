package at.sv.milkyway.window;

import at.sv.milkyway.scoring.VisibilitySample;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * A contiguous run of visibility samples.
 *
 * @param duration length in hours, from the first to the last sample
 */
public record QualityPeriod(ZonedDateTime start, ZonedDateTime end, double duration, double averageScore,
                            Quality quality) {

    /**
     * @param samples a non-empty list of chronologically ordered samples
     */
    public static QualityPeriod of(List<VisibilitySample> samples) {
        double sum = 0;
        for (VisibilitySample sample : samples) {
            sum += sample.score();
        }
        return of(samples.get(0), samples.get(samples.size() - 1), sum / samples.size());
    }

    static QualityPeriod of(VisibilitySample first, VisibilitySample last, double averageScore) {
        double duration = Duration.between(first.time(), last.time()).toMillis() / 3_600_000.0;
        return new QualityPeriod(first.time(), last.time(), duration, averageScore, Quality.of(averageScore));
    }

    /**
     * @return the ranking weight, favoring long periods of high quality
     */
    public double weight() {
        return averageScore * duration;
    }
}
