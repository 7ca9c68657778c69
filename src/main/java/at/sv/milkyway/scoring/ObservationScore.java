package at.sv.milkyway.scoring;

import org.jetbrains.annotations.Nullable;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * @param bestTime the sample time with the highest score, {@code null} if nothing was scored
 * @param rating   0 (not visible) to 4 (excellent)
 * @param curve    all scored samples in chronological order
 * @param reason   human-readable explanation of the rating
 */
public record ObservationScore(@Nullable ZonedDateTime bestTime, int rating, List<VisibilitySample> curve,
                               String reason) {

    public ObservationScore {
        curve = List.copyOf(curve);
    }

    static ObservationScore notVisible(String reason) {
        return new ObservationScore(null, 0, List.of(), reason);
    }
}
