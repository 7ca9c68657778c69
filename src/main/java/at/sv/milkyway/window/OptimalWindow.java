package at.sv.milkyway.window;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import org.jetbrains.annotations.Nullable;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * The recommended observation interval. A missing start time signals that there is no viable window.
 */
@Data
@AllArgsConstructor
@Builder
public final class OptimalWindow {
    @Nullable
    private final ZonedDateTime startTime;
    @Nullable
    private final ZonedDateTime endTime;
    /**
     * In hours.
     */
    private final double duration;
    private final double averageScore;
    @Nullable
    private final ZonedDateTime bestTime;
    @Builder.Default
    private final List<QualityPeriod> qualityPeriods = List.of();
    private final String description;

    public static OptimalWindow empty(String description) {
        return OptimalWindow.builder().description(description).build();
    }

    public boolean isViable() {
        return startTime != null && duration > 0;
    }
}
