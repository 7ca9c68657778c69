package at.sv.milkyway.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import org.jetbrains.annotations.Nullable;

import java.time.ZonedDateTime;

@Data
@AllArgsConstructor
@Builder
public final class GalacticCoreState {

    private static final GalacticCoreState UNAVAILABLE = GalacticCoreState.builder().build();

    private final double altitude;
    private final double azimuth;
    /**
     * True if the core is at or above the altitude threshold at the requested time.
     */
    private final boolean visible;
    private final double altitudeThreshold;
    @Nullable
    private final ZonedDateTime riseTime;
    @Nullable
    private final ZonedDateTime transitTime;
    @Nullable
    private final ZonedDateTime setTime;

    /**
     * @return the neutral state used when the position could not be computed
     */
    public static GalacticCoreState unavailable() {
        return UNAVAILABLE;
    }

    public boolean hasRiseAndSet() {
        return riseTime != null && setTime != null;
    }
}
