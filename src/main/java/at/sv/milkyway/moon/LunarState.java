package at.sv.milkyway.moon;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import org.jetbrains.annotations.Nullable;

import java.time.ZonedDateTime;

@Data
@AllArgsConstructor
@Builder
public final class LunarState {

    private static final LunarState UNAVAILABLE = LunarState.builder().build();

    /**
     * [0..1), 0 is new moon and 0.5 full moon.
     */
    private final double phase;
    /**
     * Illuminated fraction of the disk [0..1].
     */
    private final double illumination;
    private final double altitude;
    private final double azimuth;
    @Nullable
    private final ZonedDateTime rise;
    @Nullable
    private final ZonedDateTime set;

    public static LunarState unavailable() {
        return UNAVAILABLE;
    }

    public MoonPhaseName getPhaseName() {
        return MoonPhaseName.of(phase);
    }

    /**
     * @return 0 for no interference up to 1 for a full moon high in the sky
     */
    public double getInterference() {
        return MoonInterference.of(illumination, altitude);
    }
}
