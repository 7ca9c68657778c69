package at.sv.milkyway.scoring;

import lombok.Builder;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

import java.time.ZonedDateTime;
import java.util.function.ToDoubleFunction;

@Getter
@Builder
public final class ObservationInputs {
    private final double latitude;
    private final double longitude;
    private final ZonedDateTime date;
    @Nullable
    private final ZonedDateTime nightStart;
    @Nullable
    private final ZonedDateTime nightEnd;
    @Nullable
    private final ZonedDateTime moonRise;
    @Nullable
    private final ZonedDateTime moonSet;
    /**
     * Illuminated fraction of the moon [0..1].
     */
    private final double moonIllumination;
    @Nullable
    private final ZonedDateTime gcRise;
    @Nullable
    private final ZonedDateTime gcSet;
    /**
     * Altitude of the galactic core in degrees.
     */
    private final ToDoubleFunction<ZonedDateTime> gcAltitude;
    /**
     * Altitude of the moon in degrees.
     */
    private final ToDoubleFunction<ZonedDateTime> moonAltitude;
    /**
     * Angular separation between galactic core and moon in degrees.
     */
    private final ToDoubleFunction<ZonedDateTime> gcMoonAngle;
}
