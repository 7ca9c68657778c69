package at.sv.milkyway.time;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * The dark period between astronomical dusk of a day and astronomical dawn of the following day.
 */
@Data
@AllArgsConstructor
@Builder
public final class NightWindow {

    private static final NightWindow NO_DARKNESS = NightWindow.builder().build();

    /**
     * Astronomical dusk, the sun descending through -18°.
     */
    @Nullable
    private final ZonedDateTime night;
    /**
     * Astronomical dawn of the following calendar day.
     */
    @Nullable
    private final ZonedDateTime dayEnd;
    @Nullable
    private final ZonedDateTime civilDusk;
    @Nullable
    private final ZonedDateTime civilDawn;

    public static NightWindow noDarkness() {
        return NO_DARKNESS;
    }

    public boolean hasDarkness() {
        return night != null && dayEnd != null;
    }

    /**
     * @return the hours between dusk and dawn, or 0 if there is no astronomical night
     */
    public double getDarkDuration() {
        if (!hasDarkness()) {
            return 0;
        }
        return calculateDarkDuration(night, dayEnd);
    }

    /**
     * @return the hours from {@code dusk} to {@code dawn}, adding a full day if dawn is not after dusk
     */
    public static double calculateDarkDuration(ZonedDateTime dusk, ZonedDateTime dawn) {
        long millis = Duration.between(dusk, dawn).toMillis();
        if (millis <= 0) {
            millis += Duration.ofDays(1).toMillis();
        }
        return millis / 3_600_000.0;
    }
}
