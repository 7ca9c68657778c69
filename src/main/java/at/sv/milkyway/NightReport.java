package at.sv.milkyway;

import at.sv.milkyway.core.GalacticCoreState;
import at.sv.milkyway.moon.LunarState;
import at.sv.milkyway.rating.VisibilityRating;
import at.sv.milkyway.scoring.ObservationScore;
import at.sv.milkyway.time.NightWindow;
import at.sv.milkyway.window.OptimalWindow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Everything computed for the night starting on {@link #date}.
 */
@Data
@AllArgsConstructor
@Builder
public final class NightReport {
    private final LocalDate date;
    private final Location location;
    private final ZoneId zone;
    private final GalacticCoreState galacticCore;
    private final LunarState moon;
    private final NightWindow night;
    private final ObservationScore observation;
    private final OptimalWindow optimalWindow;
    /**
     * Point based alternative to the observation rating.
     */
    private final VisibilityRating visibilityRating;

    public int getRating() {
        return observation.rating();
    }

    public String getReason() {
        return observation.reason();
    }
}
