package at.sv.milkyway.scoring;

import at.sv.milkyway.Location;
import at.sv.milkyway.ephemeris.EphemerisProvider;
import at.sv.milkyway.ephemeris.EquatorialCoordinate;
import at.sv.milkyway.ephemeris.HorizontalPosition;
import at.sv.milkyway.ephemeris.LunarProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;
import java.util.function.ToDoubleFunction;

/**
 * Time dependent altitude and separation functions for the observation scorer, backed by the ephemeris adapters.
 */
@Slf4j
public final class SkyFunctions {

    private final EphemerisProvider ephemeris;
    private final LunarProvider lunarProvider;
    private final EquatorialCoordinate target;

    public SkyFunctions(EphemerisProvider ephemeris, LunarProvider lunarProvider) {
        this(ephemeris, lunarProvider, EquatorialCoordinate.GALACTIC_CENTER);
    }

    public SkyFunctions(EphemerisProvider ephemeris, LunarProvider lunarProvider, EquatorialCoordinate target) {
        this.ephemeris = ephemeris;
        this.lunarProvider = lunarProvider;
        this.target = target;
    }

    public ToDoubleFunction<ZonedDateTime> gcAltitude(Location location) {
        return time -> ephemeris.horizontalPosition(time, location, target).altitude();
    }

    /**
     * @return the moon altitude, or 0 if it could not be computed
     */
    public ToDoubleFunction<ZonedDateTime> moonAltitude(Location location) {
        return time -> {
            try {
                return lunarProvider.moonPosition(time, location).altitude();
            } catch (Exception e) {
                log.error("Failed to calculate moon altitude at {}: {}", time, e.getLocalizedMessage(), e);
                return 0;
            }
        };
    }

    /**
     * @return the angular separation between moon and target, or 0 if it could not be computed
     */
    public ToDoubleFunction<ZonedDateTime> gcMoonAngle(Location location) {
        return time -> {
            try {
                HorizontalPosition moon = lunarProvider.moonPosition(time, location);
                HorizontalPosition core = ephemeris.horizontalPosition(time, location, target);
                return moon.angularSeparation(core);
            } catch (Exception e) {
                log.error("Failed to calculate moon separation at {}: {}", time, e.getLocalizedMessage(), e);
                return 0;
            }
        };
    }
}
