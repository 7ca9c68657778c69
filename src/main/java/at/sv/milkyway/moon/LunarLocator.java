package at.sv.milkyway.moon;

import at.sv.milkyway.Location;
import at.sv.milkyway.ephemeris.HorizontalPosition;
import at.sv.milkyway.ephemeris.Illumination;
import at.sv.milkyway.ephemeris.LunarProvider;
import at.sv.milkyway.ephemeris.RiseSet;
import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;

@Slf4j
public final class LunarLocator {

    private static final double NEW_MOON_FRACTION = 0.01;
    private static final double FULL_MOON_FRACTION = 0.99;

    private final LunarProvider lunarProvider;

    public LunarLocator(LunarProvider lunarProvider) {
        this.lunarProvider = lunarProvider;
    }

    /**
     * @return the moon state at the given time; never throws, failures result in {@link LunarState#unavailable()}
     */
    public LunarState locate(ZonedDateTime date, Location location) {
        try {
            HorizontalPosition position = lunarProvider.moonPosition(date, location);
            Illumination illumination = lunarProvider.moonIllumination(date);
            RiseSet riseSet = findRiseAndSet(date, location);
            return LunarState.builder()
                             .phase(normalizePhase(illumination))
                             .illumination(illumination.fraction())
                             .altitude(position.altitude())
                             .azimuth(position.azimuth())
                             .rise(riseSet.rise())
                             .set(riseSet.set())
                             .build();
        } catch (Exception e) {
            log.error("Failed to calculate moon data for {} at {}: {}", date, location, e.getLocalizedMessage(), e);
            return LunarState.unavailable();
        }
    }

    private static double normalizePhase(Illumination illumination) {
        if (illumination.fraction() < NEW_MOON_FRACTION) {
            return 0;
        }
        if (illumination.fraction() > FULL_MOON_FRACTION) {
            return 0.5;
        }
        return illumination.phase();
    }

    /**
     * Pairs the rise of the given day with the following set, so that the set is always after the rise.
     */
    private RiseSet findRiseAndSet(ZonedDateTime date, Location location) {
        RiseSet today = lunarProvider.moonTimes(date, location);
        ZonedDateTime rise = today.rise();
        ZonedDateTime set = today.set();
        if (rise == null && set != null) {
            rise = lunarProvider.moonTimes(date.minusDays(1), location).rise();
        }
        if (rise != null && (set == null || set.isBefore(rise))) {
            set = lunarProvider.moonTimes(date.plusDays(1), location).set();
        }
        if (rise != null && set != null && !set.isAfter(rise)) {
            log.debug("Dropping moon set {} as it does not follow rise {}", set, rise);
            set = null;
        }
        return new RiseSet(rise, set);
    }
}
