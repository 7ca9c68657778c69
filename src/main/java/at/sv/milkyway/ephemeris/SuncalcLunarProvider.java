package at.sv.milkyway.ephemeris;

import at.sv.milkyway.Location;
import org.shredzone.commons.suncalc.MoonIllumination;
import org.shredzone.commons.suncalc.MoonPosition;
import org.shredzone.commons.suncalc.MoonTimes;

import java.time.LocalTime;
import java.time.ZonedDateTime;

public final class SuncalcLunarProvider implements LunarProvider {

    private final double elevation;

    public SuncalcLunarProvider() {
        this(0);
    }

    public SuncalcLunarProvider(double elevation) {
        this.elevation = elevation;
    }

    @Override
    public HorizontalPosition moonPosition(ZonedDateTime time, Location location) {
        MoonPosition position = MoonPosition.compute()
                                            .at(location.lat(), location.lng())
                                            .elevation(elevation)
                                            .on(time)
                                            .execute();
        return HorizontalPosition.of(position.getAltitude(), position.getAzimuth());
    }

    @Override
    public Illumination moonIllumination(ZonedDateTime time) {
        MoonIllumination illumination = MoonIllumination.compute().on(time).execute();
        double fraction = illumination.getFraction();
        if (Double.isNaN(fraction)) {
            throw new EphemerisFailure("Invalid moon illumination at " + time);
        }
        return new Illumination(toPhase(illumination.getPhase()), Math.max(0, Math.min(1, fraction)));
    }

    /**
     * Converts the suncalc phase angle (-180° new moon, -90° first quarter, 0° full moon, 90° last quarter).
     */
    private static double toPhase(double phaseAngle) {
        double phase = (phaseAngle + 180.0) / 360.0;
        phase = phase - Math.floor(phase);
        return phase >= 1.0 ? 0.0 : phase;
    }

    @Override
    public RiseSet moonTimes(ZonedDateTime day, Location location) {
        MoonTimes times = MoonTimes.compute()
                                   .at(location.lat(), location.lng())
                                   .elevation(elevation)
                                   .on(day.with(LocalTime.MIDNIGHT))
                                   .oneDay()
                                   .execute();
        return new RiseSet(times.getRise(), times.getSet());
    }
}
