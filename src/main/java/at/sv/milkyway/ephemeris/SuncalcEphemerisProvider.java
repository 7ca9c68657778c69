package at.sv.milkyway.ephemeris;

import at.sv.milkyway.Location;
import org.shredzone.commons.suncalc.MoonPosition;
import org.shredzone.commons.suncalc.MoonTimes;
import org.shredzone.commons.suncalc.SunTimes;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * Ephemeris backed by commons-suncalc for sun and moon events. Fixed stars are converted to horizontal coordinates
 * via Greenwich mean sidereal time and the local hour angle.
 */
public final class SuncalcEphemerisProvider implements EphemerisProvider {

    private static final double J1970 = 2440587.5;
    private static final double J2000 = 2451545.0;
    private static final double DAY_MS = 86_400_000.0;
    private static final int MOON_SCAN_STEP_MINUTES = 10;

    private final double elevation;

    public SuncalcEphemerisProvider() {
        this(0);
    }

    /**
     * @param elevation the elevation of the observer in meters
     */
    public SuncalcEphemerisProvider(double elevation) {
        this.elevation = elevation;
    }

    @Override
    public HorizontalPosition horizontalPosition(ZonedDateTime time, Location location, EquatorialCoordinate coordinate) {
        double phi = Math.toRadians(location.lat());
        double dec = Math.toRadians(coordinate.declination());
        double localSiderealDeg = siderealDegrees(time) + location.lng();
        double hourAngle = Math.toRadians(localSiderealDeg - coordinate.rightAscension() * 15.0);

        double altitude = Math.asin(Math.sin(phi) * Math.sin(dec) + Math.cos(phi) * Math.cos(dec) * Math.cos(hourAngle));
        double azimuth = Math.atan2(-Math.cos(dec) * Math.sin(hourAngle),
                Math.sin(dec) * Math.cos(phi) - Math.cos(dec) * Math.sin(phi) * Math.cos(hourAngle));
        return HorizontalPosition.of(Math.toDegrees(altitude), Math.toDegrees(azimuth));
    }

    @Override
    public ZonedDateTime searchAltitudeCrossing(Body body, Location location, Direction direction, ZonedDateTime start,
                                                int maxDays, double targetAltitude) {
        return switch (body) {
            case SUN -> searchSunCrossing(location, direction, start, maxDays, targetAltitude);
            case MOON -> searchMoonCrossing(location, direction, start, maxDays, targetAltitude);
        };
    }

    private ZonedDateTime searchSunCrossing(Location location, Direction direction, ZonedDateTime start, int maxDays,
                                            double targetAltitude) {
        SunTimes times = SunTimes.compute()
                                 .at(location.lat(), location.lng())
                                 .elevation(elevation)
                                 .on(start)
                                 .twilight(targetAltitude)
                                 .limit(Duration.ofDays(maxDays))
                                 .execute();
        return direction == Direction.RISE ? times.getRise() : times.getSet();
    }

    private ZonedDateTime searchMoonCrossing(Location location, Direction direction, ZonedDateTime start, int maxDays,
                                             double targetAltitude) {
        if (targetAltitude == 0) {
            MoonTimes times = MoonTimes.compute()
                                       .at(location.lat(), location.lng())
                                       .elevation(elevation)
                                       .on(start)
                                       .limit(Duration.ofDays(maxDays))
                                       .execute();
            return direction == Direction.RISE ? times.getRise() : times.getSet();
        }
        return scanMoonCrossing(location, direction, start, maxDays, targetAltitude);
    }

    private ZonedDateTime scanMoonCrossing(Location location, Direction direction, ZonedDateTime start, int maxDays,
                                           double targetAltitude) {
        int steps = maxDays * 24 * 60 / MOON_SCAN_STEP_MINUTES;
        double previous = moonAltitude(start, location);
        for (int i = 1; i <= steps; i++) {
            ZonedDateTime time = start.plusMinutes((long) i * MOON_SCAN_STEP_MINUTES);
            double current = moonAltitude(time, location);
            boolean rising = previous < targetAltitude && current >= targetAltitude;
            boolean setting = previous >= targetAltitude && current < targetAltitude;
            if (direction == Direction.RISE && rising || direction == Direction.SET && setting) {
                double fraction = (targetAltitude - previous) / (current - previous);
                long offsetSeconds = Math.round(fraction * MOON_SCAN_STEP_MINUTES * 60);
                return time.minusMinutes(MOON_SCAN_STEP_MINUTES).plusSeconds(offsetSeconds);
            }
            previous = current;
        }
        return null;
    }

    private double moonAltitude(ZonedDateTime time, Location location) {
        return MoonPosition.compute()
                           .at(location.lat(), location.lng())
                           .elevation(elevation)
                           .on(time)
                           .execute()
                           .getAltitude();
    }

    @Override
    public double siderealTime(ZonedDateTime time) {
        return siderealDegrees(time) / 15.0;
    }

    private static double siderealDegrees(ZonedDateTime time) {
        double daysSinceJ2000 = time.toInstant().toEpochMilli() / DAY_MS + J1970 - J2000;
        double degrees = (280.46061837 + 360.98564736629 * daysSinceJ2000) % 360.0;
        return degrees < 0 ? degrees + 360.0 : degrees;
    }
}
