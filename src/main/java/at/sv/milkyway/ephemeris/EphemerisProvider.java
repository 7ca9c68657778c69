package at.sv.milkyway.ephemeris;

import at.sv.milkyway.Location;

import java.time.ZonedDateTime;

public interface EphemerisProvider {

    /**
     * @param time       the instant of observation
     * @param location   the observer
     * @param coordinate the fixed celestial coordinate to convert
     * @return altitude and azimuth of the coordinate as seen by the observer
     * @throws EphemerisFailure if the position could not be computed
     */
    HorizontalPosition horizontalPosition(ZonedDateTime time, Location location, EquatorialCoordinate coordinate);

    /**
     * Searches for the next time after {@code start} at which the given body passes the target altitude in the given
     * direction.
     *
     * @param maxDays        the maximum number of days to search
     * @param targetAltitude the altitude in degrees, e.g. -18 for astronomical twilight
     * @return the crossing, in the zone of {@code start}, or {@code null} if there is none within {@code maxDays}
     */
    ZonedDateTime searchAltitudeCrossing(Body body, Location location, Direction direction, ZonedDateTime start,
                                         int maxDays, double targetAltitude);

    /**
     * @return the Greenwich mean sidereal time in hours [0..24)
     */
    double siderealTime(ZonedDateTime time);
}
