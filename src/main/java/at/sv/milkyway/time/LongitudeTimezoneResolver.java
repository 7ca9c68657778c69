package at.sv.milkyway.time;

import at.sv.milkyway.Location;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Approximates the zone of a location by its nautical time zone, i.e. one hour per 15° of longitude.
 */
public final class LongitudeTimezoneResolver implements TimezoneResolver {

    @Override
    public ZoneId resolve(Location location) {
        return ZoneOffset.ofHours((int) Math.round(location.lng() / 15.0));
    }
}
