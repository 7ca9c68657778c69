package at.sv.milkyway.time;

import at.sv.milkyway.Location;

import java.time.ZoneId;
import java.time.ZonedDateTime;

@FunctionalInterface
public interface TimezoneResolver {

    ZoneId resolve(Location location);

    /**
     * @return the hour of day [0..23] of the given time at the location
     */
    default int localHour(ZonedDateTime time, Location location) {
        return time.withZoneSameInstant(resolve(location)).getHour();
    }
}
