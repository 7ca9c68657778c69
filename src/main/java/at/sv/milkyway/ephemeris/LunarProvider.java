package at.sv.milkyway.ephemeris;

import at.sv.milkyway.Location;

import java.time.ZonedDateTime;

public interface LunarProvider {

    HorizontalPosition moonPosition(ZonedDateTime time, Location location);

    Illumination moonIllumination(ZonedDateTime time);

    /**
     * @param day the calendar day to search, in the zone of the observer. The time of day is ignored.
     * @return the moon rise and set times within the given calendar day
     */
    RiseSet moonTimes(ZonedDateTime day, Location location);
}
