package at.sv.milkyway.time;

import at.sv.milkyway.Location;
import at.sv.milkyway.ephemeris.Body;
import at.sv.milkyway.ephemeris.Direction;
import at.sv.milkyway.ephemeris.EphemerisProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

@Slf4j
public final class TwilightLocator {

    static final double ASTRONOMICAL_TWILIGHT = -18;
    static final double CIVIL_TWILIGHT = -6;
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final EphemerisProvider ephemeris;

    public TwilightLocator(EphemerisProvider ephemeris) {
        this.ephemeris = ephemeris;
    }

    /**
     * Dusk is searched on the calendar day of {@code date}, dawn on the following day, so that the window always
     * spans one continuous dark period even if both events are close to midnight.
     *
     * @return the night window; never throws, failures result in {@link NightWindow#noDarkness()}
     */
    public NightWindow locate(ZonedDateTime date, Location location) {
        ZonedDateTime startOfDay = date.with(LocalTime.MIDNIGHT);
        ZonedDateTime startOfNextDay = startOfDay.plusDays(1);
        try {
            return NightWindow.builder()
                              .night(search(location, Direction.SET, startOfDay, ASTRONOMICAL_TWILIGHT))
                              .dayEnd(search(location, Direction.RISE, startOfNextDay, ASTRONOMICAL_TWILIGHT))
                              .civilDusk(search(location, Direction.SET, startOfDay, CIVIL_TWILIGHT))
                              .civilDawn(search(location, Direction.RISE, startOfNextDay, CIVIL_TWILIGHT))
                              .build();
        } catch (Exception e) {
            log.error("Failed to calculate twilight times for {} at {}: {}", date.toLocalDate(), location,
                    e.getLocalizedMessage(), e);
            return NightWindow.noDarkness();
        }
    }

    private ZonedDateTime search(Location location, Direction direction, ZonedDateTime start, double altitude) {
        return ephemeris.searchAltitudeCrossing(Body.SUN, location, direction, start, 1, altitude);
    }

    public String toDebugString(NightWindow window) {
        return "civil_dawn: " + format(window.getCivilDawn()) +
               "\ncivil_dusk: " + format(window.getCivilDusk()) +
               "\nastronomical_dusk: " + format(window.getNight()) +
               "\nastronomical_dawn: " + format(window.getDayEnd());
    }

    private String format(ZonedDateTime time) {
        if (time == null) {
            return "-";
        }
        return TIME_FORMATTER.format(time);
    }
}
