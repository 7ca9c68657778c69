package at.sv.milkyway.core;

import at.sv.milkyway.Location;
import at.sv.milkyway.ephemeris.Direction;
import at.sv.milkyway.ephemeris.EphemerisProvider;
import at.sv.milkyway.ephemeris.EquatorialCoordinate;
import at.sv.milkyway.ephemeris.HorizontalPosition;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Month;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds position, rise, transit and set of the galactic core relative to a month dependent altitude threshold.
 */
@Slf4j
public final class GalacticCoreLocator {

    static final double SIDEREAL_DAY_HOURS = 23.9344696;
    private static final int SAMPLE_STEP_MINUTES = 10;
    private static final int HOURS_BEFORE = 6;
    private static final int HOURS_AFTER = 36;
    private static final int EXTENSION_HOURS = 36;
    private static final int MAX_TRANSIT_SHIFTS = 4;

    private final EphemerisProvider ephemeris;
    private final EquatorialCoordinate target;

    public GalacticCoreLocator(EphemerisProvider ephemeris) {
        this(ephemeris, EquatorialCoordinate.GALACTIC_CENTER);
    }

    public GalacticCoreLocator(EphemerisProvider ephemeris, EquatorialCoordinate target) {
        this.ephemeris = ephemeris;
        this.target = target;
    }

    /**
     * The core culminates lower later in the season, so the required altitude is relaxed towards the end of the year.
     *
     * @return the minimum altitude in degrees for the given month
     */
    public static double altitudeThreshold(Month month) {
        if (month.getValue() <= Month.JULY.getValue()) {
            return 20;
        }
        if (month.getValue() <= Month.SEPTEMBER.getValue()) {
            return 15;
        }
        return 10;
    }

    /**
     * @return the state of the galactic core; never throws, failures result in {@link GalacticCoreState#unavailable()}
     */
    public GalacticCoreState locate(ZonedDateTime date, Location location) {
        try {
            double threshold = altitudeThreshold(date.getMonth());
            HorizontalPosition position = ephemeris.horizontalPosition(date, location, target);

            ZonedDateTime searchStart = date.minusHours(HOURS_BEFORE);
            ZonedDateTime searchEnd = date.plusHours(HOURS_AFTER);
            List<Crossing> crossings = findCrossings(searchStart, searchEnd, location, threshold, true);

            ZonedDateTime rise = null;
            ZonedDateTime set = null;
            int riseIndex = indexOfFirst(crossings, Direction.RISE, 0);
            if (riseIndex >= 0) {
                rise = crossings.get(riseIndex).time();
                int setIndex = indexOfFirst(crossings, Direction.SET, riseIndex + 1);
                if (setIndex >= 0) {
                    set = crossings.get(setIndex).time();
                } else if (altitudeAt(searchEnd, location) >= threshold) {
                    set = findExtendedSet(searchEnd, location, threshold);
                }
            }

            ZonedDateTime transit = findTransit(date, location, rise, set);
            return GalacticCoreState.builder()
                                    .altitude(position.altitude())
                                    .azimuth(position.azimuth())
                                    .visible(position.altitude() >= threshold)
                                    .altitudeThreshold(threshold)
                                    .riseTime(rise)
                                    .transitTime(transit)
                                    .setTime(set)
                                    .build();
        } catch (Exception e) {
            log.error("Failed to locate galactic core for {} at {}: {}", date, location, e.getLocalizedMessage(), e);
            return GalacticCoreState.unavailable();
        }
    }

    private List<Crossing> findCrossings(ZonedDateTime start, ZonedDateTime end, Location location, double threshold,
                                         boolean startAboveIsRise) {
        List<Crossing> crossings = new ArrayList<>();
        long steps = Duration.between(start, end).toMinutes() / SAMPLE_STEP_MINUTES;
        double previous = altitudeAt(start, location);
        if (startAboveIsRise && previous >= threshold) {
            crossings.add(new Crossing(start, Direction.RISE));
        }
        for (long i = 1; i <= steps; i++) {
            ZonedDateTime time = start.plusMinutes(i * SAMPLE_STEP_MINUTES);
            double current = altitudeAt(time, location);
            if (previous < threshold && current >= threshold) {
                crossings.add(new Crossing(interpolate(time, previous, current, threshold), Direction.RISE));
            } else if (previous >= threshold && current < threshold) {
                crossings.add(new Crossing(interpolate(time, previous, current, threshold), Direction.SET));
            }
            previous = current;
        }
        return crossings;
    }

    private ZonedDateTime findExtendedSet(ZonedDateTime from, Location location, double threshold) {
        List<Crossing> crossings = findCrossings(from, from.plusHours(EXTENSION_HOURS), location, threshold, false);
        int setIndex = indexOfFirst(crossings, Direction.SET, 0);
        return setIndex >= 0 ? crossings.get(setIndex).time() : null;
    }

    private static ZonedDateTime interpolate(ZonedDateTime sampleTime, double previous, double current, double threshold) {
        double fraction = (threshold - previous) / (current - previous);
        long offsetMillis = Math.round(fraction * SAMPLE_STEP_MINUTES * 60_000);
        return sampleTime.minusMinutes(SAMPLE_STEP_MINUTES).plus(Duration.ofMillis(offsetMillis));
    }

    private static int indexOfFirst(List<Crossing> crossings, Direction direction, int fromIndex) {
        for (int i = fromIndex; i < crossings.size(); i++) {
            if (crossings.get(i).direction() == direction) {
                return i;
            }
        }
        return -1;
    }

    /**
     * The core transits when the local sidereal time equals its right ascension. The estimate is shifted by whole
     * sidereal days into [rise, set]; if that is not possible the raw estimate is returned.
     */
    private ZonedDateTime findTransit(ZonedDateTime date, Location location, ZonedDateTime rise, ZonedDateTime set) {
        double localSiderealTime = ephemeris.siderealTime(date) + location.lng() / 15.0;
        double hourAngle = localSiderealTime - target.rightAscension();
        hourAngle = ((((hourAngle + 12) % 24) + 24) % 24) - 12;
        ZonedDateTime estimate = date.plus(hoursToDuration(-hourAngle));
        if (rise == null || set == null) {
            return estimate;
        }
        ZonedDateTime transit = estimate;
        Duration siderealDay = hoursToDuration(SIDEREAL_DAY_HOURS);
        for (int i = 0; i < MAX_TRANSIT_SHIFTS; i++) {
            if (transit.isBefore(rise)) {
                transit = transit.plus(siderealDay);
            } else if (transit.isAfter(set)) {
                transit = transit.minus(siderealDay);
            } else {
                return transit;
            }
        }
        if (!transit.isBefore(rise) && !transit.isAfter(set)) {
            return transit;
        }
        log.debug("Transit {} could not be placed within [{}, {}], using estimate", transit, rise, set);
        return estimate;
    }

    private static Duration hoursToDuration(double hours) {
        return Duration.ofMillis(Math.round(hours * 3_600_000));
    }

    private double altitudeAt(ZonedDateTime time, Location location) {
        return ephemeris.horizontalPosition(time, location, target).altitude();
    }

    private record Crossing(ZonedDateTime time, Direction direction) {
    }
}
