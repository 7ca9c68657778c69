package at.sv.milkyway.ephemeris;

import at.sv.milkyway.Location;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SuncalcEphemerisProviderTest {

    private SuncalcEphemerisProvider provider;
    private ZonedDateTime j2000;

    @BeforeEach
    void setUp() {
        provider = new SuncalcEphemerisProvider();
        j2000 = ZonedDateTime.of(2000, 1, 1, 12, 0, 0, 0, ZoneOffset.UTC);
    }

    @Test
    void siderealTime_atJ2000() {
        assertThat(provider.siderealTime(j2000)).isCloseTo(280.46061837 / 15, within(1e-6));
    }

    @Test
    void siderealTime_advancesAboutFourMinutesPerDay() {
        double difference = provider.siderealTime(j2000.plusDays(1)) - provider.siderealTime(j2000);

        assertThat(difference * 60).isCloseTo(3.943, within(0.01));
    }

    @Test
    void siderealTime_alwaysWithinOneDay() {
        for (int day = 0; day < 400; day += 7) {
            assertThat(provider.siderealTime(j2000.minusDays(day))).isGreaterThanOrEqualTo(0).isLessThan(24);
        }
    }

    @Test
    void horizontalPosition_celestialPole_altitudeEqualsLatitude() {
        Location vienna = Location.of(48.2, 16.39);

        HorizontalPosition position = provider.horizontalPosition(j2000, vienna, new EquatorialCoordinate(0, 90));

        assertThat(position.altitude()).isCloseTo(48.2, within(1e-6));
    }

    @Test
    void horizontalPosition_southCelestialPole_belowHorizonInNorth() {
        Location vienna = Location.of(48.2, 16.39);

        HorizontalPosition position = provider.horizontalPosition(j2000, vienna, new EquatorialCoordinate(0, -90));

        assertThat(position.altitude()).isCloseTo(-48.2, within(1e-6));
    }

    @Test
    void horizontalPosition_onMeridian_culminatesInTheSouth() {
        Location location = Location.of(34, -116);
        double localSiderealTime = provider.siderealTime(j2000) + location.lng() / 15;

        HorizontalPosition position = provider.horizontalPosition(j2000, location,
                new EquatorialCoordinate(localSiderealTime, -29.007));

        assertThat(position.altitude()).isCloseTo(90 - 34 - 29.007, within(1e-6));
        assertThat(position.azimuth()).isCloseTo(180, within(1e-3));
    }

    @Test
    void searchAltitudeCrossing_astronomicalDusk_vienna() {
        ZonedDateTime day = ZonedDateTime.of(2021, 1, 1, 0, 0, 0, 0, ZoneId.of("Europe/Vienna"));

        ZonedDateTime dusk = provider.searchAltitudeCrossing(Body.SUN, Location.of(48.2, 16.39), Direction.SET, day, 1,
                -18);

        assertThat(dusk.toLocalDate()).isEqualTo(day.toLocalDate());
        assertThat(dusk.toLocalTime()).isBetween(LocalTime.of(18, 0), LocalTime.of(18, 10));
        assertThat(dusk.getZone()).isEqualTo(day.getZone());
    }

    @Test
    void searchAltitudeCrossing_noAstronomicalNight_returnsNull() {
        ZonedDateTime midsummer = ZonedDateTime.of(2024, 6, 21, 0, 0, 0, 0, ZoneId.of("Europe/Helsinki"));

        ZonedDateTime dusk = provider.searchAltitudeCrossing(Body.SUN, Location.of(65, 25), Direction.SET, midsummer,
                1, -18);

        assertThat(dusk).isNull();
    }

    @Test
    void searchAltitudeCrossing_moonRiseAndSet_areInOrderWithinSearchRange() {
        ZonedDateTime start = ZonedDateTime.of(2024, 6, 15, 0, 0, 0, 0, ZoneOffset.UTC);
        Location location = Location.of(48.2, 16.39);

        ZonedDateTime rise = provider.searchAltitudeCrossing(Body.MOON, location, Direction.RISE, start, 2, 0);
        ZonedDateTime set = provider.searchAltitudeCrossing(Body.MOON, location, Direction.SET, start, 2, 0);

        assertThat(rise).isAfter(start).isBefore(start.plusDays(2));
        assertThat(set).isAfter(start).isBefore(start.plusDays(2));
    }

    @Test
    void searchAltitudeCrossing_moonAboveCustomAltitude_scanned() {
        ZonedDateTime start = ZonedDateTime.of(2024, 6, 15, 0, 0, 0, 0, ZoneOffset.UTC);
        Location location = Location.of(48.2, 16.39);

        ZonedDateTime rise = provider.searchAltitudeCrossing(Body.MOON, location, Direction.RISE, start, 2, 10);

        assertThat(rise).isNotNull();
        assertThat(new SuncalcLunarProvider().moonPosition(rise, location).altitude()).isCloseTo(10, within(0.5));
    }
}
