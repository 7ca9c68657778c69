package at.sv.milkyway.rating;

import at.sv.milkyway.Location;
import at.sv.milkyway.moon.LunarState;
import at.sv.milkyway.time.NightWindow;
import at.sv.milkyway.window.OptimalWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VisibilityRatingConverterTest {

    private VisibilityRatingConverter converter;
    private Location location;
    private ZonedDateTime dusk;
    private NightWindow eightHourNight;
    private LunarState moonDown;

    @BeforeEach
    void setUp() {
        converter = new VisibilityRatingConverter(location -> ZoneOffset.UTC);
        location = Location.of(34, -116);
        dusk = ZonedDateTime.of(2024, 6, 5, 21, 0, 0, 0, ZoneOffset.UTC);
        eightHourNight = NightWindow.builder().night(dusk).dayEnd(dusk.plusHours(8)).build();
        moonDown = LunarState.builder().illumination(0.9).altitude(-10).build();
    }

    private OptimalWindow windowAt(ZonedDateTime start, double hours) {
        return OptimalWindow.builder().startTime(start).endTime(start.plusMinutes((long) (hours * 60)))
                            .duration(hours).description("Good viewing window").build();
    }

    @Test
    void convert_highCore_noMoon_longNight_fourStars() {
        VisibilityRating rating = converter.convert(30, moonDown, eightHourNight, windowAt(dusk.plusHours(1), 3),
                location);

        assertThat(rating.stars()).isEqualTo(4);
        assertThat(rating.points()).isCloseTo(75, within(1e-9));
        assertThat(rating.reason()).isEqualTo("Altitude 30° (+45), moon (-0), 8.0 h of darkness (+30)");
        assertThat(rating.description()).startsWith("Excellent visibility");
    }

    @Test
    void convert_fullMoonHigh_penalizedByThirtyPoints() {
        LunarState fullMoonHigh = LunarState.builder().illumination(1.0).altitude(60).build();
        NightWindow fiveHourNight = NightWindow.builder().night(dusk).dayEnd(dusk.plusHours(5)).build();

        VisibilityRating rating = converter.convert(20, fullMoonHigh, fiveHourNight, windowAt(dusk.plusHours(1), 2),
                location);

        assertThat(rating.points()).isCloseTo(20, within(1e-9));
        assertThat(rating.stars()).isEqualTo(1);
    }

    @Test
    void convert_pointsNeverNegative() {
        LunarState fullMoonHigh = LunarState.builder().illumination(1.0).altitude(80).build();
        NightWindow shortNight = NightWindow.builder().night(dusk).dayEnd(dusk.plusHours(1)).build();

        VisibilityRating rating = converter.convert(0, fullMoonHigh, shortNight, windowAt(dusk.plusMinutes(10), 0.5),
                location);

        assertThat(rating.points()).isZero();
        assertThat(rating.stars()).isEqualTo(1);
    }

    @Test
    void convert_noWindow_zeroStars() {
        VisibilityRating rating = converter.convert(30, moonDown, eightHourNight, OptimalWindow.empty("none"),
                location);

        assertThat(rating.stars()).isZero();
        assertThat(rating.reason()).isEqualTo("No optimal viewing window");
        assertThat(rating.description()).startsWith("No visibility");
    }

    @Test
    void convert_windowWithoutDuration_zeroStars() {
        VisibilityRating rating = converter.convert(30, moonDown, eightHourNight, windowAt(dusk.plusHours(1), 0),
                location);

        assertThat(rating.stars()).isZero();
        assertThat(rating.reason()).isEqualTo("Optimal viewing window has no duration");
    }

    @Test
    void convert_windowStartsDuringDaylight_zeroStars() {
        ZonedDateTime noon = dusk.withHour(12);
        ZonedDateTime sixPm = dusk.withHour(18);
        ZonedDateTime sixAm = dusk.withHour(6);

        assertThat(converter.convert(30, moonDown, eightHourNight, windowAt(noon, 2), location).stars()).isZero();
        assertThat(converter.convert(30, moonDown, eightHourNight, windowAt(sixPm, 2), location).reason())
                .isEqualTo("Optimal viewing window starts during daylight hours");
        assertThat(converter.convert(30, moonDown, eightHourNight, windowAt(sixAm, 2), location).stars()).isZero();
        assertThat(converter.convert(30, moonDown, eightHourNight, windowAt(dusk.withHour(19), 2), location).stars())
                .isEqualTo(4);
        assertThat(converter.convert(30, moonDown, eightHourNight, windowAt(dusk.withHour(5), 2), location).stars())
                .isEqualTo(4);
    }

    @Test
    void convert_daylightCheck_usesResolvedZone() {
        VisibilityRatingConverter viennaConverter = new VisibilityRatingConverter(location -> ZoneOffset.ofHours(2));

        // 17:00 UTC is 19:00 at the location
        VisibilityRating rating = viennaConverter.convert(30, moonDown, eightHourNight, windowAt(dusk.withHour(17), 2),
                location);

        assertThat(rating.stars()).isEqualTo(4);
    }

    @Test
    void altitudePoints_capped() {
        assertThat(VisibilityRatingConverter.altitudePoints(-5)).isZero();
        assertThat(VisibilityRatingConverter.altitudePoints(10)).isEqualTo(15);
        assertThat(VisibilityRatingConverter.altitudePoints(40)).isEqualTo(50);
    }

    @Test
    void darknessPoints_buckets() {
        assertThat(VisibilityRatingConverter.darknessPoints(9)).isEqualTo(30);
        assertThat(VisibilityRatingConverter.darknessPoints(8)).isEqualTo(30);
        assertThat(VisibilityRatingConverter.darknessPoints(7.9)).isEqualTo(25);
        assertThat(VisibilityRatingConverter.darknessPoints(4)).isEqualTo(20);
        assertThat(VisibilityRatingConverter.darknessPoints(2)).isEqualTo(10);
        assertThat(VisibilityRatingConverter.darknessPoints(1.9)).isZero();
    }

    @Test
    void toStars_thresholds() {
        assertThat(VisibilityRatingConverter.toStars(60)).isEqualTo(4);
        assertThat(VisibilityRatingConverter.toStars(59.9)).isEqualTo(3);
        assertThat(VisibilityRatingConverter.toStars(45)).isEqualTo(3);
        assertThat(VisibilityRatingConverter.toStars(25)).isEqualTo(2);
        assertThat(VisibilityRatingConverter.toStars(24.9)).isEqualTo(1);
        assertThat(VisibilityRatingConverter.toStars(0)).isEqualTo(1);
    }

    @Test
    void ratingDescriptions_unknownStars() {
        assertThat(RatingDescriptions.describe(5)).isEqualTo("Unknown visibility");
        assertThat(RatingDescriptions.describe(2)).startsWith("Fair visibility");
    }
}
