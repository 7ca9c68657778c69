package at.sv.milkyway;

import at.sv.milkyway.core.GalacticCoreState;
import at.sv.milkyway.ephemeris.EphemerisFailure;
import at.sv.milkyway.ephemeris.EphemerisProvider;
import at.sv.milkyway.ephemeris.LunarProvider;
import at.sv.milkyway.ephemeris.SuncalcEphemerisProvider;
import at.sv.milkyway.ephemeris.SuncalcLunarProvider;
import at.sv.milkyway.moon.LunarState;
import at.sv.milkyway.scoring.ObservationScorer;
import at.sv.milkyway.time.NightWindow;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.Answer;

import java.time.LocalDate;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class NightReportCalculatorTest {

    private static final ZoneId LOS_ANGELES = ZoneId.of("America/Los_Angeles");
    private static final Location JOSHUA_TREE = Location.of(34.0, -116.0);

    @Test
    void calculate_newMoonInJune_darkNightWithCoreUp() {
        NightReportCalculator calculator = NightReportCalculator.create(new SuncalcEphemerisProvider(),
                new SuncalcLunarProvider(), location -> LOS_ANGELES, 0.5);
        LocalDate date = LocalDate.of(2024, 6, 5);

        NightReport report = calculator.calculate(date, JOSHUA_TREE, LOS_ANGELES);

        assertThat(report.getDate()).isEqualTo(date);
        assertThat(report.getNight().hasDarkness()).isTrue();
        assertThat(report.getNight().getNight().toLocalDate()).isEqualTo(date);
        assertThat(report.getGalacticCore().hasRiseAndSet()).isTrue();
        assertThat(report.getMoon().getIllumination()).isLessThan(0.1);
        assertThat(report.getRating()).isGreaterThanOrEqualTo(3);
        assertThat(report.getObservation().curve()).isNotEmpty();
        assertThat(report.getOptimalWindow().isViable()).isTrue();
        assertThat(report.getOptimalWindow().getStartTime()).isAfterOrEqualTo(report.getNight().getNight());
        assertThat(report.getOptimalWindow().getEndTime()).isBeforeOrEqualTo(report.getNight().getDayEnd());
        assertThat(report.getVisibilityRating().stars()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void calculate_noAstronomicalNight_ratingZero() {
        NightReportCalculator calculator = NightReportCalculator.create(new SuncalcEphemerisProvider(),
                new SuncalcLunarProvider(), location -> ZoneId.of("Europe/Helsinki"), 0.5);

        NightReport report = calculator.calculate(LocalDate.of(2024, 6, 21), Location.of(60.5, 25),
                ZoneId.of("Europe/Helsinki"));

        assertThat(report.getNight().hasDarkness()).isFalse();
        assertThat(report.getRating()).isZero();
        assertThat(report.getReason()).isEqualTo(ObservationScorer.NO_ASTRONOMICAL_DARKNESS);
        assertThat(report.getOptimalWindow().isViable()).isFalse();
        assertThat(report.getVisibilityRating().stars()).isZero();
    }

    @Test
    void calculate_ephemerisUnavailable_neutralReport() {
        Answer<Object> failure = invocation -> {
            throw new EphemerisFailure("Ephemeris data unavailable for " + invocation.getMethod().getName());
        };
        NightReportCalculator calculator = NightReportCalculator.create(mock(EphemerisProvider.class, failure),
                mock(LunarProvider.class, failure), location -> LOS_ANGELES, 0.5);

        NightReport report = calculator.calculate(LocalDate.of(2024, 6, 5), JOSHUA_TREE, LOS_ANGELES);

        assertThat(report.getGalacticCore()).isSameAs(GalacticCoreState.unavailable());
        assertThat(report.getMoon()).isSameAs(LunarState.unavailable());
        assertThat(report.getNight()).isSameAs(NightWindow.noDarkness());
        assertThat(report.getGalacticCore().getRiseTime()).isNull();
        assertThat(report.getMoon().getIllumination()).isZero();
        assertThat(report.getNight().hasDarkness()).isFalse();
        assertThat(report.getRating()).isZero();
        assertThat(report.getOptimalWindow().getStartTime()).isNull();
        assertThat(report.getVisibilityRating().stars()).isZero();
        assertThat(report.getVisibilityRating().reason()).isEqualTo("No optimal viewing window");
    }
}
