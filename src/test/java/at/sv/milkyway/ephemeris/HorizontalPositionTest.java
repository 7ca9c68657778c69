package at.sv.milkyway.ephemeris;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HorizontalPositionTest {

    @Test
    void of_normalizesAzimuth() {
        assertThat(HorizontalPosition.of(10, -10).azimuth()).isCloseTo(350, within(1e-9));
        assertThat(HorizontalPosition.of(10, 360).azimuth()).isZero();
        assertThat(HorizontalPosition.of(10, 725).azimuth()).isCloseTo(5, within(1e-9));
    }

    @Test
    void of_nan_ephemerisFailure() {
        assertThatThrownBy(() -> HorizontalPosition.of(Double.NaN, 0)).isInstanceOf(EphemerisFailure.class);
    }

    @Test
    void isAboveHorizon() {
        assertThat(HorizontalPosition.of(0.1, 0).isAboveHorizon()).isTrue();
        assertThat(HorizontalPosition.of(0, 0).isAboveHorizon()).isFalse();
    }

    @Test
    void angularSeparation() {
        HorizontalPosition south = new HorizontalPosition(0, 180);

        assertThat(south.angularSeparation(south)).isCloseTo(0, within(1e-6));
        assertThat(south.angularSeparation(new HorizontalPosition(0, 90))).isCloseTo(90, within(1e-9));
        assertThat(south.angularSeparation(new HorizontalPosition(90, 0))).isCloseTo(90, within(1e-9));
        assertThat(south.angularSeparation(new HorizontalPosition(0, 0))).isCloseTo(180, within(1e-6));
        assertThat(new HorizontalPosition(20, 350).angularSeparation(new HorizontalPosition(20, 10)))
                .isCloseTo(new HorizontalPosition(20, 10).angularSeparation(new HorizontalPosition(20, 350)), within(1e-9))
                .isCloseTo(18.78, within(0.05));
    }
}
