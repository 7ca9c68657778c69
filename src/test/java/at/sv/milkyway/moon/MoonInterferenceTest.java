package at.sv.milkyway.moon;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MoonInterferenceTest {

    @Test
    void of_belowHorizon_noInterference() {
        assertThat(MoonInterference.of(1.0, 0)).isZero();
        assertThat(MoonInterference.of(1.0, -30)).isZero();
    }

    @Test
    void of_saturatesAt45Degrees() {
        assertThat(MoonInterference.of(0.8, 45)).isCloseTo(0.8, within(1e-9));
        assertThat(MoonInterference.of(0.8, 80)).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void of_growsWithAltitude_fasterThanLinear() {
        double low = MoonInterference.of(1.0, 10);
        double mid = MoonInterference.of(1.0, 22.5);

        assertThat(low).isLessThan(mid);
        assertThat(mid).isCloseTo(Math.pow(0.5, 0.7), within(1e-9));
        assertThat(mid).isGreaterThan(0.5);
    }
}
