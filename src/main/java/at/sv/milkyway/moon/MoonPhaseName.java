package at.sv.milkyway.moon;

public enum MoonPhaseName {
    NEW_MOON("New Moon"),
    WAXING_CRESCENT("Waxing Crescent"),
    FIRST_QUARTER("First Quarter"),
    WAXING_GIBBOUS("Waxing Gibbous"),
    FULL_MOON("Full Moon"),
    WANING_GIBBOUS("Waning Gibbous"),
    THIRD_QUARTER("Third Quarter"),
    WANING_CRESCENT("Waning Crescent");

    private final String displayName;

    MoonPhaseName(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Each name covers an eighth of the cycle, centered on its principal phase.
     *
     * @param phase [0..1), 0.5 is full moon
     */
    public static MoonPhaseName of(double phase) {
        if (phase < 0.0625 || phase >= 0.9375) return NEW_MOON;
        if (phase < 0.1875) return WAXING_CRESCENT;
        if (phase < 0.3125) return FIRST_QUARTER;
        if (phase < 0.4375) return WAXING_GIBBOUS;
        if (phase < 0.5625) return FULL_MOON;
        if (phase < 0.6875) return WANING_GIBBOUS;
        if (phase < 0.8125) return THIRD_QUARTER;
        return WANING_CRESCENT;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
