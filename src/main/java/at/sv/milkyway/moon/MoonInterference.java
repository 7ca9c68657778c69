package at.sv.milkyway.moon;

public final class MoonInterference {

    private static final double FULL_INTERFERENCE_ALTITUDE = 45.0;
    private static final double ALTITUDE_EXPONENT = 0.7;

    private MoonInterference() {
    }

    /**
     * A moon below the horizon never interferes. Above it, interference grows non-linearly with altitude and
     * saturates at 45°.
     *
     * @param illumination illuminated fraction [0..1]
     * @param altitude     moon altitude in degrees
     * @return interference [0..1]
     */
    public static double of(double illumination, double altitude) {
        if (altitude <= 0) {
            return 0;
        }
        double altitudeFactor = Math.min(1, Math.pow(altitude / FULL_INTERFERENCE_ALTITUDE, ALTITUDE_EXPONENT));
        return illumination * altitudeFactor;
    }
}
