package at.sv.milkyway.ephemeris;

/**
 * Position above the local horizon, in degrees. Azimuth is measured from north towards east.
 */
public record HorizontalPosition(double altitude, double azimuth) {

    public static HorizontalPosition of(double altitude, double azimuth) {
        if (Double.isNaN(altitude) || Double.isNaN(azimuth)) {
            throw new EphemerisFailure("Invalid horizontal position: altitude=" + altitude + ", azimuth=" + azimuth);
        }
        return new HorizontalPosition(Math.max(-90, Math.min(90, altitude)), normalizeAzimuth(azimuth));
    }

    public boolean isAboveHorizon() {
        return altitude > 0;
    }

    /**
     * Great circle distance to the other position, using the spherical law of cosines.
     *
     * @return the angle in degrees [0..180]
     */
    public double angularSeparation(HorizontalPosition other) {
        double alt1 = Math.toRadians(altitude);
        double alt2 = Math.toRadians(other.altitude);
        double deltaAz = Math.toRadians(azimuth - other.azimuth);
        double cos = Math.sin(alt1) * Math.sin(alt2) + Math.cos(alt1) * Math.cos(alt2) * Math.cos(deltaAz);
        return Math.toDegrees(Math.acos(Math.max(-1, Math.min(1, cos))));
    }

    private static double normalizeAzimuth(double azimuth) {
        double normalized = azimuth % 360.0;
        if (normalized < 0) {
            normalized += 360.0;
        }
        return normalized >= 360.0 ? 0.0 : normalized;
    }
}
