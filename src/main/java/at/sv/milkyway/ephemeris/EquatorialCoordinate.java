package at.sv.milkyway.ephemeris;

/**
 * Fixed celestial coordinate.
 *
 * @param rightAscension in hours [0..24)
 * @param declination    in degrees [-90..90]
 */
public record EquatorialCoordinate(double rightAscension, double declination) {

    /**
     * Sagittarius A*, J2000 (17h 45m 36s, -29° 0' 25").
     */
    public static final EquatorialCoordinate GALACTIC_CENTER = new EquatorialCoordinate(17.759, -29.007);
}
