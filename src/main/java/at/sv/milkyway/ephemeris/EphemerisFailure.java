package at.sv.milkyway.ephemeris;

/**
 * Exception to signal that an ephemeris calculation failed or returned unusable data.
 * Locators convert EphemerisFailures into neutral states.
 */
public class EphemerisFailure extends RuntimeException {
    public EphemerisFailure(String message) {
        super(message);
    }

    public EphemerisFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
