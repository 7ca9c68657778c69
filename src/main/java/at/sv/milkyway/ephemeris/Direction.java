package at.sv.milkyway.ephemeris;

/**
 * Direction of an altitude crossing.
 */
public enum Direction {
    /**
     * Ascending through the target altitude.
     */
    RISE,
    /**
     * Descending through the target altitude.
     */
    SET
}
