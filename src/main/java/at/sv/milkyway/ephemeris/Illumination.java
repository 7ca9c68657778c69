package at.sv.milkyway.ephemeris;

/**
 * @param phase    lunar phase [0..1), 0 is new moon, 0.25 first quarter, 0.5 full moon and 0.75 last quarter
 * @param fraction illuminated fraction of the visible disk [0..1]
 */
public record Illumination(double phase, double fraction) {
}
