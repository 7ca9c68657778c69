package at.sv.milkyway.scoring;

import java.time.ZonedDateTime;

/**
 * One evaluation of the observation quality.
 *
 * @param score        [0..1], 1 is a perfectly dark sky
 * @param altitudeGC   altitude of the galactic core in degrees
 * @param moonAltitude altitude of the moon in degrees
 * @param moonAngle    angular separation between moon and galactic core in degrees
 */
public record VisibilitySample(ZonedDateTime time, double score, double altitudeGC, double moonAltitude,
                               double moonAngle) {
}
