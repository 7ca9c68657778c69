package at.sv.milkyway.scoring;

/**
 * The aggregated values the rating and its reason are derived from.
 *
 * @param windowLengthMinutes length of the intersection of night and core visibility
 * @param averageScore        step-weighted average of all samples
 * @param finalScore          average score scaled by the window length multiplier
 */
public record ScoreSummary(double moonIllumination, double windowLengthMinutes, double averageScore,
                           double finalScore) {

    public long moonIlluminationPercent() {
        return Math.round(moonIllumination * 100);
    }

    public double windowLengthHours() {
        return windowLengthMinutes / 60;
    }
}
