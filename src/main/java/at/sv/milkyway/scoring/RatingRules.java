package at.sv.milkyway.scoring;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Maps a final score to a rating bucket and, within that bucket, to the reason of the first matching rule.
 * Moon related reasons are listed before window length related ones.
 */
public final class RatingRules {

    public static final RatingRules DEFAULT = new RatingRules(List.of(
            new Bucket(1, 0.25, List.of(
                    rule(s -> s.moonIllumination() > 0.6 && s.averageScore() < 0.5,
                            s -> "Severe moon interference (" + s.moonIlluminationPercent() + "% illuminated)"),
                    rule(s -> s.windowLengthMinutes() < 60,
                            s -> "Very short observation window (" + Math.round(s.windowLengthMinutes()) + " minutes)"),
                    fallback("Poor viewing conditions"))),
            new Bucket(2, 0.5, List.of(
                    rule(s -> s.moonIllumination() > 0.5 && s.averageScore() < 0.5,
                            s -> "Significant moon interference (" + s.moonIlluminationPercent() + "% illuminated)"),
                    rule(s -> s.windowLengthMinutes() < 90,
                            s -> "Limited observation window (" + hours(s) + " hours)"),
                    fallback("Fair viewing conditions"))),
            new Bucket(3, 0.75, List.of(
                    rule(s -> s.moonIllumination() > 0.3,
                            s -> "Good conditions with some moon (" + s.moonIlluminationPercent() + "% illuminated)"),
                    rule(s -> s.windowLengthMinutes() >= 120,
                            s -> "Good conditions with " + hours(s) + " hour window"),
                    fallback("Good viewing conditions"))),
            new Bucket(4, Double.POSITIVE_INFINITY, List.of(
                    rule(s -> s.moonIllumination() < 0.1 && s.windowLengthMinutes() >= 120,
                            s -> "Excellent dark sky conditions (" + hours(s) + " hours)"),
                    rule(s -> s.averageScore() > 0.9,
                            s -> "Perfect viewing conditions - moon below horizon"),
                    rule(s -> true,
                            s -> "Excellent conditions (" + hours(s) + " hour window)")))
    ));

    private final List<Bucket> buckets;

    public RatingRules(List<Bucket> buckets) {
        this.buckets = List.copyOf(buckets);
    }

    /**
     * @return the rating of the first bucket whose upper bound exceeds the final score, with the reason of its first
     * matching rule
     */
    public Rated evaluate(ScoreSummary summary) {
        for (Bucket bucket : buckets) {
            if (summary.finalScore() < bucket.upperBound()) {
                return new Rated(bucket.rating(), bucket.reasonFor(summary));
            }
        }
        Bucket last = buckets.get(buckets.size() - 1);
        return new Rated(last.rating(), last.reasonFor(summary));
    }

    private static Rule rule(Predicate<ScoreSummary> condition, Function<ScoreSummary, String> template) {
        return new Rule(condition, template);
    }

    private static Rule fallback(String reason) {
        return new Rule(s -> true, s -> reason);
    }

    private static String hours(ScoreSummary summary) {
        return String.format(Locale.ROOT, "%.1f", summary.windowLengthHours());
    }

    public record Rule(Predicate<ScoreSummary> condition, Function<ScoreSummary, String> template) {
    }

    /**
     * @param upperBound exclusive upper bound of the final score
     * @param rules      evaluated top to bottom; the last rule should always match
     */
    public record Bucket(int rating, double upperBound, List<Rule> rules) {

        String reasonFor(ScoreSummary summary) {
            return rules.stream()
                        .filter(rule -> rule.condition().test(summary))
                        .findFirst()
                        .map(rule -> rule.template().apply(summary))
                        .orElse("");
        }
    }

    public record Rated(int rating, String reason) {
    }
}
