package at.sv.milkyway.scoring;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

class RatingRulesTest {

    private RatingRules.Rated evaluate(double illumination, double minutes, double average, double finalScore) {
        return RatingRules.DEFAULT.evaluate(new ScoreSummary(illumination, minutes, average, finalScore));
    }

    @Test
    void bucketBoundaries_areExclusiveUpperBounds() {
        assertThat(evaluate(0, 300, 0.2, 0.2499).rating(), is(1));
        assertThat(evaluate(0, 300, 0.25, 0.25).rating(), is(2));
        assertThat(evaluate(0, 300, 0.5, 0.5).rating(), is(3));
        assertThat(evaluate(0, 300, 0.75, 0.75).rating(), is(4));
    }

    @Test
    void poorBucket_moonReasonsBeforeWindowReasons() {
        assertThat(evaluate(0.7, 45, 0.1, 0.07).reason(), is("Severe moon interference (70% illuminated)"));
        assertThat(evaluate(0.2, 45, 0.1, 0.07).reason(), is("Very short observation window (45 minutes)"));
        assertThat(evaluate(0.2, 200, 0.1, 0.1).reason(), is("Poor viewing conditions"));
    }

    @Test
    void fairBucket_reasons() {
        assertThat(evaluate(0.55, 200, 0.4, 0.4).reason(), is("Significant moon interference (55% illuminated)"));
        assertThat(evaluate(0.2, 75, 0.45, 0.4).reason(), is("Limited observation window (1.3 hours)"));
        assertThat(evaluate(0.2, 200, 0.4, 0.4).reason(), is("Fair viewing conditions"));
    }

    @Test
    void goodBucket_reasons() {
        assertThat(evaluate(0.35, 200, 0.6, 0.6).reason(), is("Good conditions with some moon (35% illuminated)"));
        assertThat(evaluate(0.2, 150, 0.6, 0.6).reason(), is("Good conditions with 2.5 hour window"));
        assertThat(evaluate(0.2, 100, 0.7, 0.6).reason(), is("Good viewing conditions"));
    }

    @Test
    void excellentBucket_reasons() {
        assertThat(evaluate(0.05, 180, 1.0, 1.0).reason(), is("Excellent dark sky conditions (3.0 hours)"));
        assertThat(evaluate(0.2, 100, 0.95, 0.9).reason(), is("Perfect viewing conditions - moon below horizon"));
        assertThat(evaluate(0.2, 100, 0.85, 0.8).reason(), is("Excellent conditions (1.7 hour window)"));
    }

    @Test
    void customRules_firstMatchingRuleWins() {
        RatingRules rules = new RatingRules(List.of(
                new RatingRules.Bucket(1, 0.5, List.of(
                        new RatingRules.Rule(s -> s.averageScore() < 0.1, s -> "dark"),
                        new RatingRules.Rule(s -> true, s -> "default"))),
                new RatingRules.Bucket(2, 1.0, List.of(
                        new RatingRules.Rule(s -> true, s -> "bright")))));

        assertThat(rules.evaluate(new ScoreSummary(0, 60, 0.05, 0.05)), is(new RatingRules.Rated(1, "dark")));
        assertThat(rules.evaluate(new ScoreSummary(0, 60, 0.3, 0.3)), is(new RatingRules.Rated(1, "default")));
        assertThat(rules.evaluate(new ScoreSummary(0, 60, 0.7, 0.7)), is(new RatingRules.Rated(2, "bright")));
        assertThat(rules.evaluate(new ScoreSummary(0, 60, 1.0, 1.5)), is(new RatingRules.Rated(2, "bright")));
    }
}
