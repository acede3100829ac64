package io.github.drompincen.knowpipe.runtime.classification;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** Picks the best matching rule: highest saturated confidence, then rule priority, then declaration order. */
final class RuleScorer {

    private RuleScorer() {}

    static <L> Optional<KeywordRule.Match<L>> best(List<KeywordRule<L>> rules, String normalizedQuery,
                                                   double saturation) {
        KeywordRule.Match<L> best = null;
        Comparator<KeywordRule.Match<L>> order = Comparator
                .<KeywordRule.Match<L>>comparingDouble(m -> confidence(m.score(), saturation))
                .thenComparingInt(m -> m.rule().priority());
        for (KeywordRule<L> rule : rules) {
            KeywordRule.Match<L> match = rule.match(normalizedQuery);
            if (!match.matched()) continue;
            // strict comparison keeps the earlier rule on a full tie
            if (best == null || order.compare(match, best) > 0) {
                best = match;
            }
        }
        return Optional.ofNullable(best);
    }

    static double confidence(double score, double saturation) {
        if (saturation <= 0) return score > 0 ? 1.0 : 0.0;
        return Math.min(1.0, score / saturation);
    }
}
