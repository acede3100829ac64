package io.github.drompincen.knowpipe.runtime.classification;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Weighted keyword set (plus optional regex patterns) voting for one label. {@code priority}
 * breaks ties between rules with equal scores.
 */
public record KeywordRule<L>(
        L label,
        Map<String, Double> keywords,
        List<Pattern> patterns,
        double patternWeight,
        int priority
) {
    public KeywordRule {
        Objects.requireNonNull(label, "label");
        keywords = keywords == null ? Map.of() : new LinkedHashMap<>(keywords);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    public static <L> KeywordRule<L> of(L label, int priority, Map<String, Double> keywords) {
        return new KeywordRule<>(label, keywords, List.of(), 0.0, priority);
    }

    public Match<L> match(String normalizedQuery) {
        double score = 0.0;
        List<String> matched = new ArrayList<>();
        for (Map.Entry<String, Double> e : keywords.entrySet()) {
            if (QueryText.containsKeyword(normalizedQuery, e.getKey())) {
                score += e.getValue();
                matched.add(e.getKey());
            }
        }
        for (Pattern p : patterns) {
            if (p.matcher(normalizedQuery).find()) {
                score += patternWeight;
                matched.add("pattern:" + p.pattern());
            }
        }
        return new Match<>(this, score, matched);
    }

    public record Match<L>(KeywordRule<L> rule, double score, List<String> matchedKeywords) {
        public boolean matched() {
            return score > 0.0;
        }
    }
}
