package io.github.drompincen.knowpipe.runtime.classification;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/** Query normalization and keyword matching shared by the detectors and cache key derivation. */
public final class QueryText {

    private static final Pattern NON_TEXT = Pattern.compile("[^a-z0-9+#./'\\- ]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[\\s./'\\-]+");
    private static final Map<String, Pattern> KEYWORD_PATTERNS = new ConcurrentHashMap<>();

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "of", "to", "in", "on", "for", "with", "is", "are", "be",
            "do", "does", "i", "me", "my", "we", "our", "you", "your", "it", "this", "that", "these",
            "those", "how", "what", "can", "could", "should", "would", "please", "at", "by", "from",
            "as", "into", "about", "s");

    private QueryText() {}

    /** Lower-cases, strips punctuation other than in identifiers like {@code c++} or {@code ci/cd}, collapses blanks. */
    public static String normalize(String raw) {
        if (raw == null) return "";
        String lower = raw.toLowerCase(Locale.ROOT);
        String cleaned = NON_TEXT.matcher(lower).replaceAll(" ");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    public static List<String> tokens(String normalized) {
        if (normalized == null || normalized.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String t : TOKEN_SPLIT.split(normalized)) {
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    /** Sorted, de-duplicated, stop-word-free token set: word order and repetition do not matter. */
    public static Set<String> topicTerms(String raw) {
        Set<String> terms = new TreeSet<>();
        for (String t : tokens(normalize(raw))) {
            if (!STOP_WORDS.contains(t)) terms.add(t);
        }
        return terms;
    }

    /**
     * Word-start match of {@code keyword} inside {@code normalized}. Keywords of three characters or
     * fewer must match a whole word so that {@code vs} does not fire inside {@code vsync}.
     */
    public static boolean containsKeyword(String normalized, String keyword) {
        Pattern p = KEYWORD_PATTERNS.computeIfAbsent(keyword.toLowerCase(Locale.ROOT), QueryText::compile);
        return p.matcher(normalized).find();
    }

    private static Pattern compile(String keyword) {
        String quoted = Pattern.quote(keyword);
        String tail = keyword.length() <= 3 ? "(?![a-z0-9])" : "";
        return Pattern.compile("(?<![a-z0-9])" + quoted + tail);
    }

    static double longWordRatio(List<String> tokens, int minLength) {
        if (tokens.isEmpty()) return 0.0;
        long longWords = tokens.stream().filter(t -> t.length() >= minLength).count();
        return (double) longWords / tokens.size();
    }

    static List<String> words(String... words) {
        return Arrays.asList(words);
    }
}
