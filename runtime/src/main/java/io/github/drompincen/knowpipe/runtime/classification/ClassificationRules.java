package io.github.drompincen.knowpipe.runtime.classification;

import io.github.drompincen.knowpipe.protocol.api.AudienceLevel;
import io.github.drompincen.knowpipe.protocol.api.ResearchType;
import io.github.drompincen.knowpipe.protocol.api.UrgencyLevel;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword tables for every detector. Domain clusters can be extended or replaced through
 * {@code knowpipe.classifier.domains}; the remaining tables are built in.
 */
@Component
public class ClassificationRules {

    private final List<KeywordRule<ResearchType>> researchTypeRules;
    private final List<KeywordRule<AudienceLevel>> audienceRules;
    private final List<KeywordRule<UrgencyLevel>> urgencyRules;
    private final List<KeywordRule<String>> domainRules;
    private final List<String> jargon;
    private final String defaultDomain;

    public ClassificationRules(PipelineProperties properties) {
        PipelineProperties.Classifier cfg = properties.getClassifier();
        this.defaultDomain = cfg.getDefaultDomain();
        this.researchTypeRules = defaultResearchTypeRules();
        this.audienceRules = defaultAudienceRules();
        this.urgencyRules = defaultUrgencyRules();
        this.domainRules = domainRules(cfg.getDomains());
        this.jargon = List.of("latency", "throughput", "idempotent", "linearizable", "consensus",
                "serialization", "allocation", "backpressure", "sharding", "partitioning", "mutex",
                "semaphore", "monad", "lifetime", "borrow checker", "vtable", "syscall", "invariant",
                "amortized", "contention", "cache line", "happens-before", "reentrant");
    }

    public List<KeywordRule<ResearchType>> researchTypeRules() { return researchTypeRules; }
    public List<KeywordRule<AudienceLevel>> audienceRules() { return audienceRules; }
    public List<KeywordRule<UrgencyLevel>> urgencyRules() { return urgencyRules; }
    public List<KeywordRule<String>> domainRules() { return domainRules; }
    public List<String> jargon() { return jargon; }
    public String defaultDomain() { return defaultDomain; }

    static List<KeywordRule<ResearchType>> defaultResearchTypeRules() {
        List<KeywordRule<ResearchType>> rules = new ArrayList<>();
        rules.add(KeywordRule.of(ResearchType.DECISION, 1, weights(
                1.0, "choose", "decide", "versus", "vs", "compare", "comparison", "should i", "should we",
                "which", "pros and cons", "trade-off", "tradeoff",
                0.6, "select", "recommend", "alternative", "option", "better", "best")));
        rules.add(KeywordRule.of(ResearchType.IMPLEMENTATION, 1, weights(
                1.0, "implement", "build", "create", "how to", "how do i", "how can i", "set up", "setup",
                "configure", "integrate",
                0.6, "develop", "code", "write", "add", "example", "tutorial", "step by step", "make")));
        rules.add(KeywordRule.of(ResearchType.TROUBLESHOOTING, 2, weights(
                1.0, "error", "bug", "fix", "debug", "crash", "exception", "not working", "broken", "fails",
                "failing", "panic", "stack trace",
                0.6, "problem", "issue", "wrong", "unexpected", "slow", "hangs", "leak")));
        rules.add(KeywordRule.of(ResearchType.LEARNING, 1, weights(
                1.0, "what is", "what are", "explain", "understand", "learn", "concept", "overview",
                "introduction",
                0.6, "why", "difference between", "meaning", "basics", "theory", "how does")));
        rules.add(KeywordRule.of(ResearchType.VALIDATION, 1, weights(
                1.0, "test", "verify", "validate", "benchmark", "audit", "review", "is it correct",
                "is this correct",
                0.6, "check", "ensure", "confirm", "assert", "coverage", "correctness")));
        return Collections.unmodifiableList(rules);
    }

    static List<KeywordRule<AudienceLevel>> defaultAudienceRules() {
        List<KeywordRule<AudienceLevel>> rules = new ArrayList<>();
        rules.add(new KeywordRule<>(AudienceLevel.BEGINNER, weights(
                1.2, "beginner", "new to", "getting started", "first time", "never used", "from scratch",
                "eli5", "simple explanation", "basics", "newbie",
                0.6, "simple", "easy", "introduction", "what is a"),
                List.of(Pattern.compile("\\bi(?:'m| am) (?:new|learning|a student)\\b"),
                        Pattern.compile("\\b(?:don't|do not) understand\\b")),
                1.2, 1));
        rules.add(new KeywordRule<>(AudienceLevel.ADVANCED, weights(
                1.0, "internals", "under the hood", "deep dive", "lock-free", "memory model", "zero-copy",
                "optimize", "optimization", "performance tuning", "bytecode", "jit", "garbage collector",
                "kernel", "formal", "proof",
                0.6, "architecture", "scalability", "trade-offs", "distributed", "low-level", "profiling"),
                List.of(Pattern.compile("\\bin production\\b"), Pattern.compile("\\bat scale\\b")),
                0.6, 1));
        return Collections.unmodifiableList(rules);
    }

    static List<KeywordRule<UrgencyLevel>> defaultUrgencyRules() {
        List<KeywordRule<UrgencyLevel>> rules = new ArrayList<>();
        rules.add(KeywordRule.of(UrgencyLevel.URGENT, 3, weights(
                1.0, "urgent", "asap", "emergency", "outage", "production down", "prod down", "critical",
                "immediately", "blocker", "right now", "sev1", "p0")));
        rules.add(KeywordRule.of(UrgencyLevel.HIGH, 2, weights(
                1.0, "soon", "today", "deadline", "quickly", "important", "tonight", "before release",
                0.6, "broken", "failing", "regression", "blocked")));
        rules.add(KeywordRule.of(UrgencyLevel.LOW, 1, weights(
                1.0, "eventually", "someday", "no rush", "curious", "when you have time", "nice to have",
                "low priority", "for future", "at some point")));
        return Collections.unmodifiableList(rules);
    }

    static Map<String, List<String>> defaultDomainClusters() {
        Map<String, List<String>> clusters = new LinkedHashMap<>();
        clusters.put("async", List.of("async", "await", "asynchronous", "concurrency", "concurrent",
                "retry", "retries", "backoff", "future", "promise", "coroutine", "reactive",
                "non-blocking", "event loop", "executor", "thread"));
        clusters.put("rust", List.of("rust", "cargo", "crate", "tokio", "borrow", "lifetime", "trait",
                "rustc", "serde", "clippy"));
        clusters.put("java", List.of("java", "jvm", "spring", "maven", "gradle", "jdk", "hibernate",
                "junit", "kotlin", "bean"));
        clusters.put("web", List.of("http", "rest", "api", "frontend", "react", "javascript",
                "typescript", "css", "html", "browser", "graphql", "websocket", "endpoint"));
        clusters.put("devops", List.of("docker", "kubernetes", "k8s", "helm", "terraform", "ci/cd",
                "pipeline", "deploy", "deployment", "ansible", "container", "jenkins"));
        clusters.put("ai", List.of("machine learning", "ml", "llm", "model", "embedding", "neural",
                "training", "inference", "prompt", "transformer", "vector"));
        clusters.put("database", List.of("database", "sql", "postgres", "mysql", "mongodb", "mongo",
                "query plan", "index", "schema", "migration", "redis", "transaction"));
        clusters.put("security", List.of("security", "auth", "authentication", "authorization", "oauth",
                "jwt", "encryption", "tls", "vulnerability", "xss", "csrf", "secret"));
        clusters.put("testing", List.of("unit test", "integration test", "mock", "mockito", "fixture",
                "test coverage", "tdd", "assertion", "flaky"));
        return clusters;
    }

    private static List<KeywordRule<String>> domainRules(Map<String, List<String>> overrides) {
        Map<String, List<String>> clusters = defaultDomainClusters();
        if (overrides != null) clusters.putAll(overrides);
        List<KeywordRule<String>> rules = new ArrayList<>();
        int priority = clusters.size();
        for (Map.Entry<String, List<String>> cluster : clusters.entrySet()) {
            Map<String, Double> keywords = new LinkedHashMap<>();
            List<String> words = cluster.getValue();
            for (int i = 0; i < words.size(); i++) {
                // the cluster's first keyword is its name and counts double
                keywords.put(words.get(i), i == 0 ? 1.0 : 0.6);
            }
            rules.add(KeywordRule.of(cluster.getKey(), priority--, keywords));
        }
        return Collections.unmodifiableList(rules);
    }

    /** Alternating list of a weight followed by the keywords that carry it. */
    private static Map<String, Double> weights(Object... pairs) {
        Map<String, Double> out = new LinkedHashMap<>();
        double current = 1.0;
        for (Object o : pairs) {
            if (o instanceof Double d) {
                current = d;
            } else {
                out.put((String) o, current);
            }
        }
        return out;
    }
}
