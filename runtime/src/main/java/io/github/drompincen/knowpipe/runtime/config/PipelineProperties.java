package io.github.drompincen.knowpipe.runtime.config;

import io.github.drompincen.knowpipe.protocol.api.GapType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** All tunables of the pipeline, bound from {@code knowpipe.*}. */
@ConfigurationProperties(prefix = "knowpipe")
public class PipelineProperties {

    private final Classifier classifier = new Classifier();
    private final Cache cache = new Cache();
    private final Gap gap = new Gap();
    private final Priority priority = new Priority();
    private final Scheduler scheduler = new Scheduler();
    private final Notify notify = new Notify();
    private final Proactive proactive = new Proactive();

    /** Longest query {@code submit} accepts. */
    private int maxQueryLength = 4096;

    public Classifier getClassifier() { return classifier; }
    public Cache getCache() { return cache; }
    public Gap getGap() { return gap; }
    public Priority getPriority() { return priority; }
    public Scheduler getScheduler() { return scheduler; }
    public Notify getNotify() { return notify; }
    public Proactive getProactive() { return proactive; }
    public int getMaxQueryLength() { return maxQueryLength; }
    public void setMaxQueryLength(int maxQueryLength) { this.maxQueryLength = maxQueryLength; }

    public static class Classifier {
        private Duration advancedBudget = Duration.ofMillis(500);
        private Duration contextBudget = Duration.ofMillis(100);
        private int poolSize = 4;
        /** Matched keyword weight at which basic confidence reaches 1.0. */
        private double keywordSaturation = 2.0;
        private double researchTypeWeight = 0.35;
        private double audienceWeight = 0.25;
        private double domainWeight = 0.25;
        private double urgencyWeight = 0.15;
        private double urgencyBoost = 1.3;
        private double highConfidenceBoost = 1.1;
        private double lowConfidenceThreshold = 0.3;
        private double lowConfidencePenalty = 0.8;
        private String defaultDomain = "general";
        /** Extra or replacement domain clusters: domain name to keywords. */
        private Map<String, List<String>> domains = new LinkedHashMap<>();

        public Duration getAdvancedBudget() { return advancedBudget; }
        public void setAdvancedBudget(Duration advancedBudget) { this.advancedBudget = advancedBudget; }
        public Duration getContextBudget() { return contextBudget; }
        public void setContextBudget(Duration contextBudget) { this.contextBudget = contextBudget; }
        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
        public double getKeywordSaturation() { return keywordSaturation; }
        public void setKeywordSaturation(double keywordSaturation) { this.keywordSaturation = keywordSaturation; }
        public double getResearchTypeWeight() { return researchTypeWeight; }
        public void setResearchTypeWeight(double researchTypeWeight) { this.researchTypeWeight = researchTypeWeight; }
        public double getAudienceWeight() { return audienceWeight; }
        public void setAudienceWeight(double audienceWeight) { this.audienceWeight = audienceWeight; }
        public double getDomainWeight() { return domainWeight; }
        public void setDomainWeight(double domainWeight) { this.domainWeight = domainWeight; }
        public double getUrgencyWeight() { return urgencyWeight; }
        public void setUrgencyWeight(double urgencyWeight) { this.urgencyWeight = urgencyWeight; }
        public double getUrgencyBoost() { return urgencyBoost; }
        public void setUrgencyBoost(double urgencyBoost) { this.urgencyBoost = urgencyBoost; }
        public double getHighConfidenceBoost() { return highConfidenceBoost; }
        public void setHighConfidenceBoost(double highConfidenceBoost) { this.highConfidenceBoost = highConfidenceBoost; }
        public double getLowConfidenceThreshold() { return lowConfidenceThreshold; }
        public void setLowConfidenceThreshold(double lowConfidenceThreshold) { this.lowConfidenceThreshold = lowConfidenceThreshold; }
        public double getLowConfidencePenalty() { return lowConfidencePenalty; }
        public void setLowConfidencePenalty(double lowConfidencePenalty) { this.lowConfidencePenalty = lowConfidencePenalty; }
        public String getDefaultDomain() { return defaultDomain; }
        public void setDefaultDomain(String defaultDomain) { this.defaultDomain = defaultDomain; }
        public Map<String, List<String>> getDomains() { return domains; }
        public void setDomains(Map<String, List<String>> domains) { this.domains = domains; }
    }

    public static class Cache {
        private int maxEntries = 10_000;
        private long maxSizeBytes = 256L * 1024 * 1024;
        private Duration defaultTtl = Duration.ofHours(24);
        private boolean persistent = true;

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
        public long getMaxSizeBytes() { return maxSizeBytes; }
        public void setMaxSizeBytes(long maxSizeBytes) { this.maxSizeBytes = maxSizeBytes; }
        public Duration getDefaultTtl() { return defaultTtl; }
        public void setDefaultTtl(Duration defaultTtl) { this.defaultTtl = defaultTtl; }
        public boolean isPersistent() { return persistent; }
        public void setPersistent(boolean persistent) { this.persistent = persistent; }
    }

    public static class Gap {
        private List<String> extensions = new ArrayList<>(List.of(
                "java", "kt", "rs", "py", "js", "ts", "go", "md", "yml", "yaml", "properties", "toml"));
        private List<String> excludedDirectories = new ArrayList<>(List.of(
                ".git", ".idea", "target", "build", "node_modules", "dist", ".gradle", "out"));
        private long maxFileSizeBytes = 2L * 1024 * 1024;
        private Duration perFileBudget = Duration.ofMillis(250);
        private int poolSize = 8;
        private Duration staleDocumentationAfter = Duration.ofDays(30);
        private double coveredThreshold = 0.92;
        private double lowConfidenceThreshold = 0.75;
        private int semanticBatchSize = 32;

        public List<String> getExtensions() { return extensions; }
        public void setExtensions(List<String> extensions) { this.extensions = extensions; }
        public List<String> getExcludedDirectories() { return excludedDirectories; }
        public void setExcludedDirectories(List<String> excludedDirectories) { this.excludedDirectories = excludedDirectories; }
        public long getMaxFileSizeBytes() { return maxFileSizeBytes; }
        public void setMaxFileSizeBytes(long maxFileSizeBytes) { this.maxFileSizeBytes = maxFileSizeBytes; }
        public Duration getPerFileBudget() { return perFileBudget; }
        public void setPerFileBudget(Duration perFileBudget) { this.perFileBudget = perFileBudget; }
        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
        public Duration getStaleDocumentationAfter() { return staleDocumentationAfter; }
        public void setStaleDocumentationAfter(Duration staleDocumentationAfter) { this.staleDocumentationAfter = staleDocumentationAfter; }
        public double getCoveredThreshold() { return coveredThreshold; }
        public void setCoveredThreshold(double coveredThreshold) { this.coveredThreshold = coveredThreshold; }
        public double getLowConfidenceThreshold() { return lowConfidenceThreshold; }
        public void setLowConfidenceThreshold(double lowConfidenceThreshold) { this.lowConfidenceThreshold = lowConfidenceThreshold; }
        public int getSemanticBatchSize() { return semanticBatchSize; }
        public void setSemanticBatchSize(int semanticBatchSize) { this.semanticBatchSize = semanticBatchSize; }
    }

    public static class Priority {
        private double stalenessWeight = 0.2;
        private double impactWeight = 0.2;
        private double preferenceWeight = 0.15;
        private double urgencyWeight = 0.25;
        private double gapSeverityWeight = 0.1;
        private double interactiveWeight = 0.3;
        private Duration stalenessHorizon = Duration.ofHours(24);
        private int impactSaturation = 20;
        private double requestBaseImpact = 0.5;
        private double defaultPreference = 0.5;
        private Map<GapType, Double> gapSeverity = new EnumMap<>(Map.of(
                GapType.MISSING, 0.6,
                GapType.INCONSISTENT, 0.7,
                GapType.OUTDATED, 0.5,
                GapType.ORPHANED, 0.4,
                GapType.LOW_CONFIDENCE, 0.3));

        public double getStalenessWeight() { return stalenessWeight; }
        public void setStalenessWeight(double stalenessWeight) { this.stalenessWeight = stalenessWeight; }
        public double getImpactWeight() { return impactWeight; }
        public void setImpactWeight(double impactWeight) { this.impactWeight = impactWeight; }
        public double getPreferenceWeight() { return preferenceWeight; }
        public void setPreferenceWeight(double preferenceWeight) { this.preferenceWeight = preferenceWeight; }
        public double getUrgencyWeight() { return urgencyWeight; }
        public void setUrgencyWeight(double urgencyWeight) { this.urgencyWeight = urgencyWeight; }
        public double getGapSeverityWeight() { return gapSeverityWeight; }
        public void setGapSeverityWeight(double gapSeverityWeight) { this.gapSeverityWeight = gapSeverityWeight; }
        public double getInteractiveWeight() { return interactiveWeight; }
        public void setInteractiveWeight(double interactiveWeight) { this.interactiveWeight = interactiveWeight; }
        public Duration getStalenessHorizon() { return stalenessHorizon; }
        public void setStalenessHorizon(Duration stalenessHorizon) { this.stalenessHorizon = stalenessHorizon; }
        public int getImpactSaturation() { return impactSaturation; }
        public void setImpactSaturation(int impactSaturation) { this.impactSaturation = impactSaturation; }
        public double getRequestBaseImpact() { return requestBaseImpact; }
        public void setRequestBaseImpact(double requestBaseImpact) { this.requestBaseImpact = requestBaseImpact; }
        public double getDefaultPreference() { return defaultPreference; }
        public void setDefaultPreference(double defaultPreference) { this.defaultPreference = defaultPreference; }
        public Map<GapType, Double> getGapSeverity() { return gapSeverity; }
        public void setGapSeverity(Map<GapType, Double> gapSeverity) { this.gapSeverity = gapSeverity; }
    }

    public static class Scheduler {
        private int maxConcurrency = 5;
        private int maxAttempts = 3;
        private Duration retryBackoff = Duration.ofSeconds(2);
        private Duration maxRetryBackoff = Duration.ofMinutes(5);
        private Duration executorTimeout = Duration.ofMinutes(10);
        private int maxQueueDepth = 100;

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
        public Duration getMaxRetryBackoff() { return maxRetryBackoff; }
        public void setMaxRetryBackoff(Duration maxRetryBackoff) { this.maxRetryBackoff = maxRetryBackoff; }
        public Duration getExecutorTimeout() { return executorTimeout; }
        public void setExecutorTimeout(Duration executorTimeout) { this.executorTimeout = executorTimeout; }
        public int getMaxQueueDepth() { return maxQueueDepth; }
        public void setMaxQueueDepth(int maxQueueDepth) { this.maxQueueDepth = maxQueueDepth; }
    }

    public static class Notify {
        private int mailboxCapacity = 64;
        private Duration channelTimeout = Duration.ofSeconds(3);
        private int maxRetries = 2;
        private Duration retryBackoff = Duration.ofMillis(200);
        private Duration progressInterval = Duration.ofSeconds(1);
        private int poolSize = 4;
        private boolean cliEnabled = false;
        private String fileLogPath;
        private String webhookUrl;

        public int getMailboxCapacity() { return mailboxCapacity; }
        public void setMailboxCapacity(int mailboxCapacity) { this.mailboxCapacity = mailboxCapacity; }
        public Duration getChannelTimeout() { return channelTimeout; }
        public void setChannelTimeout(Duration channelTimeout) { this.channelTimeout = channelTimeout; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
        public Duration getProgressInterval() { return progressInterval; }
        public void setProgressInterval(Duration progressInterval) { this.progressInterval = progressInterval; }
        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
        public boolean isCliEnabled() { return cliEnabled; }
        public void setCliEnabled(boolean cliEnabled) { this.cliEnabled = cliEnabled; }
        public String getFileLogPath() { return fileLogPath; }
        public void setFileLogPath(String fileLogPath) { this.fileLogPath = fileLogPath; }
        public String getWebhookUrl() { return webhookUrl; }
        public void setWebhookUrl(String webhookUrl) { this.webhookUrl = webhookUrl; }
    }

    public static class Proactive {
        private boolean enabled = false;
        private boolean watchEnabled = false;
        private String projectRoot = ".";
        private String requestedBy = "proactive";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isWatchEnabled() { return watchEnabled; }
        public void setWatchEnabled(boolean watchEnabled) { this.watchEnabled = watchEnabled; }
        public String getProjectRoot() { return projectRoot; }
        public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
        public String getRequestedBy() { return requestedBy; }
        public void setRequestedBy(String requestedBy) { this.requestedBy = requestedBy; }
    }
}
