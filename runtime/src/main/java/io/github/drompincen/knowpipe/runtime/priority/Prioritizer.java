package io.github.drompincen.knowpipe.runtime.priority;

import io.github.drompincen.knowpipe.protocol.api.GapType;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import io.github.drompincen.knowpipe.protocol.api.ScheduledTask;
import io.github.drompincen.knowpipe.protocol.api.TaskOrigin;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Weighted priority scoring. Every factor is normalized to [0, 1] and the score is the
 * weight-normalized sum. Ordering is score descending, then enqueue time (FIFO), then task id.
 */
@Service
public class Prioritizer {

    private final PipelineProperties.Priority cfg;
    private final PreferenceRegistry preferences;
    private final Clock clock;
    private final Map<PriorityFactor, Double> weights = new EnumMap<>(PriorityFactor.class);

    public Prioritizer(PipelineProperties properties, PreferenceRegistry preferences, Clock clock) {
        this.cfg = properties.getPriority();
        this.preferences = preferences;
        this.clock = clock;
        weights.put(PriorityFactor.STALENESS, cfg.getStalenessWeight());
        weights.put(PriorityFactor.IMPACT, cfg.getImpactWeight());
        weights.put(PriorityFactor.PREFERENCE, cfg.getPreferenceWeight());
        weights.put(PriorityFactor.URGENCY, cfg.getUrgencyWeight());
        weights.put(PriorityFactor.GAP_SEVERITY, cfg.getGapSeverityWeight());
        weights.put(PriorityFactor.INTERACTIVE, cfg.getInteractiveWeight());
    }

    public PriorityScore score(ScheduledTask task) {
        Instant now = clock.instant();
        KnowledgeGap gap = task.gap();
        Map<PriorityFactor, Double> factors = new EnumMap<>(PriorityFactor.class);

        Instant since = gap != null ? gap.detectedAt() : task.enqueuedAt();
        factors.put(PriorityFactor.STALENESS, staleness(since, now));
        factors.put(PriorityFactor.IMPACT, gap != null ? impact(gap.references()) : clamp(cfg.getRequestBaseImpact()));
        factors.put(PriorityFactor.PREFERENCE,
                clamp(preferences.weightFor(task.requestedBy(), task.request(), gap == null ? null : gap.gapType())));
        factors.put(PriorityFactor.URGENCY, task.request() == null ? 0.0 : task.request().urgency().weight());
        factors.put(PriorityFactor.GAP_SEVERITY, gap == null ? 0.0 : severity(gap.gapType()));
        factors.put(PriorityFactor.INTERACTIVE, task.origin() == TaskOrigin.ON_DEMAND ? 1.0 : 0.0);

        double total = 0.0;
        double weighted = 0.0;
        for (Map.Entry<PriorityFactor, Double> w : weights.entrySet()) {
            total += w.getValue();
            weighted += w.getValue() * factors.get(w.getKey());
        }
        double score = total <= 0 ? 0.0 : weighted / total;
        return new PriorityScore(task.id(), score, factors);
    }

    /** Highest priority first. Scores are computed once per call. */
    public List<ScheduledTask> order(Collection<ScheduledTask> tasks) {
        Map<UUID, Double> scores = new HashMap<>();
        for (ScheduledTask t : tasks) scores.put(t.id(), score(t).score());
        List<ScheduledTask> sorted = new ArrayList<>(tasks);
        sorted.sort(Comparator
                .comparing((ScheduledTask t) -> scores.get(t.id()), Comparator.reverseOrder())
                .thenComparing(ScheduledTask::enqueuedAt)
                .thenComparing(ScheduledTask::id));
        return sorted;
    }

    private double staleness(Instant since, Instant now) {
        if (since == null) return 0.0;
        Duration horizon = cfg.getStalenessHorizon();
        if (horizon.isZero() || horizon.isNegative()) return 1.0;
        double age = Duration.between(since, now).toMillis();
        return clamp(age / horizon.toMillis());
    }

    private double impact(int references) {
        int saturation = Math.max(1, cfg.getImpactSaturation());
        return clamp(Math.log1p(Math.max(0, references)) / Math.log1p(saturation));
    }

    private double severity(GapType type) {
        return clamp(cfg.getGapSeverity().getOrDefault(type, 0.0));
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
