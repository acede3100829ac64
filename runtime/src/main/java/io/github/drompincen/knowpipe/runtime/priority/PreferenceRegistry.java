package io.github.drompincen.knowpipe.runtime.priority;

import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;
import io.github.drompincen.knowpipe.protocol.api.GapType;
import io.github.drompincen.knowpipe.protocol.api.ResearchType;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user interest weights in [0, 1] for domains, research types and gap types. A task's
 * preference factor is the mean of the weights its requester declared for the task's attributes,
 * or the default when none apply.
 */
@Service
public class PreferenceRegistry {

    private final Map<String, Profile> profiles = new ConcurrentHashMap<>();
    private final double defaultWeight;

    public PreferenceRegistry(PipelineProperties properties) {
        this.defaultWeight = properties.getPriority().getDefaultPreference();
    }

    public void setDomainWeight(String userId, String domain, double weight) {
        profile(userId).domains.put(domain, clamp(weight));
    }

    public void setResearchTypeWeight(String userId, ResearchType type, double weight) {
        profile(userId).researchTypes.put(type.name(), clamp(weight));
    }

    public void setGapTypeWeight(String userId, GapType type, double weight) {
        profile(userId).gapTypes.put(type.name(), clamp(weight));
    }

    public void clear(String userId) {
        profiles.remove(userId);
    }

    public double weightFor(String userId, ClassifiedRequest request, GapType gapType) {
        Profile profile = userId == null ? null : profiles.get(userId);
        if (profile == null) return defaultWeight;
        double sum = 0.0;
        int n = 0;
        if (request != null) {
            Double d = profile.domains.get(request.domain());
            if (d != null) { sum += d; n++; }
            Double t = profile.researchTypes.get(request.researchType().name());
            if (t != null) { sum += t; n++; }
        }
        if (gapType != null) {
            Double g = profile.gapTypes.get(gapType.name());
            if (g != null) { sum += g; n++; }
        }
        return n == 0 ? defaultWeight : sum / n;
    }

    private Profile profile(String userId) {
        return profiles.computeIfAbsent(userId, u -> new Profile());
    }

    private static double clamp(double w) {
        if (Double.isNaN(w)) return 0.0;
        return Math.max(0.0, Math.min(1.0, w));
    }

    private static final class Profile {
        final Map<String, Double> domains = new ConcurrentHashMap<>();
        final Map<String, Double> researchTypes = new ConcurrentHashMap<>();
        final Map<String, Double> gapTypes = new ConcurrentHashMap<>();
    }
}
