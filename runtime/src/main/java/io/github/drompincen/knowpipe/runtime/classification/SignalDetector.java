package io.github.drompincen.knowpipe.runtime.classification;

/**
 * Heuristic detector for one classification axis. Implementations must be pure: the same
 * normalized query always yields the same signal.
 */
public interface SignalDetector<L> {

    ClassificationDimension dimension();

    /**
     * @param normalizedQuery output of {@link QueryText#normalize(String)}
     */
    Signal<L> detect(String normalizedQuery);
}
