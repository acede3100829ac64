package io.github.drompincen.knowpipe.runtime.gap;

import java.util.List;

/**
 * Nearest-neighbour lookup against the embeddings of cached research.
 */
public interface SimilaritySearch {

    /**
     * @return for each query vector, the cosine similarity of the closest cached entry, or
     *         {@code null} when nothing is indexed
     */
    List<Double> nearestSimilarity(List<float[]> vectors);
}
