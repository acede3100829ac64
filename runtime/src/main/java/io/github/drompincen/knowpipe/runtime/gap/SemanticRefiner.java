package io.github.drompincen.knowpipe.runtime.gap;

import io.github.drompincen.knowpipe.protocol.api.GapType;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scores gaps against existing knowledge by embedding similarity. Gaps at or above the covered
 * threshold are dropped; those at or above the low-confidence threshold become
 * {@link GapType#LOW_CONFIDENCE}. Without both collaborators, or when they fail, gaps pass through
 * unchanged.
 */
@Component
public class SemanticRefiner {

    private static final Logger log = LoggerFactory.getLogger(SemanticRefiner.class);

    private final EmbeddingModel embeddings;
    private final SimilaritySearch search;
    private final double coveredThreshold;
    private final double lowConfidenceThreshold;
    private final int batchSize;

    public SemanticRefiner(Optional<EmbeddingModel> embeddings,
                           Optional<SimilaritySearch> search,
                           PipelineProperties properties) {
        this.embeddings = embeddings.orElse(null);
        this.search = search.orElse(null);
        PipelineProperties.Gap cfg = properties.getGap();
        this.coveredThreshold = cfg.getCoveredThreshold();
        this.lowConfidenceThreshold = cfg.getLowConfidenceThreshold();
        this.batchSize = Math.max(1, cfg.getSemanticBatchSize());
    }

    public boolean isEnabled() {
        return embeddings != null && search != null;
    }

    public List<KnowledgeGap> refine(List<KnowledgeGap> gaps) {
        if (!isEnabled() || gaps.isEmpty()) return gaps;
        List<KnowledgeGap> out = new ArrayList<>(gaps.size());
        for (int from = 0; from < gaps.size(); from += batchSize) {
            List<KnowledgeGap> batch = gaps.subList(from, Math.min(gaps.size(), from + batchSize));
            List<Double> scores;
            try {
                scores = score(batch);
            } catch (RuntimeException e) {
                log.warn("[GapAnalyzer] Semantic refinement unavailable, keeping {} pattern-only gaps: {}",
                        batch.size(), e.getMessage());
                out.addAll(batch);
                continue;
            }
            for (int i = 0; i < batch.size(); i++) {
                KnowledgeGap gap = batch.get(i);
                Double score = scores.get(i);
                if (score == null) {
                    out.add(gap);
                } else if (score >= coveredThreshold) {
                    log.debug("[GapAnalyzer] {}:{} already covered (similarity {})", gap.location(), gap.line(), score);
                } else if (score >= lowConfidenceThreshold) {
                    out.add(gap.reclassified(GapType.LOW_CONFIDENCE, score));
                } else {
                    out.add(gap.withSemanticScore(score));
                }
            }
        }
        return out;
    }

    private List<Double> score(List<KnowledgeGap> batch) {
        List<String> texts = new ArrayList<>(batch.size());
        for (KnowledgeGap gap : batch) {
            texts.add(gap.description() + "\n" + gap.context());
        }
        List<float[]> vectors = embeddings.embed(texts);
        if (vectors.size() != batch.size()) {
            throw new IllegalStateException("embedding model returned " + vectors.size()
                    + " vectors for " + batch.size() + " texts");
        }
        List<Double> scores = search.nearestSimilarity(vectors);
        if (scores.size() != batch.size()) {
            throw new IllegalStateException("similarity search returned " + scores.size()
                    + " scores for " + batch.size() + " vectors");
        }
        return scores;
    }
}
