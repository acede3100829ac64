package io.github.drompincen.knowpipe.runtime.gap;

import io.github.drompincen.knowpipe.persistence.document.KnowledgeGapDocument;
import io.github.drompincen.knowpipe.persistence.repository.KnowledgeGapRepository;
import io.github.drompincen.knowpipe.protocol.api.GapStatus;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import io.github.drompincen.knowpipe.runtime.error.GapNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Lifecycle of detected gaps: OPEN until research resolves them or a user dismisses them.
 * Dismissal is final; a resolved gap that is detected again (its cached research expired) reopens.
 */
@Service
public class GapRegistry {

    private static final Logger log = LoggerFactory.getLogger(GapRegistry.class);

    private final KnowledgeGapRepository repository;
    private final Clock clock;

    public GapRegistry(KnowledgeGapRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Records a scan result and returns the gaps that are open, i.e. eligible for scheduling.
     */
    public List<KnowledgeGap> record(List<KnowledgeGap> detected) {
        Instant now = clock.instant();
        List<KnowledgeGap> open = new ArrayList<>();
        for (KnowledgeGap gap : detected) {
            KnowledgeGapDocument doc = repository.findById(gap.id().toString()).orElse(null);
            if (doc == null) {
                doc = new KnowledgeGapDocument();
                doc.setGapId(gap.id().toString());
                doc.setDetectedAt(gap.detectedAt());
            } else if (doc.getStatus() == GapStatus.DISMISSED) {
                log.debug("[GapRegistry] Ignoring dismissed gap {}", gap.id());
                continue;
            } else if (doc.getStatus() == GapStatus.RESOLVED) {
                log.info("[GapRegistry] Reopening gap {} at {}:{}", gap.id(), gap.location(), gap.line());
                doc.setStatus(GapStatus.OPEN);
                doc.setClosedAt(null);
                doc.setTaskId(null);
            }
            doc.setLocation(gap.location());
            doc.setLine(gap.line());
            doc.setGapType(gap.gapType());
            doc.setSemanticScore(gap.semanticScore());
            doc.setDescription(gap.description());
            doc.setReferences(gap.references());
            doc.setLastSeenAt(now);
            repository.save(doc);
            open.add(gap);
        }
        return open;
    }

    /**
     * Resolves open gaps of {@code location} that a re-analysis of the file no longer reports.
     *
     * @return number of gaps closed
     */
    public int reconcileFile(String location, List<KnowledgeGap> current) {
        Set<String> stillPresent = new HashSet<>();
        for (KnowledgeGap gap : current) stillPresent.add(gap.id().toString());
        int closed = 0;
        for (KnowledgeGapDocument doc : repository.findByLocationAndStatus(location, GapStatus.OPEN)) {
            if (stillPresent.contains(doc.getGapId())) continue;
            doc.setStatus(GapStatus.RESOLVED);
            doc.setClosedAt(clock.instant());
            repository.save(doc);
            closed++;
        }
        if (closed > 0) {
            log.info("[GapRegistry] {} gaps in {} fixed at the source", closed, location);
        }
        return closed;
    }

    public void markScheduled(UUID gapId, UUID taskId) {
        repository.findById(gapId.toString()).ifPresent(doc -> {
            doc.setTaskId(taskId.toString());
            repository.save(doc);
        });
    }

    public void resolve(UUID gapId) {
        close(gapId, GapStatus.RESOLVED).ifPresent(doc ->
                log.info("[GapRegistry] Gap {} resolved by task {}", gapId, doc.getTaskId()));
    }

    /**
     * Marks the gap dismissed for good.
     *
     * @return the research task scheduled for the gap, if it had one when it was dismissed
     */
    public Optional<UUID> dismiss(UUID gapId) {
        if (repository.findById(gapId.toString()).isEmpty()) {
            throw new GapNotFoundException(gapId);
        }
        Optional<KnowledgeGapDocument> dismissed = close(gapId, GapStatus.DISMISSED);
        if (dismissed.isEmpty()) {
            return Optional.empty();
        }
        log.info("[GapRegistry] Gap {} dismissed", gapId);
        return Optional.ofNullable(dismissed.get().getTaskId()).map(UUID::fromString);
    }

    public Optional<GapStatus> status(UUID gapId) {
        return repository.findById(gapId.toString()).map(KnowledgeGapDocument::getStatus);
    }

    public boolean isDismissed(UUID gapId) {
        return status(gapId).map(s -> s == GapStatus.DISMISSED).orElse(false);
    }

    /** Empty when the gap is unknown or was already dismissed. */
    private Optional<KnowledgeGapDocument> close(UUID gapId, GapStatus status) {
        return repository.findById(gapId.toString())
                .filter(doc -> doc.getStatus() != GapStatus.DISMISSED)
                .map(doc -> {
                    doc.setStatus(status);
                    doc.setClosedAt(clock.instant());
                    return repository.save(doc);
                });
    }
}
