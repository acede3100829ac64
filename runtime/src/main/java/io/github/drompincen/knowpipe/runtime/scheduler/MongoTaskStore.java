package io.github.drompincen.knowpipe.runtime.scheduler;

import io.github.drompincen.knowpipe.persistence.document.ScheduledTaskDocument;
import io.github.drompincen.knowpipe.persistence.repository.ScheduledTaskRepository;
import io.github.drompincen.knowpipe.protocol.api.CacheKey;
import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import io.github.drompincen.knowpipe.protocol.api.TaskState;
import io.github.drompincen.knowpipe.runtime.cache.CacheKeys;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** {@link TaskStore} over the {@code scheduled_tasks} collection. */
@Component
public class MongoTaskStore implements TaskStore {

    private static final List<TaskState> IN_FLIGHT = List.of(TaskState.QUEUED, TaskState.RUNNING, TaskState.RETRYING);

    private final ScheduledTaskRepository repository;

    public MongoTaskStore(ScheduledTaskRepository repository) {
        this.repository = repository;
    }

    @Override
    public void save(TaskRecord task) {
        repository.save(toDocument(task));
    }

    @Override
    public Optional<TaskRecord> find(UUID taskId) {
        return repository.findById(taskId.toString()).map(MongoTaskStore::fromDocument);
    }

    @Override
    public List<TaskRecord> findInFlight() {
        List<TaskRecord> out = new ArrayList<>();
        for (ScheduledTaskDocument doc : repository.findByStateIn(IN_FLIGHT)) {
            out.add(fromDocument(doc));
        }
        out.sort(Comparator.comparing(TaskRecord::enqueuedAt));
        return out;
    }

    static ScheduledTaskDocument toDocument(TaskRecord task) {
        ScheduledTaskDocument doc = new ScheduledTaskDocument();
        doc.setTaskId(task.id().toString());
        doc.setFingerprint(task.fingerprint());
        doc.setOrigin(task.origin());
        doc.setState(task.state());
        doc.setAttempts(task.attempts());
        doc.setMaxAttempts(task.maxAttempts());
        doc.setEnqueuedAt(task.enqueuedAt());
        doc.setUpdatedAt(task.updatedAt());
        doc.setNextAttemptAt(task.nextAttemptAt());
        doc.setCacheKeyId(task.cacheKey().id());
        doc.setContextHash(task.cacheKey().contextHash());
        doc.setLastError(task.lastError());
        doc.setRequestedBy(task.requestedBy());

        ClassifiedRequest r = task.request();
        ScheduledTaskDocument.RequestSnapshot rs = new ScheduledTaskDocument.RequestSnapshot();
        rs.setRawQuery(r.rawQuery());
        rs.setResearchType(r.researchType());
        rs.setAudience(r.audience());
        rs.setDomain(r.domain());
        rs.setUrgency(r.urgency());
        rs.setConfidence(r.confidence());
        rs.setMatchedKeywords(new ArrayList<>(r.matchedKeywords()));
        doc.setRequest(rs);

        KnowledgeGap g = task.gap();
        if (g != null) {
            ScheduledTaskDocument.GapSnapshot gs = new ScheduledTaskDocument.GapSnapshot();
            gs.setGapId(g.id().toString());
            gs.setLocation(g.location());
            gs.setLine(g.line());
            gs.setGapType(g.gapType());
            gs.setDetectedAt(g.detectedAt());
            gs.setSemanticScore(g.semanticScore());
            gs.setDescription(g.description());
            gs.setContext(g.context());
            gs.setReferences(g.references());
            doc.setGap(gs);
        }
        return doc;
    }

    static TaskRecord fromDocument(ScheduledTaskDocument doc) {
        ScheduledTaskDocument.RequestSnapshot rs = doc.getRequest();
        ClassifiedRequest request = new ClassifiedRequest(rs.getRawQuery(), rs.getResearchType(), rs.getAudience(),
                rs.getDomain(), rs.getUrgency(), rs.getConfidence(), rs.getMatchedKeywords());
        // the topic hash is a pure function of the query, so it is not stored
        CacheKey key = new CacheKey(CacheKeys.topicHash(request.rawQuery()), request.researchType(),
                request.audience(), request.domain(),
                doc.getContextHash() == null ? CacheKeys.NO_CONTEXT : doc.getContextHash());

        KnowledgeGap gap = null;
        ScheduledTaskDocument.GapSnapshot gs = doc.getGap();
        if (gs != null) {
            gap = new KnowledgeGap(UUID.fromString(gs.getGapId()), gs.getLocation(), gs.getLine(), gs.getGapType(),
                    gs.getDetectedAt(), gs.getSemanticScore(), gs.getDescription(), gs.getContext(),
                    gs.getReferences());
        }
        return new TaskRecord(UUID.fromString(doc.getTaskId()), doc.getFingerprint(), doc.getOrigin(), request, key,
                gap, doc.getRequestedBy(), doc.getMaxAttempts(), doc.getEnqueuedAt(), doc.getState(),
                doc.getAttempts(), doc.getUpdatedAt(), doc.getNextAttemptAt(), doc.getLastError());
    }
}
