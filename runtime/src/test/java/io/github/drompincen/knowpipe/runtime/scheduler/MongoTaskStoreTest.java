package io.github.drompincen.knowpipe.runtime.scheduler;

import io.github.drompincen.knowpipe.persistence.document.ScheduledTaskDocument;
import io.github.drompincen.knowpipe.persistence.repository.ScheduledTaskRepository;
import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;
import io.github.drompincen.knowpipe.protocol.api.ContextHints;
import io.github.drompincen.knowpipe.protocol.api.GapType;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import io.github.drompincen.knowpipe.protocol.api.TaskState;
import io.github.drompincen.knowpipe.runtime.cache.CacheKeys;
import io.github.drompincen.knowpipe.runtime.support.Requests;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MongoTaskStoreTest {

    @Mock private ScheduledTaskRepository repository;

    private final Instant t0 = Instant.parse("2026-03-02T09:00:00Z");

    @Test
    void restoredTaskKeepsCacheKeyAndGap() {
        KnowledgeGap gap = Requests.gap("src/Widget.java", 6, GapType.MISSING, "undocumented public type Widget", t0)
                .withSemanticScore(0.4)
                .withReferences(2);
        ClassifiedRequest request = Requests.request(gap.researchQuery());
        TaskSubject subject = TaskSubject.proactive(gap, request,
                CacheKeys.derive(request, ContextHints.forProject(gap.location())), "proactive");
        TaskRecord record = new TaskRecord(subject.taskId(0), subject, 3, t0);
        record.transition(TaskState.RUNNING, t0.plusSeconds(1));

        TaskRecord restored = MongoTaskStore.fromDocument(MongoTaskStore.toDocument(record));

        assertThat(restored.cacheKey()).isEqualTo(subject.cacheKey());
        assertThat(restored.fingerprint()).isEqualTo(subject.fingerprint());
        assertThat(restored.gap()).isEqualTo(gap);
        assertThat(restored.state()).isEqualTo(TaskState.RUNNING);
        assertThat(restored.attempts()).isEqualTo(1);
    }

    @Test
    void inFlightTasksComeBackOldestFirst() {
        TaskRecord older = new TaskRecord(UUID.randomUUID(), Requests.onDemand("older", "alice"), 3, t0);
        TaskRecord newer = new TaskRecord(UUID.randomUUID(), Requests.onDemand("newer", "alice"), 3, t0.plusSeconds(5));
        List<ScheduledTaskDocument> docs = List.of(MongoTaskStore.toDocument(newer), MongoTaskStore.toDocument(older));
        when(repository.findByStateIn(List.of(TaskState.QUEUED, TaskState.RUNNING, TaskState.RETRYING))).thenReturn(docs);

        List<TaskRecord> inFlight = new MongoTaskStore(repository).findInFlight();

        assertThat(inFlight).extracting(TaskRecord::id).containsExactly(older.id(), newer.id());
    }
}
