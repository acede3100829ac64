package io.github.drompincen.knowpipe.runtime.gap;

import io.github.drompincen.knowpipe.persistence.document.KnowledgeGapDocument;
import io.github.drompincen.knowpipe.persistence.repository.KnowledgeGapRepository;
import io.github.drompincen.knowpipe.protocol.api.GapStatus;
import io.github.drompincen.knowpipe.protocol.api.GapType;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import io.github.drompincen.knowpipe.runtime.error.GapNotFoundException;
import io.github.drompincen.knowpipe.runtime.support.MutableClock;
import io.github.drompincen.knowpipe.runtime.support.Requests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GapRegistryTest {

    @Mock private KnowledgeGapRepository repository;

    private final Map<String, KnowledgeGapDocument> stored = new HashMap<>();
    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    private GapRegistry registry;

    @BeforeEach
    void setUp() {
        when(repository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(stored.get((String) inv.getArgument(0))));
        when(repository.save(any(KnowledgeGapDocument.class))).thenAnswer(inv -> {
            KnowledgeGapDocument doc = inv.getArgument(0);
            stored.put(doc.getGapId(), doc);
            return doc;
        });
        when(repository.findByLocationAndStatus(anyString(), any())).thenAnswer(inv -> stored.values().stream()
                .filter(d -> d.getLocation().equals(inv.getArgument(0)) && d.getStatus() == inv.getArgument(1))
                .toList());
        registry = new GapRegistry(repository, clock);
    }

    private KnowledgeGap gap(int line) {
        return Requests.gap("docs/api.md", line, GapType.ORPHANED, "broken link to x" + line, clock.instant());
    }

    @Test
    void recordsNewGapsAsOpen() {
        List<KnowledgeGap> open = registry.record(List.of(gap(1), gap(2)));

        assertThat(open).hasSize(2);
        assertThat(registry.status(gap(1).id())).contains(GapStatus.OPEN);
        assertThat(stored.get(gap(2).id().toString()).getLastSeenAt()).isEqualTo(clock.instant());
    }

    @Test
    void dismissedGapsAreNeverReturnedAgain() {
        registry.record(List.of(gap(1)));
        registry.dismiss(gap(1).id());

        List<KnowledgeGap> open = registry.record(List.of(gap(1)));

        assertThat(open).isEmpty();
        assertThat(registry.isDismissed(gap(1).id())).isTrue();
    }

    @Test
    void resolveDoesNotOverrideDismissal() {
        registry.record(List.of(gap(1)));
        registry.dismiss(gap(1).id());

        registry.resolve(gap(1).id());

        assertThat(registry.status(gap(1).id())).contains(GapStatus.DISMISSED);
    }

    @Test
    void dismissalHandsBackTheScheduledTaskOnce() {
        UUID task = UUID.randomUUID();
        registry.record(List.of(gap(1)));
        registry.markScheduled(gap(1).id(), task);

        assertThat(registry.dismiss(gap(1).id())).contains(task);
        assertThat(registry.dismiss(gap(1).id())).isEmpty();
        assertThat(registry.dismiss(gap(1).id())).isEmpty();
    }

    @Test
    void resolvingADismissedGapWritesNothing() {
        registry.record(List.of(gap(1)));
        registry.dismiss(gap(1).id());
        clearInvocations(repository);

        registry.resolve(gap(1).id());

        verify(repository, never()).save(any());
        assertThat(stored.get(gap(1).id().toString()).getStatus()).isEqualTo(GapStatus.DISMISSED);
    }

    @Test
    void resolvedGapReopensWhenDetectedAgain() {
        registry.record(List.of(gap(1)));
        registry.markScheduled(gap(1).id(), UUID.randomUUID());
        registry.resolve(gap(1).id());
        assertThat(registry.status(gap(1).id())).contains(GapStatus.RESOLVED);

        List<KnowledgeGap> open = registry.record(List.of(gap(1)));

        assertThat(open).hasSize(1);
        KnowledgeGapDocument doc = stored.get(gap(1).id().toString());
        assertThat(doc.getStatus()).isEqualTo(GapStatus.OPEN);
        assertThat(doc.getTaskId()).isNull();
        assertThat(doc.getClosedAt()).isNull();
    }

    @Test
    void reconcileClosesGapsNoLongerReported() {
        registry.record(List.of(gap(1), gap(2)));

        int closed = registry.reconcileFile("docs/api.md", List.of(gap(2)));

        assertThat(closed).isEqualTo(1);
        assertThat(registry.status(gap(1).id())).contains(GapStatus.RESOLVED);
        assertThat(registry.status(gap(2).id())).contains(GapStatus.OPEN);
    }

    @Test
    void dismissUnknownGapFails() {
        UUID unknown = UUID.randomUUID();

        assertThatThrownBy(() -> registry.dismiss(unknown)).isInstanceOf(GapNotFoundException.class);
        verify(repository, never()).save(any());
    }
}
