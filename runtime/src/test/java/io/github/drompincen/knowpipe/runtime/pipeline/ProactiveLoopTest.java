package io.github.drompincen.knowpipe.runtime.pipeline;

import io.github.drompincen.knowpipe.protocol.api.GapType;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import io.github.drompincen.knowpipe.protocol.api.TaskOrigin;
import io.github.drompincen.knowpipe.runtime.classification.RequestClassifier;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import io.github.drompincen.knowpipe.runtime.gap.GapAnalyzer;
import io.github.drompincen.knowpipe.runtime.gap.GapRegistry;
import io.github.drompincen.knowpipe.runtime.scheduler.ResearchScheduler;
import io.github.drompincen.knowpipe.runtime.scheduler.TaskSubject;
import io.github.drompincen.knowpipe.runtime.support.Requests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ProactiveLoopTest {

    @Mock private GapAnalyzer analyzer;
    @Mock private GapRegistry registry;
    @Mock private RequestClassifier classifier;
    @Mock private ResearchScheduler scheduler;

    @TempDir Path root;

    private final Instant now = Instant.parse("2026-03-02T09:00:00Z");
    private PipelineProperties properties;
    private ProactiveLoop loop;

    private final KnowledgeGap missing = Requests.gap("src/A.java", 3, GapType.MISSING, "undocumented public type A", now);
    private final KnowledgeGap todo = Requests.gap("src/A.java", 9, GapType.INCONSISTENT, "TODO: retry", now);
    private final KnowledgeGap link = Requests.gap("README.md", 2, GapType.ORPHANED, "broken link to docs/x.md", now);

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getProactive().setEnabled(true);
        properties.getProactive().setProjectRoot(root.toString());
        when(registry.record(anyList())).thenAnswer(inv -> inv.getArgument(0));
        when(classifier.classify(any(), any())).thenAnswer(inv -> Requests.request(inv.getArgument(0)));
        when(scheduler.enqueue(any())).thenAnswer(inv -> Optional.of(((TaskSubject) inv.getArgument(0)).taskId(0)));
        loop = new ProactiveLoop(analyzer, registry, classifier, scheduler, properties);
    }

    @Test
    void everyOpenGapBecomesAProactiveTask() {
        when(analyzer.scan(root.toAbsolutePath().normalize())).thenReturn(List.of(missing, todo, link));

        assertThat(loop.scanProject()).isEqualTo(3);

        ArgumentCaptor<TaskSubject> subjects = ArgumentCaptor.forClass(TaskSubject.class);
        verify(scheduler, times(3)).enqueue(subjects.capture());
        assertThat(subjects.getAllValues()).allSatisfy(s -> {
            assertThat(s.origin()).isEqualTo(TaskOrigin.PROACTIVE);
            assertThat(s.requestedBy()).isEqualTo("proactive");
        });
        assertThat(subjects.getAllValues()).extracting(s -> s.request().rawQuery())
                .containsExactly(missing.researchQuery(), todo.researchQuery(), link.researchQuery());
        verify(registry).markScheduled(missing.id(), Requests.proactive(missing).taskId(0));
        verify(registry, times(3)).markScheduled(any(), any());
    }

    @Test
    void fullBacklogDefersTheRestToTheNextCycle() {
        when(analyzer.scan(any())).thenReturn(List.of(missing, todo, link));
        doReturn(Optional.of(UUID.randomUUID()), Optional.empty()).when(scheduler).enqueue(any());

        assertThat(loop.scanProject()).isEqualTo(1);

        verify(scheduler, times(2)).enqueue(any());
        verify(registry).markScheduled(any(), any());
        verify(registry, never()).markScheduled(eq(todo.id()), any());
    }

    @Test
    void changedFileIsReconciledByRelativePath() {
        Path file = root.resolve("src/A.java");
        when(analyzer.onFileChanged(root.toAbsolutePath().normalize(), file.toAbsolutePath().normalize()))
                .thenReturn(List.of(todo));

        assertThat(loop.onFileChanged(Path.of("src/A.java"))).isEqualTo(1);

        verify(registry).reconcileFile("src/A.java", List.of(todo));
        verify(registry).markScheduled(any(), any());
    }

    @Test
    void analyzerFailureOnChangeIsContained() {
        when(analyzer.onFileChanged(any(), any())).thenThrow(new IllegalStateException("disk gone"));

        assertThat(loop.onFileChanged(Path.of("src/A.java"))).isZero();
        verifyNoInteractions(scheduler);
    }

    @Test
    void disabledLoopDoesNotScan() {
        properties.getProactive().setEnabled(false);
        loop = new ProactiveLoop(analyzer, registry, classifier, scheduler, properties);

        loop.runCycle();
        loop.startWatching();

        verifyNoInteractions(analyzer, scheduler);
    }
}
