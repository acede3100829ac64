package io.github.drompincen.knowpipe.runtime.gap;

import io.github.drompincen.knowpipe.protocol.api.GapType;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * A Markdown document older than the newest source file in the same directory by more than the
 * staleness window.
 */
@Component
public class StaleDocumentationDetector implements GapDetector {

    private final Duration window;

    @Autowired
    public StaleDocumentationDetector(PipelineProperties properties) {
        this(properties.getGap().getStaleDocumentationAfter());
    }

    StaleDocumentationDetector(Duration window) {
        this.window = window;
    }

    @Override
    public GapType gapType() {
        return GapType.OUTDATED;
    }

    @Override
    public boolean supports(SourceFile file) {
        return file.isMarkdown();
    }

    @Override
    public List<KnowledgeGap> detect(SourceFile file, ScanContext context) throws IOException {
        Path dir = file.path().getParent();
        Path newest = null;
        Instant newestTime = Instant.MIN;
        try (Stream<Path> siblings = Files.list(dir)) {
            for (Path p : (Iterable<Path>) siblings::iterator) {
                if (!Files.isRegularFile(p)) continue;
                String ext = ProjectFiles.extension(p);
                if (ext.equals("md") || ext.equals("markdown") || !context.extensions().contains(ext)) continue;
                Instant modified = Files.getLastModifiedTime(p).toInstant();
                if (modified.isAfter(newestTime)) {
                    newestTime = modified;
                    newest = p;
                }
            }
        }
        if (newest == null) return List.of();
        Duration lag = Duration.between(file.lastModified(), newestTime);
        if (lag.compareTo(window) <= 0) return List.of();
        String description = "documentation is " + lag.toDays() + " days older than "
                + newest.getFileName();
        return List.of(gap(file, context, 1, description, file.lines().isEmpty() ? "" : file.lines().get(0)));
    }
}
