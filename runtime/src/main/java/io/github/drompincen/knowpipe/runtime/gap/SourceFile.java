package io.github.drompincen.knowpipe.runtime.gap;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * A text file loaded for analysis.
 *
 * @param relativePath project-relative path with forward slashes
 */
public record SourceFile(
        Path path,
        String relativePath,
        String extension,
        List<String> lines,
        Instant lastModified
) {
    public SourceFile {
        lines = List.copyOf(lines);
    }

    public String stem() {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public boolean isMarkdown() {
        return "md".equals(extension) || "markdown".equals(extension);
    }
}
