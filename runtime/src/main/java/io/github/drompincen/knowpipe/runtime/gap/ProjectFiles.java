package io.github.drompincen.knowpipe.runtime.gap;

import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/** Which files and directories of a project are in scope for gap analysis. */
public class ProjectFiles {

    private final Set<String> extensions;
    private final Set<String> excludedDirectories;
    private final long maxFileSizeBytes;

    public ProjectFiles(PipelineProperties.Gap cfg) {
        this.extensions = Set.copyOf(cfg.getExtensions().stream().map(e -> e.toLowerCase(Locale.ROOT)).toList());
        this.excludedDirectories = Set.copyOf(cfg.getExcludedDirectories());
        this.maxFileSizeBytes = cfg.getMaxFileSizeBytes();
    }

    public Set<String> extensions() {
        return extensions;
    }

    public long maxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public boolean isExcludedDirectory(Path dir) {
        Path name = dir.getFileName();
        return name != null && excludedDirectories.contains(name.toString());
    }

    /** True when no path element between {@code root} and {@code file} is an excluded directory. */
    public boolean isInScope(Path root, Path file) {
        Path relative = root.relativize(file);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (excludedDirectories.contains(relative.getName(i).toString())) return false;
        }
        return extensions.contains(extension(file));
    }

    public static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String relative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
