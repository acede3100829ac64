package io.github.drompincen.knowpipe.runtime.gap;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Set;

/** Scan-wide facts every detector sees: the project root, the scan instant and the extensions in scope. */
public record ScanContext(Path root, Instant now, Set<String> extensions) {

    public ScanContext {
        extensions = Set.copyOf(extensions);
    }
}
