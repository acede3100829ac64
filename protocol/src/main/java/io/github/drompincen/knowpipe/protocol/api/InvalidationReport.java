package io.github.drompincen.knowpipe.protocol.api;

import java.util.List;

public record InvalidationReport(
        boolean dryRun,
        List<String> matchedKeys,
        long bytesReclaimed
) {
    public InvalidationReport {
        matchedKeys = matchedKeys == null ? List.of() : List.copyOf(matchedKeys);
    }

    public int matchedCount() {
        return matchedKeys.size();
    }
}
