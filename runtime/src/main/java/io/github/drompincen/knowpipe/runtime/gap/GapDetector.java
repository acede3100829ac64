package io.github.drompincen.knowpipe.runtime.gap;

import io.github.drompincen.knowpipe.protocol.api.GapType;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;

import java.io.IOException;
import java.util.List;

public interface GapDetector {

    GapType gapType();

    boolean supports(SourceFile file);

    List<KnowledgeGap> detect(SourceFile file, ScanContext context) throws IOException;

    default KnowledgeGap gap(SourceFile file, ScanContext context, int line, String description, String snippet) {
        return new KnowledgeGap(
                KnowledgeGap.idFor(gapType(), file.relativePath(), line, description),
                file.relativePath(), line, gapType(), context.now(), null, description, snippet, 0);
    }
}
