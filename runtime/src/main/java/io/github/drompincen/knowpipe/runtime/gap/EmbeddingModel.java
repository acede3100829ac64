package io.github.drompincen.knowpipe.runtime.gap;

import java.util.List;

/** Text embedding provider. One vector per input text, in input order. */
public interface EmbeddingModel {

    List<float[]> embed(List<String> texts);
}
