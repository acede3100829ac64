package io.github.drompincen.knowpipe.runtime.scheduler;

import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;
import io.github.drompincen.knowpipe.protocol.api.ResearchResult;

/**
 * Produces research for a classified request. Opaque to the pipeline: an LLM client, a search
 * backend or anything else can sit behind it.
 */
public interface ResearchExecutor {

    ResearchResult execute(ClassifiedRequest request, ResearchContext context) throws ResearchExecutionException;
}
