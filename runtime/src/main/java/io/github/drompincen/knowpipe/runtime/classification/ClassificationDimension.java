package io.github.drompincen.knowpipe.runtime.classification;

public enum ClassificationDimension {
    RESEARCH_TYPE,
    AUDIENCE,
    DOMAIN,
    URGENCY
}
