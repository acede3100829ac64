package io.github.drompincen.knowpipe.runtime.error;

import java.util.UUID;

public class GapNotFoundException extends RuntimeException {

    public GapNotFoundException(UUID gapId) {
        super("Knowledge gap not found: " + gapId);
    }
}
