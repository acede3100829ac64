package io.github.drompincen.knowpipe.runtime.error;

public class PermissionDeniedException extends RuntimeException {

    public PermissionDeniedException(String message) {
        super(message);
    }
}
