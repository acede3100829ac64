package io.github.drompincen.knowpipe.runtime.error;

/** Malformed caller input; the only way {@code submit} fails. */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
