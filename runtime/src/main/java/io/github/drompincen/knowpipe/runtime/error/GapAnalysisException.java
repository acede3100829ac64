package io.github.drompincen.knowpipe.runtime.error;

import java.nio.file.Path;

/** A single file could not be analyzed; the scan logs it and moves on. */
public class GapAnalysisException extends Exception {

    private final Path file;

    public GapAnalysisException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public GapAnalysisException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
