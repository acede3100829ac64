package io.github.drompincen.knowpipe.runtime.gap;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/** Reports created or modified files under a project root. */
public interface FileWatcher extends AutoCloseable {

    void start(Path root, Consumer<Path> onChange) throws IOException;

    @Override
    void close();
}
