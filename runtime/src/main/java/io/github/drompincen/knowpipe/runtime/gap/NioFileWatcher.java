package io.github.drompincen.knowpipe.runtime.gap;

import io.github.drompincen.knowpipe.runtime.config.DaemonThreads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * {@link WatchService}-backed watcher. Registers every in-scope directory, including ones created
 * after start, and reports in-scope files on create and modify.
 */
public class NioFileWatcher implements FileWatcher {

    private static final Logger log = LoggerFactory.getLogger(NioFileWatcher.class);

    private final ProjectFiles files;
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
    private final ExecutorService loop = Executors.newSingleThreadExecutor(DaemonThreads.named("file-watcher"));
    private volatile WatchService watchService;
    private volatile boolean running;

    public NioFileWatcher(ProjectFiles files) {
        this.files = files;
    }

    @Override
    public void start(Path root, Consumer<Path> onChange) throws IOException {
        if (running) throw new IllegalStateException("watcher already started");
        Path base = root.toAbsolutePath().normalize();
        watchService = FileSystems.getDefault().newWatchService();
        registerTree(base);
        running = true;
        loop.submit(() -> pollLoop(base, onChange));
        log.info("[FileWatcher] Watching {} ({} directories)", base, keys.size());
    }

    @Override
    public void close() {
        running = false;
        loop.shutdownNow();
        WatchService ws = watchService;
        if (ws != null) {
            try {
                ws.close();
            } catch (IOException e) {
                log.warn("[FileWatcher] Failed to close watch service: {}", e.getMessage());
            }
        }
    }

    private void pollLoop(Path root, Consumer<Path> onChange) {
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            Path dir = keys.get(key);
            if (dir != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                        log.warn("[FileWatcher] Event overflow in {}", dir);
                        continue;
                    }
                    Path changed = dir.resolve((Path) event.context());
                    dispatch(root, changed, onChange);
                }
            }
            if (!key.reset()) {
                keys.remove(key);
            }
        }
    }

    private void dispatch(Path root, Path changed, Consumer<Path> onChange) {
        try {
            if (Files.isDirectory(changed)) {
                if (!files.isExcludedDirectory(changed)) registerTree(changed);
                return;
            }
            if (files.isInScope(root, changed)) {
                onChange.accept(changed);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("[FileWatcher] Failed to handle change of {}: {}", changed, e.toString());
        }
    }

    private void registerTree(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(start) && files.isExcludedDirectory(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                WatchKey key = dir.register(watchService,
                        StandardWatchEventKinds.ENTRY_CREATE, StandardWatchEventKinds.ENTRY_MODIFY);
                keys.put(key, dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
