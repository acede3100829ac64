package io.github.drompincen.knowpipe.runtime.gap;

import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import io.github.drompincen.knowpipe.runtime.cache.CacheKeys;
import io.github.drompincen.knowpipe.runtime.cache.CacheStore;
import io.github.drompincen.knowpipe.runtime.config.DaemonThreads;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import io.github.drompincen.knowpipe.runtime.error.GapAnalysisException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans a project tree for knowledge gaps. Per-file checks run in parallel on a bounded pool; a
 * file that cannot be read, is binary or exceeds its time budget is logged and skipped. Gaps whose
 * research question already has live cached knowledge are dropped.
 */
@Service
public class GapAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(GapAnalyzer.class);
    private static final int BINARY_SNIFF_BYTES = 8192;
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final List<GapDetector> detectors;
    private final CacheStore cacheStore;
    private final SemanticRefiner refiner;
    private final Clock clock;
    private final ProjectFiles files;
    private final Duration perFileBudget;
    private final int poolSize;
    private final ExecutorService pool;

    public GapAnalyzer(List<GapDetector> detectors,
                       CacheStore cacheStore,
                       SemanticRefiner refiner,
                       Clock clock,
                       PipelineProperties properties) {
        this.detectors = List.copyOf(detectors);
        this.cacheStore = cacheStore;
        this.refiner = refiner;
        this.clock = clock;
        this.files = new ProjectFiles(properties.getGap());
        this.perFileBudget = properties.getGap().getPerFileBudget();
        this.poolSize = Math.max(1, properties.getGap().getPoolSize());
        this.pool = Executors.newFixedThreadPool(poolSize, DaemonThreads.named("gap-scan"));
    }

    public ProjectFiles projectFiles() {
        return files;
    }

    public List<KnowledgeGap> scan(Path root) {
        return scan(root, cacheStore);
    }

    /** Full scan of {@code root}, checking coverage against {@code cache}. */
    public List<KnowledgeGap> scan(Path root, CacheStore cache) {
        Path base = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(base)) {
            throw new IllegalArgumentException("Not a directory: " + root);
        }
        long started = System.nanoTime();
        ScanContext context = new ScanContext(base, clock.instant(), files.extensions());
        List<Path> candidates = listFiles(base);

        List<FileScan> scans = analyzeAll(candidates, context);

        Map<String, Integer> referencesByStem = countReferences(scans);
        List<KnowledgeGap> gaps = new ArrayList<>();
        for (FileScan scan : scans) {
            int refs = referencesByStem.getOrDefault(scan.stem(), 0);
            for (KnowledgeGap gap : scan.gaps()) {
                gaps.add(refs > 0 ? gap.withReferences(refs) : gap);
            }
        }
        List<KnowledgeGap> result = finish(gaps, cache);
        log.info("[GapAnalyzer] Scanned {} files under {} in {} ms: {} gaps",
                scans.size(), base, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started), result.size());
        return result;
    }

    /** Re-analyzes one file; out-of-scope or unreadable files yield no gaps. */
    public List<KnowledgeGap> onFileChanged(Path root, Path file) {
        Path base = root.toAbsolutePath().normalize();
        Path target = base.resolve(file).normalize();
        if (!target.startsWith(base) || !Files.isRegularFile(target) || !files.isInScope(base, target)) {
            return List.of();
        }
        ScanContext context = new ScanContext(base, clock.instant(), files.extensions());
        List<FileScan> scans = analyzeAll(List.of(target), context);
        List<KnowledgeGap> gaps = new ArrayList<>();
        scans.forEach(s -> gaps.addAll(s.gaps()));
        return finish(gaps, cacheStore);
    }

    @PreDestroy
    public void shutdown() {
        pool.shutdownNow();
    }

    private List<KnowledgeGap> finish(List<KnowledgeGap> gaps, CacheStore cache) {
        List<KnowledgeGap> uncovered = new ArrayList<>(gaps.size());
        for (KnowledgeGap gap : gaps) {
            if (cache != null && cache.hasLiveTopic(CacheKeys.topicHash(gap.researchQuery()))) {
                log.debug("[GapAnalyzer] {}:{} covered by cached research", gap.location(), gap.line());
                continue;
            }
            uncovered.add(gap);
        }
        List<KnowledgeGap> refined = new ArrayList<>(refiner.refine(uncovered));
        refined.sort(Comparator.comparing(KnowledgeGap::location)
                .thenComparingInt(KnowledgeGap::line)
                .thenComparing(KnowledgeGap::gapType));
        return refined;
    }

    private List<Path> listFiles(Path root) {
        List<Path> out = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && files.isExcludedDirectory(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()
                            && attrs.size() <= files.maxFileSizeBytes()
                            && files.extensions().contains(ProjectFiles.extension(file))) {
                        out.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("[GapAnalyzer] Skipping unreadable path {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + root, e);
        }
        out.sort(Comparator.naturalOrder());
        return out;
    }

    private List<FileScan> analyzeAll(List<Path> paths, ScanContext context) {
        Map<Path, Future<FileScan>> futures = new LinkedHashMap<>();
        for (Path p : paths) {
            futures.put(p, pool.submit(() -> analyze(p, context)));
        }
        // safety net for files still queued behind slow ones
        long waves = (paths.size() + poolSize - 1) / poolSize;
        long deadline = System.nanoTime() + perFileBudget.toNanos() * (waves + 1);

        List<FileScan> scans = new ArrayList<>(paths.size());
        for (Map.Entry<Path, Future<FileScan>> e : futures.entrySet()) {
            Future<FileScan> future = e.getValue();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                scans.add(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException ex) {
                future.cancel(true);
                log.warn("[GapAnalyzer] Skipping {}: exceeded {} ms budget", e.getKey(), perFileBudget.toMillis());
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause();
                if (cause instanceof GapAnalysisException) {
                    log.warn("[GapAnalyzer] Skipping {}", cause.getMessage());
                } else {
                    log.warn("[GapAnalyzer] Skipping {}: {}", e.getKey(), cause.toString());
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                break;
            }
        }
        return scans;
    }

    private FileScan analyze(Path path, ScanContext context) throws GapAnalysisException {
        long deadline = System.nanoTime() + perFileBudget.toNanos();
        SourceFile file = load(path, context.root());
        List<KnowledgeGap> gaps = new ArrayList<>();
        for (GapDetector detector : detectors) {
            if (!detector.supports(file)) continue;
            try {
                gaps.addAll(detector.detect(file, context));
            } catch (IOException e) {
                throw new GapAnalysisException(path, "detector " + detector.gapType() + " failed", e);
            }
            if (System.nanoTime() > deadline) {
                throw new GapAnalysisException(path, "exceeded " + perFileBudget.toMillis() + " ms budget");
            }
        }
        return new FileScan(file.stem(), file.relativePath(), gaps, identifiers(file));
    }

    private SourceFile load(Path path, Path root) throws GapAnalysisException {
        byte[] bytes;
        Instant modified;
        try {
            bytes = Files.readAllBytes(path);
            modified = Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            throw new GapAnalysisException(path, "unreadable", e);
        }
        int sniffed = Math.min(bytes.length, BINARY_SNIFF_BYTES);
        for (int i = 0; i < sniffed; i++) {
            if (bytes[i] == 0) throw new GapAnalysisException(path, "binary content");
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new GapAnalysisException(path, "not valid UTF-8 text", e);
        }
        return new SourceFile(path, ProjectFiles.relative(root, path), ProjectFiles.extension(path),
                text.lines().toList(), modified);
    }

    private static Set<String> identifiers(SourceFile file) {
        Set<String> ids = new HashSet<>();
        for (String line : file.lines()) {
            Matcher m = IDENTIFIER.matcher(line);
            while (m.find()) ids.add(m.group());
        }
        return ids;
    }

    /** Number of other files mentioning each file stem. */
    private static Map<String, Integer> countReferences(List<FileScan> scans) {
        Set<String> stems = new HashSet<>();
        for (FileScan s : scans) {
            if (!s.gaps().isEmpty()) stems.add(s.stem());
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String stem : stems) {
            int n = 0;
            for (FileScan s : scans) {
                if (!s.stem().equals(stem) && s.identifiers().contains(stem)) n++;
            }
            counts.put(stem, n);
        }
        return counts;
    }

    private record FileScan(String stem, String relativePath, List<KnowledgeGap> gaps, Set<String> identifiers) {}
}
