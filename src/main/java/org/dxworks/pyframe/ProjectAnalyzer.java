package org.dxworks.pyframe;

import org.dxworks.pyframe.analyzer.ModulePaths;
import org.dxworks.pyframe.analyzer.PythonAnalyzer;
import org.dxworks.pyframe.analyzer.SourceUnit;
import org.dxworks.pyframe.index.ProjectIndex;
import org.dxworks.pyframe.model.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Analyzes many source units in parallel and merges the successful modules into a {@link ProjectIndex}.
 *
 * Units share nothing but the index, which is write-once per module label. A unit that fails, is too
 * long or cannot be read is recorded on its own and never affects the others.
 */
public class ProjectAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectAnalyzer.class);

    private final PyframeConfig config;
    private final PythonAnalyzer analyzer;

    public ProjectAnalyzer() {
        this(PyframeConfig.defaults());
    }

    public ProjectAnalyzer(PyframeConfig config) {
        this.config = config;
        this.analyzer = new PythonAnalyzer(config);
    }

    /** Analyzes in-memory units. */
    public ProjectAnalysis analyze(Collection<SourceUnit> units) {
        Run run = new Run(units.size());
        List<SourceUnit> accepted = new ArrayList<>();
        for (SourceUnit unit : units) {
            if (unit.lineCount() > config.getMaxFileLines()) {
                run.skip(unit.path, "more than " + config.getMaxFileLines() + " lines");
            } else {
                accepted.add(unit);
            }
        }
        run.forEachInParallel(accepted, unit -> run.record(analyzer.analyze(unit)));
        return run.finish();
    }

    /** Analyzes every {@code .py} file under {@code root}; module labels are relative to {@code root}. */
    public ProjectAnalysis analyzeDirectory(Path root) throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.walk(root)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".py"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        LOG.info("Found {} Python files under {}", files.size(), root.toAbsolutePath());

        Run run = new Run(files.size());
        run.forEachInParallel(files, file -> {
            String path = ModulePaths.relativePath(root, file);
            byte[] bytes;
            try {
                bytes = Files.readAllBytes(file);
            } catch (IOException e) {
                run.skip(path, "unreadable: " + e.getMessage());
                return;
            }
            if (lineCount(bytes) > config.getMaxFileLines()) {
                run.skip(path, "more than " + config.getMaxFileLines() + " lines");
                return;
            }
            run.record(analyzer.analyze(path, bytes));
        });
        return run.finish();
    }

    private static long lineCount(byte[] bytes) {
        long lines = 0;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n' || (bytes[i] == '\r' && (i + 1 >= bytes.length || bytes[i + 1] != '\n'))) {
                lines++;
            }
        }
        return bytes.length > 0 && bytes[bytes.length - 1] != '\n' && bytes[bytes.length - 1] != '\r'
                ? lines + 1
                : lines;
    }

    /** Mutable state of one project run, shared by the workers. */
    private final class Run {
        private final Instant startTime = Instant.now();
        private final int total;
        private final AtomicInteger progress = new AtomicInteger(0);
        private final ConcurrentLinkedQueue<AnalysisResult> results = new ConcurrentLinkedQueue<>();
        private final Map<String, String> skipped = new ConcurrentHashMap<>();
        private final ProjectIndex index = new ProjectIndex();

        Run(int total) {
            this.total = total;
        }

        <T> void forEachInParallel(List<T> items, Consumer<T> action) {
            ForkJoinPool pool = new ForkJoinPool(config.getParallelism());
            try {
                pool.submit(() -> items.parallelStream().forEach(action)).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Project analysis interrupted", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                if (cause instanceof Error) throw (Error) cause;
                throw new IllegalStateException(cause);
            } finally {
                pool.shutdown();
            }
        }

        void skip(String path, String reason) {
            LOG.warn("Skipping {}: {}", path, reason);
            skipped.put(path, reason);
        }

        void record(AnalysisResult result) {
            int current = progress.incrementAndGet();
            LOG.debug("[{}/{}] Analyzed {}", current, total, result.path);
            if (result.isSuccess()) {
                result.module().ifPresent(index::register);
            } else {
                result.error().ifPresent(e ->
                        LOG.warn("Error analyzing {}: {} {}", result.path, e.getErrorCode(), e.getMessage()));
            }
            results.add(result);
        }

        ProjectAnalysis finish() {
            ProjectAnalysis analysis = new ProjectAnalysis(startTime, Instant.now(), new ArrayList<>(results),
                    skipped, index);
            Duration duration = analysis.duration();
            LOG.info("Analysis complete: {} units analyzed, {} with errors, {} skipped in {} ms",
                    analysis.successCount(), analysis.errorCount(), skipped.size(), duration.toMillis());
            return analysis;
        }
    }
}
