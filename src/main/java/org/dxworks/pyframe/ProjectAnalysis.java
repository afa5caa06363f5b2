package org.dxworks.pyframe;

import org.dxworks.pyframe.index.ProjectIndex;
import org.dxworks.pyframe.model.AnalysisResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Outcome of a project run: one result per analyzed unit (sorted by path), the merged index of the
 * successful ones, and the units that were never analyzed with the reason why.
 */
public final class ProjectAnalysis {
    public final Instant startedAt;
    public final Instant endedAt;
    public final List<AnalysisResult> results;
    /** Path to reason, for units skipped before analysis (too long, unreadable). */
    public final Map<String, String> skipped;
    public final ProjectIndex index;

    ProjectAnalysis(Instant startedAt, Instant endedAt, List<AnalysisResult> results, Map<String, String> skipped,
                    ProjectIndex index) {
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.results = results.stream()
                .sorted(Comparator.comparing(r -> r.path))
                .collect(Collectors.toUnmodifiableList());
        this.skipped = Collections.unmodifiableMap(new TreeMap<>(skipped));
        this.index = index;
    }

    public Duration duration() {
        return Duration.between(startedAt, endedAt);
    }

    public long successCount() {
        return results.stream().filter(AnalysisResult::isSuccess).count();
    }

    public long errorCount() {
        return results.size() - successCount();
    }

    public List<AnalysisResult> failures() {
        return results.stream().filter(r -> !r.isSuccess()).collect(Collectors.toList());
    }

    public Optional<AnalysisResult> result(String path) {
        return results.stream().filter(r -> r.path.equals(path)).findFirst();
    }
}
