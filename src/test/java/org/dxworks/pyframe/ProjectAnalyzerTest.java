package org.dxworks.pyframe;

import org.dxworks.pyframe.analyzer.SourceUnit;
import org.dxworks.pyframe.model.AnalysisResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectAnalyzerTest {

    @TempDir
    Path tempDir;

    @Test
    void analyze_FailingUnitDoesNotAffectOthers() {
        ProjectAnalyzer analyzer = new ProjectAnalyzer(PyframeConfig.with(1000, 4));

        ProjectAnalysis analysis = analyzer.analyze(List.of(
                SourceUnit.of("pkg/good.py", "def ok():\n    pass\n"),
                SourceUnit.of("pkg/bad.py", "def broken():\nreturn 1\n"),
                SourceUnit.of("pkg/also_good.py", "class A:\n    pass\n")));

        assertEquals(3, analysis.results.size());
        assertEquals(2, analysis.successCount());
        assertEquals(1, analysis.errorCount());
        assertEquals("pkg/bad.py", analysis.failures().get(0).path);
        assertEquals(List.of("pkg/also_good.py", "pkg/bad.py", "pkg/good.py"),
                analysis.results.stream().map(r -> r.path).collect(Collectors.toList()));

        assertEquals(List.of("pkg.also_good", "pkg.good"), analysis.index.moduleNames());
        assertTrue(analysis.index.find("pkg.good.ok").isPresent());
        assertFalse(analysis.endedAt.isBefore(analysis.startedAt));
    }

    @Test
    void analyze_UnitOverLineLimit_IsSkipped() {
        ProjectAnalyzer analyzer = new ProjectAnalyzer(PyframeConfig.with(2, 1));

        ProjectAnalysis analysis = analyzer.analyze(List.of(
                SourceUnit.of("short.py", "x = 1\n"),
                SourceUnit.of("long.py", "a = 1\nb = 2\nc = 3\n")));

        assertEquals(1, analysis.results.size());
        assertEquals(List.of("long.py"), List.copyOf(analysis.skipped.keySet()));
        assertFalse(analysis.result("long.py").isPresent());
        assertTrue(analysis.result("short.py").orElseThrow().isSuccess());
    }

    @Test
    void analyzeDirectory_LabelsModulesRelativeToRoot() throws IOException {
        Path pkg = Files.createDirectories(tempDir.resolve("app").resolve("core"));
        Files.writeString(pkg.resolve("__init__.py"), "from .models import User\n");
        Files.writeString(pkg.resolve("models.py"), "class User:\n    def save(self):\n        pass\n");
        Files.write(pkg.resolve("legacy.py"), new byte[]{'x', ' ', '=', ' ', '\'', (byte) 0xE9, '\'', '\n'});
        Files.writeString(tempDir.resolve("README.md"), "# not python\n");

        ProjectAnalysis analysis = new ProjectAnalyzer().analyzeDirectory(tempDir);

        assertEquals(3, analysis.results.size());
        assertEquals(List.of("app.core", "app.core.models"), analysis.index.moduleNames());
        assertTrue(analysis.index.find("app.core.models.User.save").isPresent());
        assertEquals("app.core.models",
                analysis.index.module("app.core").orElseThrow().imports().get(0).resolvedModule);

        AnalysisResult legacy = analysis.result("app/core/legacy.py").orElseThrow();
        assertFalse(legacy.isSuccess());
        assertEquals("app.core.legacy", legacy.moduleName);
    }

    @Test
    void analyzeDirectory_LongFileIsSkipped() throws IOException {
        Files.write(tempDir.resolve("big.py"), "a = 1\nb = 2\nc = 3".getBytes(StandardCharsets.UTF_8));
        Files.writeString(tempDir.resolve("small.py"), "a = 1\n");

        ProjectAnalysis analysis = new ProjectAnalyzer(PyframeConfig.with(2, 2)).analyzeDirectory(tempDir);

        assertEquals(1, analysis.successCount());
        assertTrue(analysis.skipped.get("big.py").contains("more than 2 lines"));
    }
}
