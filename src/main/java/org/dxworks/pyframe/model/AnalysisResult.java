package org.dxworks.pyframe.model;

import org.dxworks.pyframe.AnalysisException;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of analyzing one unit: the module, or the fatal error that stopped the pass, plus the
 * non-fatal diagnostics in the order they were produced.
 */
public final class AnalysisResult {
    public final String path;
    public final String moduleName;
    private final Module module;
    private final AnalysisException error;
    public final List<Diagnostic> diagnostics;

    private AnalysisResult(String path, String moduleName, Module module, AnalysisException error,
                           List<Diagnostic> diagnostics) {
        this.path = path;
        this.moduleName = moduleName;
        this.module = module;
        this.error = error;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public static AnalysisResult success(Module module, List<Diagnostic> diagnostics) {
        return new AnalysisResult(module.path, module.name, module, null, diagnostics);
    }

    public static AnalysisResult failure(String path, String moduleName, AnalysisException error,
                                         List<Diagnostic> diagnostics) {
        return new AnalysisResult(path, moduleName, null, error, diagnostics);
    }

    public boolean isSuccess() {
        return module != null;
    }

    public Optional<Module> module() {
        return Optional.ofNullable(module);
    }

    public Optional<AnalysisException> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "AnalysisResult[" + path + ", " + diagnostics.size() + " diagnostics]"
                : "AnalysisResult[" + path + ", failed: " + error.getMessage() + "]";
    }
}
