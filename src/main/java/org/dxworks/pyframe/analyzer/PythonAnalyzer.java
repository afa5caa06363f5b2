package org.dxworks.pyframe.analyzer;

import org.dxworks.pyframe.AnalysisException;
import org.dxworks.pyframe.PyframeConfig;
import org.dxworks.pyframe.analyzer.extract.DecoratorMarkers;
import org.dxworks.pyframe.analyzer.extract.StructuralExtractor;
import org.dxworks.pyframe.analyzer.indent.IndentationResolver;
import org.dxworks.pyframe.analyzer.lexer.Tokenizer;
import org.dxworks.pyframe.analyzer.lexer.Token;
import org.dxworks.pyframe.analyzer.parser.Parser;
import org.dxworks.pyframe.analyzer.parser.tree.ModuleNode;
import org.dxworks.pyframe.model.AnalysisResult;
import org.dxworks.pyframe.model.Diagnostic;
import org.dxworks.pyframe.model.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Python structural analyzer.
 *
 * Runs one source unit through the pipeline: tokenize, resolve indentation, parse, extract. Each call
 * builds fresh pipeline state, so one instance may serve many threads. A fatal error ends the unit
 * and comes back inside the {@link AnalysisResult} together with the diagnostics gathered so far.
 */
public class PythonAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(PythonAnalyzer.class);

    private final PyframeConfig config;
    private final DecoratorMarkers markers;

    public PythonAnalyzer() {
        this(PyframeConfig.defaults());
    }

    public PythonAnalyzer(PyframeConfig config) {
        this.config = config;
        this.markers = DecoratorMarkers.from(config);
    }

    public AnalysisResult analyze(String path, String sourceCode) {
        return analyze(SourceUnit.of(path, sourceCode));
    }

    /** Decodes {@code bytes} per the unit's declared encoding first; a decoding failure is a fatal lex error. */
    public AnalysisResult analyze(String path, byte[] bytes) {
        if (path == null || bytes == null) {
            throw new IllegalArgumentException("path and bytes are required");
        }
        String text;
        try {
            text = SourceDecoder.decode(bytes);
        } catch (AnalysisException e) {
            LOG.debug("Could not decode {}: {}", path, e.getMessage());
            return AnalysisResult.failure(path, ModulePaths.moduleName(path), e, List.of());
        }
        return analyze(path, text);
    }

    public AnalysisResult analyze(SourceUnit unit) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Parser parser = null;
        try {
            List<Token> tokens = new IndentationResolver(config.getTabSize(), config.getAlternateTabSize())
                    .resolve(new Tokenizer(unit.text));
            LOG.debug("Resolved {} tokens for {}", tokens.size(), unit.path);

            parser = new Parser(tokens, config.getTabSize());
            ModuleNode tree = parser.parse();
            diagnostics.addAll(parser.diagnostics());
            parser = null;

            Module module = new StructuralExtractor(markers).extract(tree, unit.moduleName, unit.path, diagnostics);
            return AnalysisResult.success(module, diagnostics);
        } catch (AnalysisException e) {
            if (parser != null) {
                diagnostics.addAll(parser.diagnostics());
            }
            LOG.debug("Analysis of {} failed with {}: {}", unit.path, e.getErrorCode(), e.getMessage());
            return AnalysisResult.failure(unit.path, unit.moduleName, e, diagnostics);
        }
    }
}
