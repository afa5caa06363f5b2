package org.dxworks.pyframe.analyzer.indent;

import org.dxworks.pyframe.AnalysisException;
import org.dxworks.pyframe.model.SourceSpan;

/**
 * Inconsistent whitespace structure.
 */
public class IndentationException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** A dedent that matches no enclosing indentation level. */
        INCONSISTENT_DEDENT,
        /** Tabs and spaces mixed so that the comparison depends on the tab size. */
        AMBIGUOUS_TABS,
        UNEXPECTED_INDENT,
        EXPECTED_INDENT
    }

    private final Kind kind;

    public IndentationException(Kind kind, String message, SourceSpan span) {
        super(message, span);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String getErrorCode() {
        return "INDENT_" + kind.name();
    }
}
