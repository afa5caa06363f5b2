package org.dxworks.pyframe;

import org.dxworks.pyframe.model.SourceSpan;

/**
 * Structural mismatch that makes local recovery ambiguous.
 */
public class ParseException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        UNBALANCED_BRACKETS,
        /** The parser's block stack and the token-level indentation stack disagree. */
        STRUCTURAL_MISMATCH,
        UNEXPECTED_EOF
    }

    private final Kind kind;

    public ParseException(Kind kind, String message, SourceSpan span) {
        super(message, span);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String getErrorCode() {
        return "PARSE_" + kind.name();
    }
}
