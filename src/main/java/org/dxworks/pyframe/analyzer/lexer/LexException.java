package org.dxworks.pyframe.analyzer.lexer;

import org.dxworks.pyframe.AnalysisException;
import org.dxworks.pyframe.model.SourceSpan;

/**
 * Malformed token: a string literal that never closes, or a character the language does not allow.
 */
public class LexException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        UNTERMINATED_STRING,
        INVALID_CHARACTER
    }

    private final Kind kind;

    public LexException(Kind kind, String message, SourceSpan span) {
        super(message, span);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String getErrorCode() {
        return "LEX_" + kind.name();
    }
}
