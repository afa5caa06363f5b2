package org.dxworks.pyframe;

import org.dxworks.pyframe.model.SourceSpan;

/**
 * Base of the fatal error taxonomy. A fatal error terminates the analysis of one source unit only.
 */
public abstract class AnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient SourceSpan span;

    protected AnalysisException(String message, SourceSpan span) {
        super(message + " at " + span);
        this.span = span;
    }

    /** The offending span. */
    public SourceSpan getSpan() {
        return span;
    }

    /** Stable error code, e.g. {@code LEX_UNTERMINATED_STRING}. */
    public abstract String getErrorCode();
}
