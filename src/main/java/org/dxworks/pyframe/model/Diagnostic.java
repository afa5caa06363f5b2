package org.dxworks.pyframe.model;

import java.util.Objects;

/** Non-fatal notice produced while analyzing one unit. */
public final class Diagnostic {
    public final DiagnosticKind kind;
    public final String message;
    public final SourceSpan span;

    public Diagnostic(DiagnosticKind kind, String message, SourceSpan span) {
        this.kind = kind;
        this.message = message;
        this.span = span;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return kind == that.kind && message.equals(that.message) && span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, span);
    }

    @Override
    public String toString() {
        return kind + " " + span + ": " + message;
    }
}
