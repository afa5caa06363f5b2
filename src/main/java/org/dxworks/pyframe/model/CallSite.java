package org.dxworks.pyframe.model;

import java.util.List;
import java.util.Objects;

/**
 * A call expression. The callee is kept as source text ({@code self._transform}, {@code os.getcwd});
 * it is never resolved to a definition.
 */
public final class CallSite {
    public final String callee;
    public final List<String> arguments;
    public final SourceSpan span;
    /** Qualified name of the innermost enclosing scope ({@code ""} for the module). */
    public final String scope;

    public CallSite(String callee, List<String> arguments, SourceSpan span, String scope) {
        this.callee = callee;
        this.arguments = List.copyOf(arguments);
        this.span = span;
        this.scope = scope;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallSite)) return false;
        CallSite that = (CallSite) o;
        return callee.equals(that.callee) && arguments.equals(that.arguments)
                && span.equals(that.span) && scope.equals(that.scope);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callee, arguments, span, scope);
    }

    @Override
    public String toString() {
        return callee + "(" + String.join(", ", arguments) + ")";
    }
}
