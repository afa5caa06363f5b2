package org.dxworks.pyframe.model;

import java.util.List;
import java.util.Objects;

public final class Decorator {
    /** Full expression after {@code @}, e.g. {@code app.route("/", methods=["GET"])}. */
    public final String expression;
    /** Expression without its trailing call, e.g. {@code app.route}. */
    public final String name;
    /** Raw call arguments, empty when the decorator is not a call. */
    public final List<String> arguments;
    public final SourceSpan span;

    public Decorator(String expression, String name, List<String> arguments, SourceSpan span) {
        this.expression = expression;
        this.name = name;
        this.arguments = List.copyOf(arguments);
        this.span = span;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Decorator)) return false;
        Decorator that = (Decorator) o;
        return expression.equals(that.expression) && name.equals(that.name)
                && arguments.equals(that.arguments) && span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, name, arguments, span);
    }

    @Override
    public String toString() {
        return "@" + expression;
    }
}
