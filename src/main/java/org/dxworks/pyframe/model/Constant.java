package org.dxworks.pyframe.model;

import java.util.Objects;

/** Module-level assignment of a literal to a single name. */
public final class Constant {
    public final String name;
    public final String value;
    public final SourceSpan span;

    public Constant(String name, String value, SourceSpan span) {
        this.name = name;
        this.value = value;
        this.span = span;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constant)) return false;
        Constant that = (Constant) o;
        return name.equals(that.name) && value.equals(that.value) && span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, span);
    }

    @Override
    public String toString() {
        return name + " = " + value;
    }
}
