package org.dxworks.pyframe.model;

import java.util.List;
import java.util.Objects;

public final class Assignment {
    public final List<String> targets;
    public final String annotation;
    public final String operator;
    public final String value;
    public final SourceSpan span;

    public Assignment(List<String> targets, String annotation, String operator, String value, SourceSpan span) {
        this.targets = List.copyOf(targets);
        this.annotation = annotation;
        this.operator = operator;
        this.value = value;
        this.span = span;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment)) return false;
        Assignment that = (Assignment) o;
        return targets.equals(that.targets) && Objects.equals(annotation, that.annotation)
                && operator.equals(that.operator) && Objects.equals(value, that.value)
                && span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(targets, annotation, operator, value, span);
    }

    @Override
    public String toString() {
        return String.join(" = ", targets) + " " + operator + " " + value;
    }
}
