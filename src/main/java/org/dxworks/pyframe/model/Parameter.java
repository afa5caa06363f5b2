package org.dxworks.pyframe.model;

import java.util.Objects;

public final class Parameter {
    public final String name;
    public final String annotation;
    public final String defaultValue;
    public final ParameterKind kind;

    public Parameter(String name, String annotation, String defaultValue, ParameterKind kind) {
        this.name = name;
        this.annotation = annotation;
        this.defaultValue = defaultValue;
        this.kind = kind;
    }

    public Parameter withKind(ParameterKind newKind) {
        return new Parameter(name, annotation, defaultValue, newKind);
    }

    /** Source-like rendering, e.g. {@code *args: int} or {@code mode: str = 'fast'}. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        if (kind == ParameterKind.VAR_POSITIONAL) sb.append('*');
        if (kind == ParameterKind.VAR_KEYWORD) sb.append("**");
        sb.append(name);
        if (annotation != null) sb.append(": ").append(annotation);
        if (defaultValue != null) sb.append(annotation != null ? " = " : "=").append(defaultValue);
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Parameter)) return false;
        Parameter that = (Parameter) o;
        return name.equals(that.name) && Objects.equals(annotation, that.annotation)
                && Objects.equals(defaultValue, that.defaultValue) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, annotation, defaultValue, kind);
    }

    @Override
    public String toString() {
        return render();
    }
}
