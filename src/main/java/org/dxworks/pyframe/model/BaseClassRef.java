package org.dxworks.pyframe.model;

import java.util.Objects;

/**
 * Base-class reference. A name edge, not an object link: {@link #resolvedQualifiedName} is set only when
 * a class of the same unit matches.
 */
public final class BaseClassRef {
    public final String text;
    public final String resolvedQualifiedName;

    public BaseClassRef(String text, String resolvedQualifiedName) {
        this.text = text;
        this.resolvedQualifiedName = resolvedQualifiedName;
    }

    public boolean isResolved() {
        return resolvedQualifiedName != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BaseClassRef)) return false;
        BaseClassRef that = (BaseClassRef) o;
        return text.equals(that.text) && Objects.equals(resolvedQualifiedName, that.resolvedQualifiedName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, resolvedQualifiedName);
    }

    @Override
    public String toString() {
        return text;
    }
}
