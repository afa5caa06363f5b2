package org.dxworks.pyframe.model;

/**
 * Python naming-convention visibility.
 */
public enum Visibility {
    PUBLIC,
    PROTECTED,
    PRIVATE;

    /**
     * Dunder names ({@code __init__}) and plain names are public, {@code __name} is private
     * (name mangled), {@code _name} is protected.
     */
    public static Visibility of(String name) {
        if (name == null) return PUBLIC;
        if (name.startsWith("__") && name.endsWith("__")) return PUBLIC;
        if (name.startsWith("__")) return PRIVATE;
        if (name.startsWith("_")) return PROTECTED;
        return PUBLIC;
    }
}
