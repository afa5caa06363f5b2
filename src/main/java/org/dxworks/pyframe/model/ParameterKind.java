package org.dxworks.pyframe.model;

public enum ParameterKind {
    /** Before a {@code /} marker. */
    POSITIONAL_ONLY,
    POSITIONAL,
    /** After {@code *} or {@code *args}. */
    KEYWORD_ONLY,
    /** {@code *args} */
    VAR_POSITIONAL,
    /** {@code **kwargs} */
    VAR_KEYWORD
}
