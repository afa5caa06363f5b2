package org.dxworks.pyframe.model;

public enum ScopeKind {
    MODULE,
    CLASS,
    FUNCTION
}
