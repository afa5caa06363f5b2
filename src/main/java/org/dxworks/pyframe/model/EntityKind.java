package org.dxworks.pyframe.model;

public enum EntityKind {
    FUNCTION,
    CLASS
}
