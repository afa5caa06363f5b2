package org.dxworks.pyframe.model;

public enum DiagnosticKind {
    SKIPPED_CONSTRUCT,
    ORPHANED_DECORATOR
}
