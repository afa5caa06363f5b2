package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.SourceSpan;

public abstract class Node {
    public final SourceSpan span;

    protected Node(SourceSpan span) {
        this.span = span;
    }
}
