package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.List;

public final class CallNode extends Node {
    public final String callee;
    public final List<String> arguments;

    public CallNode(String callee, List<String> arguments, SourceSpan span) {
        super(span);
        this.callee = callee;
        this.arguments = List.copyOf(arguments);
    }
}
