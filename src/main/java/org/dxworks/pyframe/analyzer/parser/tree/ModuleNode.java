package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.List;

public final class ModuleNode extends Node {
    public final List<StatementNode> body;

    public ModuleNode(List<StatementNode> body, SourceSpan span) {
        super(span);
        this.body = List.copyOf(body);
    }
}
