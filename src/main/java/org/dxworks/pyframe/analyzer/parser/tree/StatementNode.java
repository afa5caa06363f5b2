package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.List;

/**
 * One logical statement.
 * {@link #calls} holds the call expressions of the statement itself (header, value, defaults),
 * never those of a nested block.
 */
public abstract class StatementNode extends Node {
    public final List<CallNode> calls;

    protected StatementNode(SourceSpan span, List<CallNode> calls) {
        super(span);
        this.calls = List.copyOf(calls);
    }

    public abstract <R> R accept(StatementVisitor<R> visitor);
}
