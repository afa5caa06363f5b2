package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.List;

/** Keyword statements: return, pass, raise, del, assert, global, ... */
public final class SimpleNode extends StatementNode {
    public final String keyword;

    public SimpleNode(String keyword, List<CallNode> calls, SourceSpan span) {
        super(span, calls);
        this.keyword = keyword;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitSimple(this);
    }
}
