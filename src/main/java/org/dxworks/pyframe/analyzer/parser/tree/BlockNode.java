package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.List;

/**
 * Control-flow clause ({@code if}, {@code elif}, {@code else}, {@code for}, {@code while}, {@code try},
 * {@code except}, {@code finally}, {@code with}, {@code async for}, {@code async with}).
 * Does not open a scope.
 */
public final class BlockNode extends StatementNode {
    public final String keyword;
    public final String header;
    public final List<StatementNode> body;

    public BlockNode(String keyword, String header, List<StatementNode> body, List<CallNode> calls,
                     SourceSpan span) {
        super(span, calls);
        this.keyword = keyword;
        this.header = header;
        this.body = List.copyOf(body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
