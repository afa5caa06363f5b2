package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.List;

public final class ExpressionNode extends StatementNode {
    public final String text;
    /** True when the statement is nothing but string literals, i.e. a docstring candidate. */
    public final boolean stringLiteral;

    public ExpressionNode(String text, boolean stringLiteral, List<CallNode> calls, SourceSpan span) {
        super(span, calls);
        this.text = text;
        this.stringLiteral = stringLiteral;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExpression(this);
    }
}
