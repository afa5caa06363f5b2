package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.List;

/**
 * A {@code @expression} line. {@link #name} is the expression without a trailing call,
 * {@link #arguments} the raw arguments of that call (empty when there is none).
 */
public final class DecoratorNode extends StatementNode {
    public final String expression;
    public final String name;
    public final List<String> arguments;

    public DecoratorNode(String expression, String name, List<String> arguments, SourceSpan span) {
        super(span, List.of());
        this.expression = expression;
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitDecorator(this);
    }
}
