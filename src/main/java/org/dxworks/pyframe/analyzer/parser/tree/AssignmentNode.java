package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.List;

/** Plain, chained, annotated or augmented assignment. */
public final class AssignmentNode extends StatementNode {
    public final List<String> targets;
    public final String annotation;
    /** {@code =} or an augmented operator such as {@code +=}. */
    public final String operator;
    /** Null for a bare annotation ({@code x: int}). */
    public final String value;
    public final boolean literalValue;

    public AssignmentNode(List<String> targets, String annotation, String operator, String value,
                          boolean literalValue, List<CallNode> calls, SourceSpan span) {
        super(span, calls);
        this.targets = List.copyOf(targets);
        this.annotation = annotation;
        this.operator = operator;
        this.value = value;
        this.literalValue = literalValue;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }
}
