package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.Parameter;
import org.dxworks.pyframe.model.SourceSpan;

import java.util.List;

public final class FunctionNode extends StatementNode {
    public final String name;
    public final boolean isAsync;
    public final List<Parameter> parameters;
    public final String returnAnnotation;
    public final List<StatementNode> body;

    public FunctionNode(String name, boolean isAsync, List<Parameter> parameters, String returnAnnotation,
                        List<StatementNode> body, List<CallNode> calls, SourceSpan span) {
        super(span, calls);
        this.name = name;
        this.isAsync = isAsync;
        this.parameters = List.copyOf(parameters);
        this.returnAnnotation = returnAnnotation;
        this.body = List.copyOf(body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
