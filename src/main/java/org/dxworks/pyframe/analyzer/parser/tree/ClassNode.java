package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.List;

public final class ClassNode extends StatementNode {
    public final String name;
    /** Positional class arguments, raw text. */
    public final List<String> bases;
    /** Keyword class arguments such as {@code metaclass=ABCMeta}, raw text. */
    public final List<String> keywords;
    public final List<StatementNode> body;

    public ClassNode(String name, List<String> bases, List<String> keywords, List<StatementNode> body,
                     List<CallNode> calls, SourceSpan span) {
        super(span, calls);
        this.name = name;
        this.bases = List.copyOf(bases);
        this.keywords = List.copyOf(keywords);
        this.body = List.copyOf(body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitClass(this);
    }
}
