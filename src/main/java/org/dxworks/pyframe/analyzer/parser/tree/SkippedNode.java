package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.List;

/** Placeholder for a construct outside the supported grammar; its tokens (and block) were skipped. */
public final class SkippedNode extends StatementNode {
    public final String reason;

    public SkippedNode(String reason, SourceSpan span) {
        super(span, List.of());
        this.reason = reason;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitSkipped(this);
    }
}
