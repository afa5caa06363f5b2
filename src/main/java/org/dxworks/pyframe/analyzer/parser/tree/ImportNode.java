package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.List;

/** {@code import a.b as c, d} */
public final class ImportNode extends StatementNode {
    public final List<ImportedName> names;

    public ImportNode(List<ImportedName> names, SourceSpan span) {
        super(span, List.of());
        this.names = List.copyOf(names);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitImport(this);
    }
}
