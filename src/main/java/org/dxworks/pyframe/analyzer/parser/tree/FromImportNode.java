package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.List;

/** {@code from ..pkg.mod import a as b, c} or {@code from mod import *} */
public final class FromImportNode extends StatementNode {
    public final int level;
    public final List<String> module;
    public final List<ImportedName> names;
    public final boolean wildcard;

    public FromImportNode(int level, List<String> module, List<ImportedName> names, boolean wildcard,
                          SourceSpan span) {
        super(span, List.of());
        this.level = level;
        this.module = List.copyOf(module);
        this.names = List.copyOf(names);
        this.wildcard = wildcard;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFromImport(this);
    }
}
