package org.dxworks.pyframe.analyzer.parser.tree;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.List;

/** {@code a.b.c [as alias]} inside an import statement. */
public final class ImportedName extends Node {
    public final List<String> path;
    public final String alias;

    public ImportedName(List<String> path, String alias, SourceSpan span) {
        super(span);
        this.path = List.copyOf(path);
        this.alias = alias;
    }
}
