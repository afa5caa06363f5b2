package org.dxworks.pyframe.model;

import java.util.List;
import java.util.Objects;

/**
 * Structural model of one source unit.
 */
public final class Module {
    /** Dotted module label derived from the originating path, e.g. {@code pkg.sub.mod}. */
    public final String name;
    public final String path;
    public final String docstring;
    public final Scope root;
    /** Every import of the unit, nested ones included, in source order. */
    public final List<ImportEntry> imports;
    public final List<Constant> constants;

    public Module(String name, String path, String docstring, Scope root, List<ImportEntry> imports,
                  List<Constant> constants) {
        this.name = name;
        this.path = path;
        this.docstring = docstring;
        this.root = root;
        this.imports = List.copyOf(imports);
        this.constants = List.copyOf(constants);
    }

    /** Prefixes a module-relative qualified name with the module label. */
    public String fullyQualifiedName(String qualifiedName) {
        if (qualifiedName == null || qualifiedName.isEmpty()) return name;
        return name.isEmpty() ? qualifiedName : name + "." + qualifiedName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Module)) return false;
        Module that = (Module) o;
        return name.equals(that.name) && path.equals(that.path) && Objects.equals(docstring, that.docstring)
                && root.equals(that.root) && imports.equals(that.imports) && constants.equals(that.constants);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, path, docstring, root, imports, constants);
    }

    @Override
    public String toString() {
        return "module " + name + " (" + path + ")";
    }
}
