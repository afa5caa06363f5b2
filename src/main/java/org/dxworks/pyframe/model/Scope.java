package org.dxworks.pyframe.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A node of the scope tree: the module, or the body of a function or class.
 *
 * A scope owns its child definitions and the statement-level facts (imports, assignments, call sites)
 * that occur directly in it, not in a nested scope. The parent is referenced by qualified name only,
 * so the tree has no ownership cycles; look it up through the module index.
 */
public final class Scope {
    public final ScopeKind kind;
    public final String name;
    /** Empty for the module scope. */
    public final String qualifiedName;
    /** Null for the module scope. */
    public final String parentQualifiedName;
    public final List<Definition> children;
    public final List<ImportEntry> imports;
    public final List<Assignment> assignments;
    public final List<CallSite> calls;

    private Scope(Builder builder) {
        this.kind = builder.kind;
        this.name = builder.name;
        this.qualifiedName = builder.qualifiedName;
        this.parentQualifiedName = builder.parentQualifiedName;
        this.children = List.copyOf(builder.children);
        this.imports = List.copyOf(builder.imports);
        this.assignments = List.copyOf(builder.assignments);
        this.calls = List.copyOf(builder.calls);
    }

    public static Builder builder(ScopeKind kind, String name, String qualifiedName, String parentQualifiedName) {
        return new Builder(kind, name, qualifiedName, parentQualifiedName);
    }

    public boolean isRoot() {
        return parentQualifiedName == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Scope)) return false;
        Scope that = (Scope) o;
        return kind == that.kind && name.equals(that.name) && qualifiedName.equals(that.qualifiedName)
                && Objects.equals(parentQualifiedName, that.parentQualifiedName)
                && children.equals(that.children) && imports.equals(that.imports)
                && assignments.equals(that.assignments) && calls.equals(that.calls);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, qualifiedName, parentQualifiedName, children, imports, assignments, calls);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " scope " + (isRoot() ? name : qualifiedName);
    }

    /** Collects the contents of a scope while its body is being walked; {@link #build()} freezes them. */
    public static final class Builder {
        private final ScopeKind kind;
        private final String name;
        private final String qualifiedName;
        private final String parentQualifiedName;
        private final List<Definition> children = new ArrayList<>();
        private final List<ImportEntry> imports = new ArrayList<>();
        private final List<Assignment> assignments = new ArrayList<>();
        private final List<CallSite> calls = new ArrayList<>();

        private Builder(ScopeKind kind, String name, String qualifiedName, String parentQualifiedName) {
            this.kind = kind;
            this.name = name;
            this.qualifiedName = qualifiedName;
            this.parentQualifiedName = parentQualifiedName;
        }

        public ScopeKind kind() {
            return kind;
        }

        public String qualifiedName() {
            return qualifiedName;
        }

        public Builder addChild(Definition definition) {
            children.add(definition);
            return this;
        }

        public Builder addImport(ImportEntry entry) {
            imports.add(entry);
            return this;
        }

        public Builder addAssignment(Assignment assignment) {
            assignments.add(assignment);
            return this;
        }

        public Builder addCall(CallSite call) {
            calls.add(call);
            return this;
        }

        public Scope build() {
            return new Scope(this);
        }
    }
}
