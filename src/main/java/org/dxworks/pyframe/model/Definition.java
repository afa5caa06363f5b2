package org.dxworks.pyframe.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A function or class definition together with the scope of its body.
 */
public abstract class Definition {
    public final String name;
    public final String qualifiedName;
    public final List<Decorator> decorators;
    public final String docstring;
    public final SourceSpan span;
    public final Scope body;

    protected Definition(String name, String qualifiedName, List<Decorator> decorators, String docstring,
                         SourceSpan span, Scope body) {
        this.name = name;
        this.qualifiedName = qualifiedName;
        this.decorators = List.copyOf(decorators);
        this.docstring = docstring;
        this.span = span;
        this.body = body;
    }

    public abstract EntityKind kind();

    public abstract String signature();

    public Visibility visibility() {
        return Visibility.of(name);
    }

    public List<String> decoratorNames() {
        return decorators.stream().map(d -> d.name).collect(Collectors.toList());
    }

    protected boolean sameDefinition(Definition that) {
        return name.equals(that.name) && qualifiedName.equals(that.qualifiedName)
                && decorators.equals(that.decorators) && Objects.equals(docstring, that.docstring)
                && span.equals(that.span) && body.equals(that.body);
    }

    protected int definitionHash() {
        return Objects.hash(name, qualifiedName, decorators, docstring, span, body);
    }

    @Override
    public String toString() {
        return kind().name().toLowerCase() + " " + qualifiedName;
    }
}
