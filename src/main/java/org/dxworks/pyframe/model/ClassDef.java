package org.dxworks.pyframe.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class ClassDef extends Definition {
    public final List<BaseClassRef> bases;
    /** Keyword class arguments, raw text, e.g. {@code metaclass=ABCMeta}. */
    public final List<String> keywords;

    public ClassDef(String name, String qualifiedName, List<BaseClassRef> bases, List<String> keywords,
                    List<Decorator> decorators, String docstring, SourceSpan span, Scope body) {
        super(name, qualifiedName, decorators, docstring, span, body);
        this.bases = List.copyOf(bases);
        this.keywords = List.copyOf(keywords);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.CLASS;
    }

    @Override
    public String signature() {
        List<String> arguments = new ArrayList<>(baseNames());
        arguments.addAll(keywords);
        return arguments.isEmpty() ? "class " + name : "class " + name + "(" + String.join(", ", arguments) + ")";
    }

    public List<String> baseNames() {
        return bases.stream().map(b -> b.text).collect(Collectors.toList());
    }

    /** Methods and nested classes, in source order. */
    public List<Definition> members() {
        return body.children;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassDef)) return false;
        ClassDef that = (ClassDef) o;
        return sameDefinition(that) && bases.equals(that.bases) && keywords.equals(that.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(definitionHash(), bases, keywords);
    }
}
