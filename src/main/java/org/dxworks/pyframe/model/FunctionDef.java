package org.dxworks.pyframe.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class FunctionDef extends Definition {
    public final List<Parameter> parameters;
    public final String returnAnnotation;
    public final boolean isAsync;
    public final boolean isStatic;
    public final boolean isClassmethod;
    public final boolean isProperty;

    public FunctionDef(String name, String qualifiedName, List<Parameter> parameters, String returnAnnotation,
                       boolean isAsync, boolean isStatic, boolean isClassmethod, boolean isProperty,
                       List<Decorator> decorators, String docstring, SourceSpan span, Scope body) {
        super(name, qualifiedName, decorators, docstring, span, body);
        this.parameters = List.copyOf(parameters);
        this.returnAnnotation = returnAnnotation;
        this.isAsync = isAsync;
        this.isStatic = isStatic;
        this.isClassmethod = isClassmethod;
        this.isProperty = isProperty;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.FUNCTION;
    }

    @Override
    public String signature() {
        List<String> parts = new ArrayList<>();
        boolean starSeen = false;
        for (int i = 0; i < parameters.size(); i++) {
            Parameter p = parameters.get(i);
            if (p.kind == ParameterKind.VAR_POSITIONAL) {
                starSeen = true;
            }
            if (p.kind == ParameterKind.KEYWORD_ONLY && !starSeen) {
                parts.add("*");
                starSeen = true;
            }
            parts.add(p.render());
            if (p.kind == ParameterKind.POSITIONAL_ONLY
                    && (i + 1 == parameters.size() || parameters.get(i + 1).kind != ParameterKind.POSITIONAL_ONLY)) {
                parts.add("/");
            }
        }
        String signature = (isAsync ? "async " : "") + "def " + name + "(" + String.join(", ", parts) + ")";
        return returnAnnotation == null ? signature : signature + " -> " + returnAnnotation;
    }

    public List<String> parameterNames() {
        return parameters.stream().map(p -> p.name).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionDef)) return false;
        FunctionDef that = (FunctionDef) o;
        return sameDefinition(that) && parameters.equals(that.parameters)
                && Objects.equals(returnAnnotation, that.returnAnnotation)
                && isAsync == that.isAsync && isStatic == that.isStatic
                && isClassmethod == that.isClassmethod && isProperty == that.isProperty;
    }

    @Override
    public int hashCode() {
        return Objects.hash(definitionHash(), parameters, returnAnnotation, isAsync, isStatic, isClassmethod,
                isProperty);
    }
}
