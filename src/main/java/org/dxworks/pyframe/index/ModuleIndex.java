package org.dxworks.pyframe.index;

import org.dxworks.pyframe.model.CallSite;
import org.dxworks.pyframe.model.ClassDef;
import org.dxworks.pyframe.model.Definition;
import org.dxworks.pyframe.model.EntityKind;
import org.dxworks.pyframe.model.FunctionDef;
import org.dxworks.pyframe.model.ImportEntry;
import org.dxworks.pyframe.model.Module;
import org.dxworks.pyframe.model.Scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only lookups over one {@link Module}, built once from the finished model.
 *
 * Definitions are listed in pre-order source order. When a name is bound twice in the same scope
 * (a property and its setter, a redefinition), {@link #lookup(String)} returns the later definition,
 * matching the binding Python keeps; {@link #lookupAll(String)} returns both.
 */
public final class ModuleIndex {

    private final Module module;
    private final List<Definition> definitions = new ArrayList<>();
    private final Map<String, List<Definition>> byQualifiedName = new LinkedHashMap<>();
    private final Map<String, Scope> scopes = new HashMap<>();
    private final Map<String, String> parents = new HashMap<>();
    private final List<CallSite> calls = new ArrayList<>();

    public ModuleIndex(Module module) {
        this.module = module;
        index(module.root);
    }

    private void index(Scope scope) {
        scopes.put(scope.qualifiedName, scope);
        calls.addAll(scope.calls);
        for (Definition child : scope.children) {
            definitions.add(child);
            byQualifiedName.computeIfAbsent(child.qualifiedName, k -> new ArrayList<>()).add(child);
            parents.put(child.qualifiedName, scope.qualifiedName);
            index(child.body);
        }
    }

    public Module module() {
        return module;
    }

    /** Exact qualified-name lookup, e.g. {@code A.m}. */
    public Optional<Definition> lookup(String qualifiedName) {
        List<Definition> found = byQualifiedName.get(qualifiedName);
        return found == null ? Optional.empty() : Optional.of(found.get(found.size() - 1));
    }

    public List<Definition> lookupAll(String qualifiedName) {
        return Collections.unmodifiableList(byQualifiedName.getOrDefault(qualifiedName, List.of()));
    }

    /** Scope with the given qualified name; {@code ""} is the module scope. */
    public Optional<Scope> scope(String qualifiedName) {
        return Optional.ofNullable(scopes.get(qualifiedName));
    }

    public List<Definition> definitions() {
        return Collections.unmodifiableList(definitions);
    }

    public List<Definition> definitions(EntityKind kind) {
        return definitions.stream()
                .filter(d -> d.kind() == kind)
                .collect(Collectors.toList());
    }

    public List<FunctionDef> functions() {
        return definitions.stream()
                .filter(FunctionDef.class::isInstance)
                .map(FunctionDef.class::cast)
                .collect(Collectors.toList());
    }

    public List<ClassDef> classes() {
        return definitions.stream()
                .filter(ClassDef.class::isInstance)
                .map(ClassDef.class::cast)
                .collect(Collectors.toList());
    }

    /** Every import of the module in source order, nested ones included. */
    public List<ImportEntry> imports() {
        return module.imports;
    }

    /** Direct child definitions of the scope named {@code qualifiedName}; {@code ""} for top level. */
    public List<Definition> children(String qualifiedName) {
        Scope scope = scopes.get(qualifiedName);
        return scope == null ? List.of() : scope.children;
    }

    public List<Definition> topLevel() {
        return module.root.children;
    }

    /** The definition enclosing {@code qualifiedName}; empty for top-level definitions and unknown names. */
    public Optional<Definition> parent(String qualifiedName) {
        String parent = parents.get(qualifiedName);
        return parent == null || parent.isEmpty() ? Optional.empty() : lookup(parent);
    }

    /** Top-level functions and classes whose names carry no underscore prefix. */
    public List<Definition> exports() {
        return module.root.children.stream()
                .filter(d -> !d.name.startsWith("_"))
                .collect(Collectors.toList());
    }

    public List<CallSite> calls() {
        return Collections.unmodifiableList(calls);
    }

    /** Calls made directly in the scope {@code qualifiedName}, not in nested definitions. */
    public List<CallSite> callsIn(String qualifiedName) {
        Scope scope = scopes.get(qualifiedName);
        return scope == null ? List.of() : scope.calls;
    }

    /** Classes of this module that list {@code qualifiedName} as a resolved base. */
    public List<ClassDef> subclassesOf(String qualifiedName) {
        return classes().stream()
                .filter(c -> c.bases.stream().anyMatch(b -> qualifiedName.equals(b.resolvedQualifiedName)))
                .collect(Collectors.toList());
    }
}
