package org.dxworks.pyframe.index;

import org.dxworks.pyframe.model.CallSite;
import org.dxworks.pyframe.model.Constant;
import org.dxworks.pyframe.model.Definition;
import org.dxworks.pyframe.model.Diagnostic;
import org.dxworks.pyframe.model.FunctionDef;
import org.dxworks.pyframe.model.ImportEntry;
import org.dxworks.pyframe.model.Module;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compact text outline of a module, meant for a human or a language model to skim. Output depends
 * only on the model, so it is stable across runs.
 */
public final class OutlineRenderer {

    private static final int MAX_CALLS = 5;

    public String render(ModuleIndex index) {
        return render(index, List.of());
    }

    public String render(ModuleIndex index, List<Diagnostic> diagnostics) {
        Module module = index.module();
        StringBuilder out = new StringBuilder();
        out.append("File: ").append(module.path).append(" (module ").append(module.name).append(")\n");
        if (module.docstring != null && !module.docstring.isEmpty()) {
            out.append("Docstring: ").append(firstLine(module.docstring)).append('\n');
        }

        if (!module.imports.isEmpty()) {
            out.append("Imports:\n");
            for (ImportEntry entry : module.imports) {
                out.append("  - ").append(entry);
                if (entry.level > 0) {
                    out.append(" -> ").append(entry.resolvedModule == null ? "?" : entry.resolvedModule);
                }
                out.append('\n');
            }
        }

        if (!module.constants.isEmpty()) {
            out.append("Constants:\n");
            for (Constant constant : module.constants) {
                out.append("  - ").append(constant).append('\n');
            }
        }

        List<Definition> exports = index.exports();
        if (!exports.isEmpty()) {
            out.append("Exports:\n");
            for (Definition export : exports) {
                out.append("  - ").append(export.name).append(" (").append(kindName(export)).append(")\n");
            }
        }

        if (!module.root.children.isEmpty()) {
            out.append("Entities:\n");
            Set<Definition> exported = new HashSet<>(exports);
            for (Definition definition : module.root.children) {
                renderDefinition(definition, 1, exported, out);
            }
        }

        if (!diagnostics.isEmpty()) {
            out.append("Diagnostics:\n");
            for (Diagnostic diagnostic : diagnostics) {
                out.append("  - ").append(diagnostic).append('\n');
            }
        }
        return out.toString();
    }

    private void renderDefinition(Definition definition, int depth, Set<Definition> exported, StringBuilder out) {
        String indent = "  ".repeat(depth);
        out.append(indent).append("- [").append(kindName(definition)).append("] ")
                .append(definition.qualifiedName).append(": ").append(definition.signature())
                .append(" (Line ").append(definition.span.startLine).append('-').append(definition.span.endLine)
                .append(')');
        if (definition instanceof FunctionDef) {
            FunctionDef function = (FunctionDef) definition;
            if (function.isStatic) out.append(" [static]");
            if (function.isClassmethod) out.append(" [classmethod]");
            if (function.isProperty) out.append(" [property]");
        }
        if (exported.contains(definition)) {
            out.append(" [EXPORTED]");
        }
        out.append('\n');

        if (!definition.decorators.isEmpty()) {
            out.append(indent).append("    Decorators: ")
                    .append(definition.decorators.stream().map(Object::toString).collect(Collectors.joining(", ")))
                    .append('\n');
        }
        List<CallSite> calls = definition.body.calls;
        if (!calls.isEmpty()) {
            out.append(indent).append("    Calls: ")
                    .append(calls.stream().limit(MAX_CALLS).map(c -> c.callee).collect(Collectors.joining(", ")))
                    .append(calls.size() > MAX_CALLS ? "..." : "")
                    .append('\n');
        }
        for (Definition child : definition.body.children) {
            renderDefinition(child, depth + 1, exported, out);
        }
    }

    private static String kindName(Definition definition) {
        return definition.kind().name().toLowerCase();
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return (newline < 0 ? text : text.substring(0, newline)).trim();
    }
}
