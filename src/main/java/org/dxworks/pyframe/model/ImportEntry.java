package org.dxworks.pyframe.model;

import java.util.List;
import java.util.Objects;

/**
 * One imported binding. {@code import a.b} has no symbol; {@code from a import b} has symbol {@code b};
 * {@code from a import *} is a wildcard and has no symbol.
 */
public final class ImportEntry {
    public final List<String> modulePath;
    public final String symbol;
    public final boolean wildcard;
    public final String alias;
    /** 0 for absolute imports, otherwise the number of leading dots. */
    public final int level;
    /** Absolute dotted module name, resolved against the importing module's label; null when it cannot be. */
    public final String resolvedModule;
    public final SourceSpan span;

    public ImportEntry(List<String> modulePath, String symbol, boolean wildcard, String alias, int level,
                       String resolvedModule, SourceSpan span) {
        if (wildcard && symbol != null) {
            throw new IllegalArgumentException("a wildcard import has no symbol");
        }
        this.modulePath = List.copyOf(modulePath);
        this.symbol = symbol;
        this.wildcard = wildcard;
        this.alias = alias;
        this.level = level;
        this.resolvedModule = resolvedModule;
        this.span = span;
    }

    /** Module as written, e.g. {@code ..helpers}. */
    public String moduleText() {
        return ".".repeat(level) + String.join(".", modulePath);
    }

    /** Name bound in the importing scope; null for wildcards. */
    public String boundName() {
        if (wildcard) return null;
        if (alias != null) return alias;
        if (symbol != null) return symbol;
        return modulePath.isEmpty() ? null : modulePath.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImportEntry)) return false;
        ImportEntry that = (ImportEntry) o;
        return wildcard == that.wildcard && level == that.level && modulePath.equals(that.modulePath)
                && Objects.equals(symbol, that.symbol) && Objects.equals(alias, that.alias)
                && Objects.equals(resolvedModule, that.resolvedModule) && span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modulePath, symbol, wildcard, alias, level, resolvedModule, span);
    }

    @Override
    public String toString() {
        String target = wildcard ? "*" : symbol;
        String text = target == null ? "import " + moduleText() : "from " + moduleText() + " import " + target;
        return alias == null ? text : text + " as " + alias;
    }
}
