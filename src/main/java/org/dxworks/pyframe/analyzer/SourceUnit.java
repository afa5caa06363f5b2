package org.dxworks.pyframe.analyzer;

/**
 * Source text together with its originating path. The path only names the unit: it yields the module
 * label and anchors relative imports.
 */
public final class SourceUnit {
    public final String path;
    public final String moduleName;
    public final String text;

    public SourceUnit(String path, String moduleName, String text) {
        if (path == null || moduleName == null || text == null) {
            throw new IllegalArgumentException("path, moduleName and text are required");
        }
        this.path = path;
        this.moduleName = moduleName;
        this.text = text;
    }

    /** Unit whose module label is derived from {@code path}. */
    public static SourceUnit of(String path, String text) {
        if (path == null) {
            throw new IllegalArgumentException("path is required");
        }
        return new SourceUnit(path, ModulePaths.moduleName(path), text);
    }

    public long lineCount() {
        if (text.isEmpty()) return 0;
        return text.lines().count();
    }

    @Override
    public String toString() {
        return moduleName + " (" + path + ")";
    }
}
