package org.dxworks.pyframe.analyzer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Dotted module labels derived from source paths. Purely textual: nothing here touches the filesystem.
 */
public final class ModulePaths {

    private static final String INIT = "__init__";
    private static final List<String> EXTENSIONS = List.of(".py", ".pyi", ".pyw");

    private ModulePaths() {
    }

    /** {@code a/b/c.py} is {@code a.b.c}, {@code a/b/__init__.py} is {@code a.b}. */
    public static String moduleName(String path) {
        List<String> parts = segments(path);
        if (!parts.isEmpty() && parts.get(parts.size() - 1).equals(INIT)) {
            parts.remove(parts.size() - 1);
        }
        return String.join(".", parts);
    }

    /** Label of {@code file} relative to the source root {@code root}. */
    public static String moduleName(Path root, Path file) {
        return moduleName(relativePath(root, file));
    }

    /** {@code file} relative to {@code root}, with forward slashes. */
    public static String relativePath(Path root, Path file) {
        Path relative = root.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize());
        return relative.toString().replace('\\', '/');
    }

    /** True for a package initializer, whose label names the package itself. */
    public static boolean isPackage(String path) {
        List<String> parts = segments(path);
        return !parts.isEmpty() && parts.get(parts.size() - 1).equals(INIT);
    }

    /**
     * Absolute module named by a relative import. One dot is the package containing the importing module
     * (the module itself for a package initializer); each further dot climbs one package up.
     *
     * @return the dotted name, or null when the dots climb above the top of the label or nothing is left to name
     */
    public static String resolveRelative(String moduleName, boolean isPackage, int level, List<String> modulePath) {
        if (level <= 0) {
            return modulePath.isEmpty() ? null : String.join(".", modulePath);
        }
        List<String> base = new ArrayList<>(moduleName.isEmpty() ? List.of() : Arrays.asList(moduleName.split("\\.")));
        if (!isPackage && !base.isEmpty()) {
            base.remove(base.size() - 1);
        }
        int up = level - 1;
        if (up > base.size()) {
            return null;
        }
        List<String> resolved = new ArrayList<>(base.subList(0, base.size() - up));
        resolved.addAll(modulePath);
        return resolved.isEmpty() ? null : String.join(".", resolved);
    }

    private static List<String> segments(String path) {
        String normalized = path.replace('\\', '/');
        for (String extension : EXTENSIONS) {
            if (normalized.endsWith(extension)) {
                normalized = normalized.substring(0, normalized.length() - extension.length());
                break;
            }
        }
        List<String> parts = new ArrayList<>();
        for (String part : normalized.split("/")) {
            if (!part.isEmpty() && !part.equals(".")) {
                parts.add(part);
            }
        }
        return parts;
    }
}
