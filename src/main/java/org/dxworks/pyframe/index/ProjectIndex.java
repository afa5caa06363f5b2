package org.dxworks.pyframe.index;

import org.dxworks.pyframe.model.Definition;
import org.dxworks.pyframe.model.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Project-wide merge of per-unit module indexes, keyed by module label. Each label is written once;
 * concurrent writers may register different modules safely, and a second module with the same label
 * is rejected.
 */
public final class ProjectIndex {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectIndex.class);

    private final Map<String, ModuleIndex> modules = new ConcurrentHashMap<>();

    /** Registers {@code module}; returns false when its label is already taken. */
    public boolean register(Module module) {
        ModuleIndex previous = modules.putIfAbsent(module.name, new ModuleIndex(module));
        if (previous != null) {
            LOG.warn("Module {} from {} already registered from {}, keeping the first",
                    module.name, module.path, previous.module().path);
            return false;
        }
        return true;
    }

    public Optional<ModuleIndex> module(String moduleName) {
        return Optional.ofNullable(modules.get(moduleName));
    }

    /** Definition {@code qualifiedName} (e.g. {@code A.m}) in module {@code moduleName} (e.g. {@code pkg.mod}). */
    public Optional<Definition> find(String moduleName, String qualifiedName) {
        ModuleIndex index = modules.get(moduleName);
        return index == null ? Optional.empty() : index.lookup(qualifiedName);
    }

    /** Resolves a fully qualified name such as {@code pkg.mod.A.m} by the longest matching module label. */
    public Optional<Definition> find(String fullyQualifiedName) {
        String moduleName = fullyQualifiedName;
        while (true) {
            int dot = moduleName.lastIndexOf('.');
            if (dot < 0) {
                return Optional.empty();
            }
            moduleName = moduleName.substring(0, dot);
            Optional<Definition> found = find(moduleName, fullyQualifiedName.substring(dot + 1));
            if (found.isPresent()) {
                return found;
            }
        }
    }

    /** Module labels in sorted order. */
    public List<String> moduleNames() {
        return modules.keySet().stream().sorted().collect(Collectors.toList());
    }

    public int size() {
        return modules.size();
    }
}
