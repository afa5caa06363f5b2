package org.dxworks.pyframe.analyzer.extract;

import org.dxworks.pyframe.PyframeConfig;
import org.dxworks.pyframe.model.Decorator;

import java.util.List;
import java.util.Set;

/**
 * Recognizes the decorators that set a function's static, classmethod or property flag. Matching is on
 * the decorator name as written (call arguments excluded), so {@code @functools.cached_property} matches
 * only when that dotted form is configured.
 */
public final class DecoratorMarkers {

    private static final List<String> ACCESSOR_SUFFIXES = List.of(".setter", ".getter", ".deleter");

    private final Set<String> staticMarkers;
    private final Set<String> classMarkers;
    private final Set<String> propertyMarkers;

    public DecoratorMarkers(Set<String> staticMarkers, Set<String> classMarkers, Set<String> propertyMarkers) {
        this.staticMarkers = Set.copyOf(staticMarkers);
        this.classMarkers = Set.copyOf(classMarkers);
        this.propertyMarkers = Set.copyOf(propertyMarkers);
    }

    public static DecoratorMarkers from(PyframeConfig config) {
        return new DecoratorMarkers(Set.copyOf(config.getStaticDecorators()), Set.copyOf(config.getClassDecorators()),
                Set.copyOf(config.getPropertyDecorators()));
    }

    public static DecoratorMarkers defaults() {
        return from(PyframeConfig.defaults());
    }

    public boolean isStatic(List<Decorator> decorators) {
        return decorators.stream().anyMatch(d -> staticMarkers.contains(d.name));
    }

    public boolean isClassmethod(List<Decorator> decorators) {
        return decorators.stream().anyMatch(d -> classMarkers.contains(d.name));
    }

    /** Property markers, plus {@code @x.setter}, {@code @x.getter} and {@code @x.deleter} accessors. */
    public boolean isProperty(List<Decorator> decorators) {
        return decorators.stream().anyMatch(d -> propertyMarkers.contains(d.name) || isAccessor(d.name));
    }

    private static boolean isAccessor(String name) {
        return ACCESSOR_SUFFIXES.stream().anyMatch(name::endsWith);
    }
}
