package org.dxworks.pyframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class PyframeConfig {

    private static final Logger LOG = LoggerFactory.getLogger(PyframeConfig.class);

    public static final String CONFIG_FILE_NAME = "pyframe-config.yml";

    private static final int DEFAULT_TAB_SIZE = 8;
    private static final int DEFAULT_ALTERNATE_TAB_SIZE = 1;
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final List<String> DEFAULT_STATIC_DECORATORS = List.of("staticmethod");
    private static final List<String> DEFAULT_CLASS_DECORATORS = List.of("classmethod");
    private static final List<String> DEFAULT_PROPERTY_DECORATORS = List.of(
            "property", "cached_property", "functools.cached_property", "abc.abstractproperty");

    private final int tabSize;
    private final int alternateTabSize;
    private final int maxFileLines;
    private final int parallelism;
    private final List<String> staticDecorators;
    private final List<String> classDecorators;
    private final List<String> propertyDecorators;

    private PyframeConfig(int tabSize, int alternateTabSize, int maxFileLines, int parallelism,
                          List<String> staticDecorators, List<String> classDecorators,
                          List<String> propertyDecorators) {
        this.tabSize = tabSize;
        this.alternateTabSize = alternateTabSize;
        this.maxFileLines = maxFileLines;
        this.parallelism = parallelism;
        this.staticDecorators = List.copyOf(staticDecorators);
        this.classDecorators = List.copyOf(classDecorators);
        this.propertyDecorators = List.copyOf(propertyDecorators);
    }

    public int getTabSize() {
        return tabSize;
    }

    public int getAlternateTabSize() {
        return alternateTabSize;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public int getParallelism() {
        return parallelism;
    }

    public List<String> getStaticDecorators() {
        return staticDecorators;
    }

    public List<String> getClassDecorators() {
        return classDecorators;
    }

    public List<String> getPropertyDecorators() {
        return propertyDecorators;
    }

    public static PyframeConfig defaults() {
        return new PyframeConfig(DEFAULT_TAB_SIZE, DEFAULT_ALTERNATE_TAB_SIZE, DEFAULT_MAX_FILE_LINES,
                defaultParallelism(), DEFAULT_STATIC_DECORATORS, DEFAULT_CLASS_DECORATORS,
                DEFAULT_PROPERTY_DECORATORS);
    }

    /** Loads {@value #CONFIG_FILE_NAME} from the working directory. */
    public static PyframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static PyframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int tabSize = positiveOr(yamlConfig.tabSize, DEFAULT_TAB_SIZE);
                int alternateTabSize = positiveOr(yamlConfig.alternateTabSize, DEFAULT_ALTERNATE_TAB_SIZE);
                if (tabSize == alternateTabSize) {
                    LOG.warn("tabSize and alternateTabSize must differ in {}, using defaults", configPath);
                    tabSize = DEFAULT_TAB_SIZE;
                    alternateTabSize = DEFAULT_ALTERNATE_TAB_SIZE;
                }
                return new PyframeConfig(
                        tabSize,
                        alternateTabSize,
                        positiveOr(yamlConfig.maxFileLines, DEFAULT_MAX_FILE_LINES),
                        positiveOr(yamlConfig.parallelism, defaultParallelism()),
                        listOr(yamlConfig.staticDecorators, DEFAULT_STATIC_DECORATORS),
                        listOr(yamlConfig.classDecorators, DEFAULT_CLASS_DECORATORS),
                        listOr(yamlConfig.propertyDecorators, DEFAULT_PROPERTY_DECORATORS));
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static PyframeConfig with(int maxFileLines, int parallelism) {
        return new PyframeConfig(DEFAULT_TAB_SIZE, DEFAULT_ALTERNATE_TAB_SIZE,
                maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES,
                parallelism > 0 ? parallelism : defaultParallelism(),
                DEFAULT_STATIC_DECORATORS, DEFAULT_CLASS_DECORATORS, DEFAULT_PROPERTY_DECORATORS);
    }

    public PyframeConfig withTabSizes(int tabSize, int alternateTabSize) {
        if (tabSize <= 0 || alternateTabSize <= 0 || tabSize == alternateTabSize) {
            throw new IllegalArgumentException("tab sizes must be positive and distinct");
        }
        return new PyframeConfig(tabSize, alternateTabSize, maxFileLines, parallelism,
                staticDecorators, classDecorators, propertyDecorators);
    }

    public PyframeConfig withDecorators(List<String> staticDecorators, List<String> classDecorators,
                                        List<String> propertyDecorators) {
        return new PyframeConfig(tabSize, alternateTabSize, maxFileLines, parallelism,
                staticDecorators, classDecorators, propertyDecorators);
    }

    private static int defaultParallelism() {
        return Runtime.getRuntime().availableProcessors();
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static List<String> listOr(List<String> value, List<String> fallback) {
        return value != null ? value : fallback;
    }

    private static class YamlConfig {
        public Integer tabSize;
        public Integer alternateTabSize;
        public Integer maxFileLines;
        public Integer parallelism;
        public List<String> staticDecorators;
        public List<String> classDecorators;
        public List<String> propertyDecorators;
    }
}
