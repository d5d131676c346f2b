package com.raditha.hygiene.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the pipeline configuration from the {@code hygiene} section of a YAML file with
 * explicit overrides.
 * <p>
 * Configuration priority: overrides &gt; hygiene.yml &gt; defaults
 */
public class PipelineSettings {

    private static final Logger logger = LoggerFactory.getLogger(PipelineSettings.class);

    public static final String CONFIG_KEY = "hygiene";
    public static final String DEFAULT_FILE = "hygiene.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private PipelineSettings() {
        /* this is only a utility class */
    }

    /**
     * Load configuration from a YAML file, applying overrides where provided.
     *
     * @param configFile         the YAML file; a missing file means "use defaults"
     * @param presetOverride     preset name (null = use YAML/default)
     * @param rootModuleOverride root module (null = use YAML/default)
     * @param maxIterationsOverride maximum sweeps (0 = use YAML/default)
     * @return complete pipeline configuration
     */
    public static PipelineConfig loadConfig(Path configFile, String presetOverride, String rootModuleOverride,
                                            int maxIterationsOverride) {
        Map<String, Object> yaml = Map.of();
        if (configFile != null && Files.isRegularFile(configFile)) {
            try (InputStream in = Files.newInputStream(configFile)) {
                yaml = readSection(in);
            } catch (IOException e) {
                throw new UncheckedIOException("Could not read " + configFile, e);
            }
        } else {
            logger.debug("No configuration file at {}, using defaults", configFile);
        }
        return fromMap(yaml, presetOverride, rootModuleOverride, maxIterationsOverride);
    }

    /**
     * Load configuration from a classpath resource.
     */
    public static PipelineConfig loadResource(String resource) {
        try (InputStream in = PipelineSettings.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.debug("No configuration resource {}, using defaults", resource);
                return PipelineConfig.defaults();
            }
            return fromMap(readSection(in), null, null, 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + resource, e);
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> readSection(InputStream in) throws IOException {
        Object root = YAML.readValue(in, Object.class);
        if (root instanceof Map<?, ?> map && map.get(CONFIG_KEY) instanceof Map<?, ?> section) {
            return (Map<String, Object>) section;
        }
        return Map.of();
    }

    /**
     * Build a configuration from the parsed {@code hygiene} section.
     */
    public static PipelineConfig fromMap(Map<String, Object> config, String presetOverride,
                                         String rootModuleOverride, int maxIterationsOverride) {
        String preset = presetOverride != null ? presetOverride : getString(config, "preset", null);
        PipelineConfig base = switch (preset == null ? "default" : preset) {
            case "strict" -> PipelineConfig.strict();
            case "fast" -> PipelineConfig.fast();
            case "default" -> PipelineConfig.defaults();
            default -> throw new IllegalArgumentException("Unknown preset: " + preset);
        };

        String rootModule = rootModuleOverride != null ? rootModuleOverride
                : getString(config, "root_module", base.rootModule());
        int maxIterations = maxIterationsOverride != 0 ? maxIterationsOverride
                : getInt(config, "max_iterations", base.maxIterations());
        boolean fixpoint = getBoolean(config, "fixpoint", base.fixpoint());
        boolean traceDiffs = getBoolean(config, "trace_diffs", base.traceDiffs());

        Set<String> macroModules = getSet(config, "macro_modules");
        if (macroModules.isEmpty()) {
            macroModules = base.macroModules();
        }

        return new PipelineConfig(
                rootModule,
                getSet(config, "app_modules"),
                macroModules,
                fixpoint,
                maxIterations,
                getSet(config, "disabled_passes"),
                traceDiffs);
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static Set<String> getSet(Map<String, Object> map, String key) {
        Object value = map.get(key);
        Set<String> result = new LinkedHashSet<>();
        if (value instanceof List<?> list) {
            for (Object o : list) {
                result.add(String.valueOf(o));
            }
        }
        return result;
    }
}
