package com.raditha.treediff.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.treediff.gram.LabelFunction;
import com.raditha.treediff.similarity.DistanceMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads tree diff configuration from a YAML file with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > YAML file > preset defaults
 */
public class DiffSettings {

    private static final Logger logger = LoggerFactory.getLogger(DiffSettings.class);
    private static final String CONFIG_KEY = "tree_diff";
    private static final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    private DiffSettings() {
    }

    /**
     * Load configuration, applying CLI overrides where provided.
     *
     * @param configFile   YAML file (null = no file)
     * @param pCLI         CLI p (0 = use YAML/default)
     * @param qCLI         CLI q (0 = use YAML/default)
     * @param dimensionCLI CLI dimension (0 = use YAML/default)
     * @param thresholdCLI CLI similarity percentage 0-100 (0 = use YAML/default)
     * @param presetCLI    CLI preset name (null = use YAML/default)
     * @return Complete configuration
     * @throws IOException if the file cannot be read or parsed
     */
    public static DiffConfig loadConfig(Path configFile, int pCLI, int qCLI, int dimensionCLI,
                                        int thresholdCLI, String presetCLI) throws IOException {
        Map<String, Object> yaml = readSection(configFile);

        String preset = presetCLI != null ? presetCLI : getString(yaml, "preset", "moderate");
        DiffConfig base = DiffConfig.forPreset(preset);

        int p = pCLI != 0 ? pCLI : getInt(yaml, "p", base.p());
        int q = qCLI != 0 ? qCLI : getInt(yaml, "q", base.q());
        int dimension = dimensionCLI != 0 ? dimensionCLI : getInt(yaml, "dimension", base.dimension());
        double threshold = thresholdCLI != 0
                ? 1.0 - thresholdCLI / 100.0
                : getDouble(yaml, "threshold", base.threshold());

        DistanceMetric metric = yaml.containsKey("metric")
                ? DistanceMetric.fromString(getString(yaml, "metric", "cosine"))
                : base.metric();
        LabelFunction labels = yaml.containsKey("labels")
                ? LabelFunction.fromString(getString(yaml, "labels", "category"))
                : base.labels();

        DiffConfig config = new DiffConfig(
                p,
                q,
                dimension,
                threshold,
                metric,
                getDouble(yaml, "max_size_difference", base.maxSizeDifference()),
                getInt(yaml, "candidate_limit", base.candidateLimit()),
                getInt(yaml, "small_node_size", base.smallNodeSize()),
                getDouble(yaml, "recovery_ratio", base.recoveryRatio()),
                labels);
        logger.debug("Loaded configuration: {}", config);
        return config;
    }

    /**
     * Load configuration from defaults only.
     */
    public static DiffConfig loadConfig() throws IOException {
        return loadConfig(null, 0, 0, 0, 0, null);
    }

    private static Map<String, Object> readSection(Path configFile) throws IOException {
        if (configFile == null) {
            return Map.of();
        }
        if (!Files.exists(configFile)) {
            throw new IOException("Config file not found: " + configFile);
        }
        Object root = mapper.readValue(configFile.toFile(), Object.class);
        if (!(root instanceof Map<?, ?> rootMap)) {
            logger.warn("Ignoring {}: top level is not a mapping", configFile);
            return Map.of();
        }
        Object section = rootMap.get(CONFIG_KEY);
        if (!(section instanceof Map)) {
            return Map.of();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;
        return config;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
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
}
