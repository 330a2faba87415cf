package io.cifxform.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.cifxform.core.error.ConfigLoadException;
import io.cifxform.core.model.Notation;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link CifConfig} from a YAML file with an optional environment variable overlay.
 *
 * <pre>
 * dictionaries:            # ascending precedence
 *   - dictionaries/cif_core.dic
 * rules: rules/checkcif.cif_rules
 * target-notation: modern
 * case-fallback: true
 * prefix-registry: registered-prefixes.json   # optional; the bundled registry otherwise
 * registered-prefixes: [_mylab_]              # added to the registry
 * allowed-fields: [_my_lab.thing]
 * </pre>
 *
 * <p>
 * Relative paths resolve against the directory holding the configuration file. Missing keys
 * receive the defaults of {@link CifConfig.Builder}.
 *
 * <p>
 * Environment overlay: {@code CIFX_DICTIONARIES} (comma separated) replaces the dictionary list,
 * {@code CIFX_TARGET_NOTATION}, {@code CIFX_CASE_FALLBACK} and {@code CIFX_PREFIX_REGISTRY} override
 * their keys. An env var is
 * "set" only if it is defined and non-blank after trimming; otherwise the YAML value stands.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_CONFIG_FILE = "cif-xform.yml";

    static final String ENV_DICTIONARIES = "CIFX_DICTIONARIES";
    static final String ENV_TARGET_NOTATION = "CIFX_TARGET_NOTATION";
    static final String ENV_CASE_FALLBACK = "CIFX_CASE_FALLBACK";
    static final String ENV_PREFIX_REGISTRY = "CIFX_PREFIX_REGISTRY";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link CifConfig}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid value
     */
    public static CifConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link CifConfig}, applying overrides from the supplied lookup. The lookup returns
     * {@code null} for an undefined variable.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid value
     */
    public static CifConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath, configPath.toString());
        }
        Path baseDir = configPath.toAbsolutePath().getParent();
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode()) {
                root = YAML_MAPPER.createObjectNode();
            }
            CifConfig config = mapToConfig(root, baseDir, envLookup, configPath.toString());
            LOG.info(
                    "Loaded configuration: source={}, dictionaries={}, targetNotation={}",
                    configPath,
                    config.dictionaries().size(),
                    config.targetNotation());
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException(
                    "Failed to parse YAML configuration: " + configPath, e, configPath.toString());
        }
    }

    private static CifConfig mapToConfig(
            JsonNode root, Path baseDir, Function<String, String> envLookup, String source) {
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping", source);
        }
        CifConfig.Builder builder = CifConfig.builder();

        // ── YAML mapping ──

        List<Path> dictionaries = new ArrayList<>();
        for (String entry : stringList(root, "dictionaries", source)) {
            dictionaries.add(resolve(baseDir, entry));
        }
        String rules = textOrNull(root, "rules");
        if (rules != null && !rules.isBlank()) {
            builder.rules(resolve(baseDir, rules.trim()));
        }
        String notation = textOrDefault(root, "target-notation", "modern");
        boolean caseFallback = boolOrDefault(root, "case-fallback", true);
        String prefixRegistry = textOrNull(root, "prefix-registry");
        builder.registeredPrefixes(stringList(root, "registered-prefixes", source));
        builder.allowedFields(stringList(root, "allowed-fields", source));

        // ── Environment overlay ──

        if (isSet(envLookup, ENV_DICTIONARIES)) {
            dictionaries.clear();
            for (String entry : envLookup.apply(ENV_DICTIONARIES).split(",")) {
                if (!entry.isBlank()) {
                    dictionaries.add(resolve(baseDir, entry.trim()));
                }
            }
        }
        notation = envStringOrDefault(envLookup, ENV_TARGET_NOTATION, notation);
        caseFallback = envBoolOrDefault(envLookup, ENV_CASE_FALLBACK, caseFallback);
        prefixRegistry = envStringOrDefault(envLookup, ENV_PREFIX_REGISTRY, prefixRegistry);
        if (prefixRegistry != null && !prefixRegistry.isBlank()) {
            builder.prefixRegistry(resolve(baseDir, prefixRegistry.trim()));
        }

        try {
            builder.targetNotation(Notation.parse(notation));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid target-notation: " + e.getMessage(), e, source);
        }
        return builder.dictionaries(dictionaries).caseFallback(caseFallback).build();
    }

    private static Path resolve(Path baseDir, String path) {
        Path candidate = Path.of(path);
        return candidate.isAbsolute() || baseDir == null ? candidate : baseDir.resolve(candidate).normalize();
    }

    // ── Env helpers ──

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static String envStringOrDefault(Function<String, String> envLookup, String envVar, String yamlDefault) {
        return isSet(envLookup, envVar) ? envLookup.apply(envVar).trim() : yamlDefault;
    }

    private static boolean envBoolOrDefault(Function<String, String> envLookup, String envVar, boolean yamlDefault) {
        return isSet(envLookup, envVar) ? Boolean.parseBoolean(envLookup.apply(envVar).trim()) : yamlDefault;
    }

    // ── YAML helpers ──

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.hasNonNull(field) ? node.get(field).asText() : defaultValue;
    }

    private static boolean boolOrDefault(JsonNode node, String field, boolean defaultValue) {
        return node.hasNonNull(field) ? node.get(field).asBoolean() : defaultValue;
    }

    /** Reads a sequence of scalars; a single scalar counts as a one-element list. */
    private static List<String> stringList(JsonNode node, String field, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (value.isValueNode()) {
            return List.of(value.asText());
        }
        if (!value.isArray()) {
            throw new ConfigLoadException("'" + field + "' must be a list", source);
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isValueNode()) {
                throw new ConfigLoadException("'" + field + "' entries must be scalars", source);
            }
            items.add(item.asText());
        }
        return items;
    }
}
