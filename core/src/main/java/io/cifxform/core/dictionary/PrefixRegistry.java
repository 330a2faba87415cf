package io.cifxform.core.dictionary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.cifxform.core.error.ConfigLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local prefixes registered for software-specific data names, such as {@code shelx} in
 * {@code _shelx_res_file}, together with the dictionaries that define names under them.
 *
 * <pre>
 * {
 *   "prefixes": {
 *     "shelx": {"description": "...", "suggested_dictionary": "cif_shelxl.dic"}
 *   },
 *   "category_dictionary_suggestions": {"pd_": "cif_pow.dic"}
 * }
 * </pre>
 *
 * <p>
 * The same layout is accepted as YAML. Prefixes are matched without their surrounding
 * underscores or dots and ignoring case. Immutable.
 */
public final class PrefixRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(PrefixRegistry.class);

    static final String RESOURCE = "io/cifxform/core/dictionary/registered-prefixes.json";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final PrefixRegistry EMPTY = new PrefixRegistry(Map.of(), Map.of());

    /**
     * One registered prefix.
     *
     * @param name                normalized prefix
     * @param description         free text, may be empty
     * @param suggestedDictionary dictionary file defining names under the prefix, or {@code null}
     */
    public record Prefix(String name, String description, String suggestedDictionary) {

        public Prefix {
            Objects.requireNonNull(name, "name must not be null");
            description = description == null ? "" : description;
        }
    }

    private final Map<String, Prefix> prefixes;
    private final Map<String, String> categorySuggestions;

    private PrefixRegistry(Map<String, Prefix> prefixes, Map<String, String> categorySuggestions) {
        this.prefixes = Map.copyOf(prefixes);
        this.categorySuggestions = Map.copyOf(categorySuggestions);
    }

    public static PrefixRegistry empty() {
        return EMPTY;
    }

    /** A registry holding just these prefixes, written with or without underscores. */
    public static PrefixRegistry of(Collection<String> prefixes) {
        return EMPTY.withPrefixes(prefixes);
    }

    /**
     * The registry shipped with the library.
     *
     * @throws IllegalStateException if the bundled resource is missing or unreadable
     */
    public static PrefixRegistry bundled() {
        try (InputStream in = PrefixRegistry.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + RESOURCE);
            }
            return fromTree(JSON_MAPPER.readTree(in), RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read bundled resource " + RESOURCE, e);
        }
    }

    /**
     * Reads a registry file: YAML when the name ends in {@code .yml} or {@code .yaml}, JSON
     * otherwise.
     *
     * @throws ConfigLoadException if the file is missing or malformed
     */
    public static PrefixRegistry load(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigLoadException("Prefix registry not found: " + path, path.toString());
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = fileName.endsWith(".yml") || fileName.endsWith(".yaml") ? YAML_MAPPER : JSON_MAPPER;
        try (InputStream in = Files.newInputStream(path)) {
            return fromTree(mapper.readTree(in), path.toString());
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse prefix registry: " + path, e, path.toString());
        }
    }

    private static PrefixRegistry fromTree(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new ConfigLoadException("Prefix registry root must be a mapping", source);
        }
        Map<String, Prefix> prefixes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = root.path("prefixes").fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String name = normalize(entry.getKey());
            JsonNode details = entry.getValue();
            prefixes.put(
                    name,
                    new Prefix(
                            name,
                            details.path("description").asText(""),
                            details.hasNonNull("suggested_dictionary")
                                    ? details.get("suggested_dictionary").asText()
                                    : null));
        }
        Map<String, String> categories = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> patterns = root.path("category_dictionary_suggestions").fields();
        while (patterns.hasNext()) {
            Map.Entry<String, JsonNode> entry = patterns.next();
            categories.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue().asText());
        }
        LOG.debug(
                "Loaded prefix registry: source={}, prefixes={}, categories={}",
                source,
                prefixes.size(),
                categories.size());
        return new PrefixRegistry(prefixes, categories);
    }

    /** Returns a copy that also registers these prefixes; existing entries keep their details. */
    public PrefixRegistry withPrefixes(Collection<String> extra) {
        Map<String, Prefix> merged = new LinkedHashMap<>(prefixes);
        for (String prefix : extra) {
            String name = normalize(prefix);
            if (!name.isEmpty()) {
                merged.putIfAbsent(name, new Prefix(name, "", null));
            }
        }
        return new PrefixRegistry(merged, categorySuggestions);
    }

    public boolean isRegistered(String prefix) {
        return prefix != null && prefixes.containsKey(normalize(prefix));
    }

    public Optional<Prefix> prefix(String prefix) {
        return prefix == null ? Optional.empty() : Optional.ofNullable(prefixes.get(normalize(prefix)));
    }

    /** Registered prefix names, sorted. */
    public Set<String> names() {
        return new TreeSet<>(prefixes.keySet());
    }

    /**
     * Suggests a dictionary for names under a prefix or category: the registered prefix's own
     * suggestion, then an exact category entry, then the longest {@code xxx_} pattern the prefix
     * starts with.
     */
    public Optional<String> suggestDictionary(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return Optional.empty();
        }
        String key = normalize(prefix);
        Prefix registered = prefixes.get(key);
        if (registered != null && registered.suggestedDictionary() != null) {
            return Optional.of(registered.suggestedDictionary());
        }
        String direct = categorySuggestions.get(key);
        if (direct != null) {
            return Optional.of(direct);
        }
        String withUnderscore = key + "_";
        return categorySuggestions.keySet().stream()
                .filter(pattern -> pattern.endsWith("_") && withUnderscore.startsWith(pattern))
                .max(Comparator.comparingInt(String::length))
                .map(categorySuggestions::get);
    }

    /** Returns the local prefix of a data name, lower-cased, or an empty string. */
    public static String prefixOf(String dataName) {
        int start = dataName.startsWith("_") ? 1 : 0;
        int end = start;
        while (end < dataName.length() && dataName.charAt(end) != '_' && dataName.charAt(end) != '.') {
            end++;
        }
        return end < dataName.length() ? dataName.substring(start, end).toLowerCase(Locale.ROOT) : "";
    }

    static String normalize(String prefix) {
        String trimmed = prefix.strip();
        int start = 0;
        int end = trimmed.length();
        while (start < end && trimmed.charAt(start) == '_') {
            start++;
        }
        while (end > start && (trimmed.charAt(end - 1) == '_' || trimmed.charAt(end - 1) == '.')) {
            end--;
        }
        return trimmed.substring(start, end).toLowerCase(Locale.ROOT);
    }
}
