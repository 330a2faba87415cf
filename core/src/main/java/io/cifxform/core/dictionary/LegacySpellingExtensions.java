package io.cifxform.core.dictionary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Legacy spellings for fields that official dictionaries define only in dotted form. Programs
 * still write names such as {@code _refine_diff_potential_max}; with these mappings a loaded
 * dictionary resolves them and converts to and from them.
 *
 * <p>
 * A mapping only ever fills a gap: it is applied to a field that has a modern spelling but no
 * legacy one, and never to a spelling some other definition already claims. Immutable.
 */
public final class LegacySpellingExtensions {

    private static final Logger LOG = LoggerFactory.getLogger(LegacySpellingExtensions.class);

    static final String RESOURCE = "io/cifxform/core/dictionary/legacy-spelling-extensions.yml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final LegacySpellingExtensions NONE = new LegacySpellingExtensions(Map.of());

    private final Map<String, String> modernToLegacy;
    private final Map<String, String> legacyToModern;

    private LegacySpellingExtensions(Map<String, String> modernToLegacy) {
        this.modernToLegacy = Map.copyOf(modernToLegacy);
        Map<String, String> inverse = new LinkedHashMap<>();
        modernToLegacy.forEach((modern, legacy) -> inverse.put(legacy, modern));
        this.legacyToModern = Map.copyOf(inverse);
    }

    /** Mappings keyed by modern spelling. */
    public static LegacySpellingExtensions of(Map<String, String> modernToLegacy) {
        return new LegacySpellingExtensions(modernToLegacy);
    }

    public static LegacySpellingExtensions none() {
        return NONE;
    }

    /**
     * The mappings shipped with the library.
     *
     * @throws IllegalStateException if the bundled resource is missing or unreadable
     */
    public static LegacySpellingExtensions bundled() {
        try (InputStream in = LegacySpellingExtensions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + RESOURCE);
            }
            JsonNode mappings = YAML_MAPPER.readTree(in).path("mappings");
            Map<String, String> modernToLegacy = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> entries = mappings.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                modernToLegacy.put(entry.getKey(), entry.getValue().asText());
            }
            LOG.debug("Loaded legacy spelling extensions: mappings={}", modernToLegacy.size());
            return new LegacySpellingExtensions(modernToLegacy);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read bundled resource " + RESOURCE, e);
        }
    }

    public Optional<String> legacyFor(String modernSpelling) {
        return Optional.ofNullable(modernToLegacy.get(modernSpelling));
    }

    public Optional<String> modernFor(String legacySpelling) {
        return Optional.ofNullable(legacyToModern.get(legacySpelling));
    }

    public int size() {
        return modernToLegacy.size();
    }
}
