package io.cifxform.core.dictionary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.cifxform.core.model.Block;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Entry;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recommends specialized dictionaries (powder, modulated, magnetic, twinning) from the data
 * names a document uses. Trigger names match in either notation and ignoring case.
 *
 * <p>
 * Confidence is twice the share of a dictionary's triggers found, capped at 1: using half of
 * them is already a certain match. Immutable.
 */
public final class DictionarySuggester {

    private static final Logger LOG = LoggerFactory.getLogger(DictionarySuggester.class);

    static final String RESOURCE = "io/cifxform/core/dictionary/dictionary-suggestions.yml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** A dictionary worth loading and the fields that suggest it. */
    public record Candidate(
            String key, String name, String description, String url, String localFile, List<String> triggers) {

        public Candidate {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(name, "name must not be null");
            description = description == null ? "" : description;
            triggers = List.copyOf(triggers);
            if (triggers.isEmpty()) {
                throw new IllegalArgumentException("candidate " + key + " has no trigger fields");
            }
        }
    }

    /**
     * One recommendation for a document.
     *
     * @param candidate     the suggested dictionary
     * @param triggerFields data names of the document that matched, as written
     * @param confidence    between 0 exclusive and 1 inclusive
     */
    public record DictionarySuggestion(Candidate candidate, List<String> triggerFields, double confidence) {

        public DictionarySuggestion {
            Objects.requireNonNull(candidate, "candidate must not be null");
            triggerFields = List.copyOf(triggerFields);
        }
    }

    private final List<Candidate> candidates;

    private DictionarySuggester(List<Candidate> candidates) {
        this.candidates = List.copyOf(candidates);
    }

    public static DictionarySuggester of(List<Candidate> candidates) {
        return new DictionarySuggester(candidates);
    }

    /**
     * The suggestions shipped with the library.
     *
     * @throws IllegalStateException if the bundled resource is missing or unreadable
     */
    public static DictionarySuggester bundled() {
        try (InputStream in = DictionarySuggester.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + RESOURCE);
            }
            List<Candidate> candidates = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> entries = YAML_MAPPER.readTree(in).path("suggestions").fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                JsonNode node = entry.getValue();
                List<String> triggers = new ArrayList<>();
                node.path("triggers").forEach(trigger -> triggers.add(trigger.asText()));
                candidates.add(new Candidate(
                        entry.getKey(),
                        node.path("name").asText(entry.getKey()),
                        node.path("description").asText(""),
                        node.hasNonNull("url") ? node.get("url").asText() : null,
                        node.hasNonNull("local-file") ? node.get("local-file").asText() : null,
                        triggers));
            }
            LOG.debug("Loaded dictionary suggestions: candidates={}", candidates.size());
            return new DictionarySuggester(candidates);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read bundled resource " + RESOURCE, e);
        }
    }

    /** Returns a copy that also considers this candidate. */
    public DictionarySuggester withCandidate(Candidate candidate) {
        List<Candidate> extended = new ArrayList<>(candidates);
        extended.add(candidate);
        return new DictionarySuggester(extended);
    }

    public List<Candidate> candidates() {
        return candidates;
    }

    /** Suggestions for the document, most confident first; candidates with no match are left out. */
    public List<DictionarySuggestion> suggest(Document document) {
        Map<String, String> used = new LinkedHashMap<>();
        for (Block block : document.blocks()) {
            for (Entry entry : block.entries()) {
                if (entry instanceof Entry.Field field) {
                    used.putIfAbsent(key(field.name()), field.name());
                } else if (entry instanceof Entry.Loop loop) {
                    for (Entry.LoopColumn column : loop.columns()) {
                        used.putIfAbsent(key(column.name()), column.name());
                    }
                }
            }
        }
        List<DictionarySuggestion> suggestions = new ArrayList<>();
        for (Candidate candidate : candidates) {
            Set<String> matched = new LinkedHashSet<>();
            for (String trigger : candidate.triggers()) {
                String written = used.get(key(trigger));
                if (written != null) {
                    matched.add(written);
                }
            }
            if (!matched.isEmpty()) {
                double confidence = Math.min(1.0, 2.0 * matched.size() / candidate.triggers().size());
                suggestions.add(new DictionarySuggestion(candidate, List.copyOf(matched), confidence));
            }
        }
        suggestions.sort(Comparator.comparingDouble(DictionarySuggestion::confidence).reversed());
        LOG.info(
                "Suggested dictionaries: source={}, suggestions={}",
                document.sourceName(),
                suggestions.stream().map(s -> s.candidate().key()).toList());
        return suggestions;
    }

    private static String key(String dataName) {
        return dataName.replace('.', '_').toLowerCase(Locale.ROOT);
    }
}
