package io.cifxform.core.dictionary;

import io.cifxform.core.model.ChangeLog;
import io.cifxform.core.model.Notation;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, merged view over one or more dictionaries. Every spelling (legacy, modern, alias)
 * maps to exactly one canonical id.
 *
 * <p>
 * This is the unit of atomic swap in {@link io.cifxform.core.engine.CifEngine}: reloading builds a
 * new set and replaces the reference; conversions that captured the old set keep using it.
 *
 * <p>
 * Thread-safe: all state is final and unmodifiable.
 */
public final class DictionarySet {

    private static final DictionarySet EMPTY = new Builder().build();

    private final Map<String, CanonicalField> byId;
    private final Map<String, String> spellingToId;
    private final Map<String, String> lowerCaseToId;
    private final List<MergeConflict> conflicts;
    private final List<String> sources;
    private final Set<String> legacyExtensions;
    private final ChangeLog warnings;

    private DictionarySet(
            Map<String, CanonicalField> byId,
            Map<String, String> spellingToId,
            List<MergeConflict> conflicts,
            List<String> sources,
            Set<String> legacyExtensions,
            ChangeLog warnings) {
        this.byId = Collections.unmodifiableMap(new LinkedHashMap<>(byId));
        this.spellingToId = Map.copyOf(spellingToId);
        Map<String, String> lower = new HashMap<>();
        for (Map.Entry<String, String> entry : spellingToId.entrySet()) {
            lower.putIfAbsent(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
        }
        this.lowerCaseToId = Map.copyOf(lower);
        this.conflicts = List.copyOf(new LinkedHashSet<>(conflicts));
        this.sources = List.copyOf(sources);
        Set<String> extensions = new LinkedHashSet<>();
        for (String spelling : legacyExtensions) {
            if (byId.containsKey(spellingToId.get(spelling))
                    && spelling.equals(byId.get(spellingToId.get(spelling)).legacySpelling())) {
                extensions.add(spelling);
            }
        }
        this.legacyExtensions = Collections.unmodifiableSet(extensions);
        this.warnings = warnings;
    }

    public static DictionarySet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Exact lookup by legacy spelling, modern spelling, alias or canonical id. */
    public Optional<CanonicalField> resolve(String name) {
        String id = spellingToId.get(name);
        return id != null ? Optional.ofNullable(byId.get(id)) : Optional.empty();
    }

    /**
     * Exact lookup first; only if that fails, a lookup with the name lower-cased. Dictionary
     * spellings are compared lower-cased as well.
     */
    public Optional<CanonicalField> resolveWithCaseFallback(String name) {
        Optional<CanonicalField> exact = resolve(name);
        if (exact.isPresent()) {
            return exact;
        }
        String id = lowerCaseToId.get(name.toLowerCase(Locale.ROOT));
        return id != null ? Optional.ofNullable(byId.get(id)) : Optional.empty();
    }

    /** Looks a field up by canonical id. */
    public Optional<CanonicalField> field(String canonicalId) {
        return Optional.ofNullable(byId.get(canonicalId));
    }

    /**
     * Returns the spelling a field should carry in the given notation: its own spelling for that
     * notation if it has one, otherwise the other notation's, otherwise its canonical id.
     *
     * @throws IllegalArgumentException if the id is not in this set
     */
    public String preferredSpelling(String canonicalId, Notation notation) {
        CanonicalField field = byId.get(canonicalId);
        if (field == null) {
            throw new IllegalArgumentException("Unknown canonical id: " + canonicalId);
        }
        String first = notation == Notation.LEGACY ? field.legacySpelling() : field.modernSpelling();
        String second = notation == Notation.LEGACY ? field.modernSpelling() : field.legacySpelling();
        if (first != null) {
            return first;
        }
        return second != null ? second : field.canonicalId();
    }

    /**
     * Walks {@code deprecated_by} links from the given id. The first element is the id itself; the
     * walk stops at a field without a replacement, at a replacement this set does not define, or
     * before revisiting an id.
     */
    public List<String> deprecationChain(String canonicalId) {
        List<String> chain = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        String current = canonicalId;
        while (current != null && seen.add(current)) {
            chain.add(current);
            current = replacementOf(current);
        }
        return chain;
    }

    /** The last id of the deprecation chain: the field currently in use. */
    public String terminal(String canonicalId) {
        List<String> chain = deprecationChain(canonicalId);
        return chain.get(chain.size() - 1);
    }

    public Collection<CanonicalField> fields() {
        return byId.values();
    }

    public int size() {
        return byId.size();
    }

    public boolean isEmpty() {
        return byId.isEmpty();
    }

    /** Spellings claimed by more than one definition, in the order they were met. */
    public List<MergeConflict> conflicts() {
        return conflicts;
    }

    /** Names of the sources merged into this set, lowest precedence first. */
    public List<String> sources() {
        return sources;
    }

    /**
     * Returns {@code true} if the spelling is a legacy spelling no dictionary defines, supplied by
     * {@link LegacySpellingExtensions}.
     */
    public boolean isLegacyExtension(String spelling) {
        return legacyExtensions.contains(spelling);
    }

    /** Legacy spellings supplied by {@link LegacySpellingExtensions}, in the order they were added. */
    public Set<String> legacyExtensions() {
        return legacyExtensions;
    }

    /** Problems found while building the set, such as deprecation cycles. */
    public ChangeLog warnings() {
        return warnings;
    }

    private String replacementOf(String canonicalId) {
        CanonicalField field = byId.get(canonicalId);
        if (field == null || field.deprecatedBy() == null) {
            return null;
        }
        String replacement = spellingToId.get(field.deprecatedBy());
        return replacement != null && byId.containsKey(replacement) ? replacement : null;
    }

    /**
     * Accumulates definitions source by source. Each {@link #source} call opens a new precedence
     * level above all previous ones. Not thread-safe.
     */
    public static final class Builder {

        private final Map<String, CanonicalField> byId = new LinkedHashMap<>();
        private final Map<String, Integer> idLevel = new HashMap<>();
        private final Map<String, String> spellingToId = new HashMap<>();
        private final Map<String, Integer> spellingLevel = new HashMap<>();
        private final List<MergeConflict> conflicts = new ArrayList<>();
        private final List<String> sources = new ArrayList<>();
        private final Set<String> legacyExtensions = new LinkedHashSet<>();
        private int level = -1;

        Builder() {}

        /** Starts a new precedence level, above every level opened before it. */
        public Builder source(String name) {
            level++;
            sources.add(name);
            return this;
        }

        /** Adds a definition at the current precedence level. */
        public Builder add(CanonicalField field) {
            if (level < 0) {
                source(field.source());
            }
            String id = field.canonicalId();
            Integer existingLevel = idLevel.get(id);
            if (existingLevel != null && existingLevel == level) {
                conflicts.add(new MergeConflict(
                        id, id, id, byId.get(id).source(), field.source(), MergeConflict.Kind.TIE));
                return this;
            }
            if (existingLevel != null) {
                conflicts.add(new MergeConflict(
                        id, id, id, field.source(), byId.get(id).source(), MergeConflict.Kind.OVERRIDE));
            }
            byId.put(id, field);
            idLevel.put(id, level);
            for (String spelling : field.spellings()) {
                claim(spelling, field);
            }
            return this;
        }

        /** Records that a definition's legacy spelling came from {@link LegacySpellingExtensions}. */
        public Builder legacyExtension(String spelling) {
            legacyExtensions.add(spelling);
            return this;
        }

        /**
         * Carries another set's conflicts and legacy extensions over when merging loaded sets.
         * Deprecation cycles are detected again on {@link #build()}.
         */
        public Builder carry(DictionarySet set) {
            conflicts.addAll(set.conflicts());
            legacyExtensions.addAll(set.legacyExtensions());
            return this;
        }

        private void claim(String spelling, CanonicalField field) {
            String owner = spellingToId.get(spelling);
            if (owner == null || owner.equals(field.canonicalId())) {
                spellingToId.put(spelling, field.canonicalId());
                spellingLevel.put(spelling, level);
                return;
            }
            String ownerSource = byId.get(owner).source();
            if (spellingLevel.get(spelling) == level) {
                conflicts.add(new MergeConflict(
                        spelling, owner, field.canonicalId(), ownerSource, field.source(), MergeConflict.Kind.TIE));
                return;
            }
            conflicts.add(new MergeConflict(
                    spelling, field.canonicalId(), owner, field.source(), ownerSource, MergeConflict.Kind.OVERRIDE));
            spellingToId.put(spelling, field.canonicalId());
            spellingLevel.put(spelling, level);
        }

        public DictionarySet build() {
            DictionarySet set =
                    new DictionarySet(byId, spellingToId, conflicts, sources, legacyExtensions, ChangeLog.empty());
            ChangeLog.Builder log = ChangeLog.builder();
            Set<Set<String>> reported = new LinkedHashSet<>();
            for (String id : byId.keySet()) {
                List<String> chain = set.deprecationChain(id);
                String last = chain.get(chain.size() - 1);
                String next = set.replacementOf(last);
                if (next != null) {
                    Set<String> cycle = new LinkedHashSet<>(chain.subList(chain.indexOf(next), chain.size()));
                    if (reported.add(Set.copyOf(cycle))) {
                        log.warning(
                                "DEPRECATION_CYCLE",
                                "Deprecation chain cycles: " + String.join(" -> ", cycle) + " -> " + next,
                                null);
                    }
                }
            }
            return new DictionarySet(byId, spellingToId, conflicts, sources, legacyExtensions, log.build());
        }
    }
}
