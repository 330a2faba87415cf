package io.cifxform.core.dictionary;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One field definition from a dictionary: the normalized identity every spelling of the field
 * resolves to, plus the metadata used for conversion and validation.
 *
 * @param canonicalId       identity of the field, unique within a dictionary set
 * @param legacySpelling    underscore-delimited spelling, or {@code null}
 * @param modernSpelling    dot-delimited spelling, or {@code null}
 * @param aliases           other spellings, in declaration order
 * @param deprecatedAliases aliases that carry a deprecation date
 * @param deprecatedBy      canonical id of the replacing field, or {@code null}
 * @param valueKind         declared content type
 * @param enumeratedValues  permitted values; empty when unrestricted
 * @param category          category id, or {@code null}
 * @param defaultValue      declared default, or {@code null}
 * @param description       definition text, or {@code null}
 * @param source            name of the dictionary source that defined the field
 */
public record CanonicalField(
        String canonicalId,
        String legacySpelling,
        String modernSpelling,
        List<String> aliases,
        Set<String> deprecatedAliases,
        String deprecatedBy,
        ValueKind valueKind,
        List<String> enumeratedValues,
        String category,
        String defaultValue,
        String description,
        String source) {

    public CanonicalField {
        Objects.requireNonNull(canonicalId, "canonicalId must not be null");
        Objects.requireNonNull(source, "source must not be null");
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
        deprecatedAliases = deprecatedAliases != null ? Set.copyOf(deprecatedAliases) : Set.of();
        enumeratedValues = enumeratedValues != null ? List.copyOf(enumeratedValues) : List.of();
        valueKind = valueKind != null ? valueKind : ValueKind.UNKNOWN;
    }

    public static Builder builder(String canonicalId, String source) {
        return new Builder(canonicalId, source);
    }

    /** Every spelling that resolves to this field: legacy, modern, aliases and the id itself. */
    public List<String> spellings() {
        Set<String> all = new LinkedHashSet<>();
        all.add(canonicalId);
        if (legacySpelling != null) {
            all.add(legacySpelling);
        }
        if (modernSpelling != null) {
            all.add(modernSpelling);
        }
        all.addAll(aliases);
        return new ArrayList<>(all);
    }

    public boolean isDeprecated() {
        return deprecatedBy != null;
    }

    /** A copy carrying the given legacy spelling. */
    public CanonicalField withLegacySpelling(String spelling) {
        return new CanonicalField(
                canonicalId,
                spelling,
                modernSpelling,
                aliases,
                deprecatedAliases,
                deprecatedBy,
                valueKind,
                enumeratedValues,
                category,
                defaultValue,
                description,
                source);
    }

    /** Returns {@code true} if the spelling is one of this field's dated, deprecated aliases. */
    public boolean isDeprecatedSpelling(String spelling) {
        return deprecatedAliases.contains(spelling);
    }

    /** Builder used by the dictionary readers. Not thread-safe. */
    public static final class Builder {

        private final String canonicalId;
        private final String source;
        private String legacySpelling;
        private String modernSpelling;
        private final List<String> aliases = new ArrayList<>();
        private final Set<String> deprecatedAliases = new LinkedHashSet<>();
        private String deprecatedBy;
        private ValueKind valueKind = ValueKind.UNKNOWN;
        private final List<String> enumeratedValues = new ArrayList<>();
        private String category;
        private String defaultValue;
        private String description;

        Builder(String canonicalId, String source) {
            this.canonicalId = canonicalId;
            this.source = source;
        }

        public Builder legacySpelling(String spelling) {
            this.legacySpelling = spelling;
            return this;
        }

        public Builder modernSpelling(String spelling) {
            this.modernSpelling = spelling;
            return this;
        }

        public Builder alias(String alias, boolean deprecated) {
            if (!aliases.contains(alias)) {
                aliases.add(alias);
            }
            if (deprecated) {
                deprecatedAliases.add(alias);
            }
            return this;
        }

        public Builder deprecatedBy(String replacement) {
            this.deprecatedBy = replacement;
            return this;
        }

        public Builder valueKind(ValueKind kind) {
            this.valueKind = kind;
            return this;
        }

        public Builder enumeratedValue(String value) {
            enumeratedValues.add(value);
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder defaultValue(String value) {
            this.defaultValue = value;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /** The aliases added so far, in order. */
        List<String> aliases() {
            return aliases;
        }

        boolean isDeprecatedAlias(String alias) {
            return deprecatedAliases.contains(alias);
        }

        public CanonicalField build() {
            return new CanonicalField(
                    canonicalId,
                    legacySpelling,
                    modernSpelling,
                    aliases,
                    deprecatedAliases,
                    deprecatedBy,
                    valueKind,
                    enumeratedValues,
                    category,
                    defaultValue,
                    description,
                    source);
        }
    }
}
