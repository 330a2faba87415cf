package io.cifxform.core.config;

import io.cifxform.core.model.Notation;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of a {@link io.cifxform.core.engine.CifEngine}, usually read from
 * {@code cif-xform.yml} by {@link ConfigLoader}.
 *
 * @param dictionaries       dictionary files, lowest precedence first
 * @param rules              rule file applied by default, or {@code null}
 * @param targetNotation     notation documents are converted to
 * @param caseFallback       whether lookups retry with lower-cased names after an exact miss
 * @param prefixRegistry     prefix registry file replacing the bundled one, or {@code null}
 * @param registeredPrefixes local prefixes accepted in addition to the registry's
 * @param allowedFields      data names accepted by the validator without a definition
 */
public record CifConfig(
        List<Path> dictionaries,
        Path rules,
        Notation targetNotation,
        boolean caseFallback,
        Path prefixRegistry,
        List<String> registeredPrefixes,
        List<String> allowedFields) {

    public CifConfig {
        dictionaries = List.copyOf(dictionaries);
        Objects.requireNonNull(targetNotation, "targetNotation must not be null");
        registeredPrefixes = List.copyOf(registeredPrefixes);
        allowedFields = List.copyOf(allowedFields);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Defaults: no dictionaries, no rules, modern notation, case fallback on, bundled prefix registry. */
    public static CifConfig defaults() {
        return builder().build();
    }

    /** Builder with the documented defaults. Not thread-safe. */
    public static final class Builder {

        private List<Path> dictionaries = new ArrayList<>();
        private Path rules;
        private Notation targetNotation = Notation.MODERN;
        private boolean caseFallback = true;
        private Path prefixRegistry;
        private List<String> registeredPrefixes = List.of();
        private List<String> allowedFields = List.of();

        Builder() {}

        public Builder dictionaries(List<Path> dictionaries) {
            this.dictionaries = new ArrayList<>(dictionaries);
            return this;
        }

        public Builder addDictionary(Path dictionary) {
            this.dictionaries.add(dictionary);
            return this;
        }

        public Builder rules(Path rules) {
            this.rules = rules;
            return this;
        }

        public Builder targetNotation(Notation targetNotation) {
            this.targetNotation = targetNotation;
            return this;
        }

        public Builder caseFallback(boolean caseFallback) {
            this.caseFallback = caseFallback;
            return this;
        }

        public Builder prefixRegistry(Path prefixRegistry) {
            this.prefixRegistry = prefixRegistry;
            return this;
        }

        public Builder registeredPrefixes(List<String> registeredPrefixes) {
            this.registeredPrefixes = registeredPrefixes;
            return this;
        }

        public Builder allowedFields(List<String> allowedFields) {
            this.allowedFields = allowedFields;
            return this;
        }

        public CifConfig build() {
            return new CifConfig(
                    dictionaries,
                    rules,
                    targetNotation,
                    caseFallback,
                    prefixRegistry,
                    registeredPrefixes,
                    allowedFields);
        }
    }
}
