package io.cifxform.core.validate;

import io.cifxform.core.dictionary.CanonicalField;
import io.cifxform.core.dictionary.DictionarySet;
import io.cifxform.core.dictionary.PrefixRegistry;
import io.cifxform.core.dictionary.ValueKind;
import io.cifxform.core.model.Block;
import io.cifxform.core.model.ChangeLog;
import io.cifxform.core.model.CifNumbers;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Entry;
import io.cifxform.core.model.Notation;
import io.cifxform.core.model.Value;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies every data name of a document and checks single values against the type and
 * enumeration their definition declares.
 *
 * <p>
 * The local prefix of a data name is the segment between its leading underscore and the next
 * {@code _} or {@code .}: {@code shelx} for both {@code _shelx_res_file} and
 * {@code _shelx.hkl_file}. A registered prefix may also follow a known category, as
 * {@code oxdiff} does in {@code _diffrn_oxdiff_ac3_digest}; such names are accepted and their
 * dotted form {@code _diffrn.oxdiff_ac3_digest} is suggested.
 */
public final class DocumentValidator {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentValidator.class);

    /** Categories of the core dictionary recognized even when no dictionary is loaded. */
    static final Set<String> CORE_CATEGORIES = Set.of(
            "atom_site", "atom_type", "audit", "cell", "cell_measurement", "chemical", "chemical_formula",
            "computing", "database", "diffrn", "diffrn_detector", "diffrn_measurement", "diffrn_radiation",
            "diffrn_reflns", "diffrn_source", "exptl", "exptl_absorpt", "exptl_crystal", "geom", "journal",
            "publ", "refine", "refine_diff", "refine_ls", "reflns", "space_group", "symmetry");

    private final DictionarySet dictionaries;
    private final PrefixRegistry registry;
    private final Set<String> categories;
    private final Set<String> allowedFields;
    private final boolean caseFallback;

    /** Validates against the bundled prefix registry with case fallback on. */
    public DocumentValidator(DictionarySet dictionaries) {
        this(dictionaries, PrefixRegistry.bundled(), List.of(), true);
    }

    /**
     * @param registeredPrefixes the only prefixes accepted, with or without surrounding
     *                           underscores, e.g. {@code _shelx_} or {@code shelx}
     * @param allowedFields      data names accepted although no dictionary defines them
     */
    public DocumentValidator(
            DictionarySet dictionaries,
            Collection<String> registeredPrefixes,
            Collection<String> allowedFields,
            boolean caseFallback) {
        this(dictionaries, PrefixRegistry.of(registeredPrefixes), allowedFields, caseFallback);
    }

    public DocumentValidator(
            DictionarySet dictionaries,
            PrefixRegistry registry,
            Collection<String> allowedFields,
            boolean caseFallback) {
        this.dictionaries = Objects.requireNonNull(dictionaries, "dictionaries must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.categories = knownCategories(dictionaries);
        this.allowedFields = Set.copyOf(allowedFields);
        this.caseFallback = caseFallback;
    }

    public ValidationReport validate(Document document) {
        List<DataNameCheck> checks = new ArrayList<>();
        ChangeLog.Builder problems = ChangeLog.builder();
        for (Block block : document.blocks()) {
            for (Entry entry : block.entries()) {
                if (entry instanceof Entry.Field field) {
                    DataNameCheck check = classify(block, field.name(), field.line(), problems);
                    checks.add(check);
                    if (check.canonicalId() != null) {
                        checkValue(field, dictionaries.field(check.canonicalId()).orElseThrow(), problems);
                    }
                } else if (entry instanceof Entry.Loop loop) {
                    for (Entry.LoopColumn column : loop.columns()) {
                        checks.add(classify(block, column.name(), loop.line(), problems));
                    }
                }
            }
        }
        ValidationReport report = new ValidationReport(checks, problems.build());
        LOG.info(
                "Validated document: source={}, names={}, problems={}",
                document.sourceName(),
                checks.size(),
                report.problems().size());
        return report;
    }

    /** Returns the local prefix of a data name, lower-cased, or an empty string. */
    public static String prefixOf(String name) {
        return PrefixRegistry.prefixOf(name);
    }

    private DataNameCheck classify(Block block, String name, int line, ChangeLog.Builder problems) {
        Optional<CanonicalField> resolved =
                caseFallback ? dictionaries.resolveWithCaseFallback(name) : dictionaries.resolve(name);
        if (resolved.isPresent()) {
            CanonicalField field = resolved.get();
            if (field.isDeprecatedSpelling(name) || field.isDeprecated()) {
                String terminal = dictionaries.terminal(field.canonicalId());
                String replacement = dictionaries.preferredSpelling(terminal, Notation.of(name));
                problems.warning("DEPRECATED_NAME", name + " is deprecated; use " + replacement, line);
                return DataNameCheck.defined(
                        block.name(), name, line, FieldCategory.DEPRECATED, field.canonicalId(), replacement);
            }
            return DataNameCheck.defined(block.name(), name, line, FieldCategory.VALID, field.canonicalId(), null);
        }
        if (allowedFields.contains(name)) {
            return DataNameCheck.defined(block.name(), name, line, FieldCategory.USER_ALLOWED, null, null);
        }
        String prefix = prefixOf(name);
        if (registry.isRegistered(prefix)) {
            return new DataNameCheck(block.name(), name, line, FieldCategory.REGISTERED_LOCAL, null, null,
                    prefix, null, registry.suggestDictionary(prefix).orElse(null));
        }
        DataNameCheck embedded = embeddedPrefix(block, name, line);
        if (embedded != null) {
            return embedded;
        }
        String dictionary = registry.suggestDictionary(prefix).orElse(null);
        problems.warning(
                "UNKNOWN_NAME",
                name + " is not defined by any loaded dictionary" + (dictionary == null ? "" : "; try " + dictionary),
                line);
        return new DataNameCheck(
                block.name(), name, line, FieldCategory.UNKNOWN, null, null, null, null, dictionary);
    }

    /**
     * Looks for a registered prefix right after a known category, trying the longest category
     * first: {@code _diffrn_oxdiff_ac3_digest} or {@code _diffrn.oxdiff_ac3_digest}.
     */
    private DataNameCheck embeddedPrefix(Block block, String name, int line) {
        String bare = name.startsWith("_") ? name.substring(1) : name;
        int dot = bare.indexOf('.');
        if (dot > 0) {
            String category = bare.substring(0, dot).toLowerCase(Locale.ROOT);
            String prefix = prefixOf("_" + bare.substring(dot + 1));
            if (categories.contains(category) && registry.isRegistered(prefix)) {
                return embeddedCheck(block, name, line, prefix, null);
            }
            return null;
        }
        String[] parts = bare.split("_");
        for (int split = parts.length - 2; split >= 1; split--) {
            String category = String.join("_", Arrays.copyOfRange(parts, 0, split)).toLowerCase(Locale.ROOT);
            String prefix = parts[split].toLowerCase(Locale.ROOT);
            if (categories.contains(category) && registry.isRegistered(prefix)) {
                String head = String.join("_", Arrays.copyOfRange(parts, 0, split));
                String rest = String.join("_", Arrays.copyOfRange(parts, split, parts.length));
                return embeddedCheck(block, name, line, prefix, "_" + head + "." + rest);
            }
        }
        return null;
    }

    private DataNameCheck embeddedCheck(Block block, String name, int line, String prefix, String suggestedName) {
        return new DataNameCheck(block.name(), name, line, FieldCategory.REGISTERED_LOCAL, null, null,
                prefix, suggestedName, registry.suggestDictionary(prefix).orElse(null));
    }

    private static Set<String> knownCategories(DictionarySet dictionaries) {
        Set<String> known = new HashSet<>(CORE_CATEGORIES);
        for (CanonicalField field : dictionaries.fields()) {
            if (field.category() != null) {
                known.add(stripUnderscore(field.category()).toLowerCase(Locale.ROOT));
            }
            String modern = field.modernSpelling();
            if (modern != null && modern.indexOf('.') > 0) {
                known.add(stripUnderscore(modern.substring(0, modern.indexOf('.'))).toLowerCase(Locale.ROOT));
            }
        }
        return Set.copyOf(known);
    }

    private static String stripUnderscore(String text) {
        return text.startsWith("_") ? text.substring(1) : text;
    }

    private static void checkValue(Entry.Field field, CanonicalField definition, ChangeLog.Builder problems) {
        Value value = field.value();
        if (value.isPlaceholder()) {
            return;
        }
        String text = value.text();
        if (definition.valueKind() == ValueKind.INTEGER && !CifNumbers.isInteger(text)) {
            problems.warning("TYPE_MISMATCH", field.name() + " expects an integer, found '" + text + "'", field.line());
        } else if (definition.valueKind() == ValueKind.REAL && !CifNumbers.isNumber(text)) {
            problems.warning("TYPE_MISMATCH", field.name() + " expects a number, found '" + text + "'", field.line());
        }
        if (!definition.enumeratedValues().isEmpty() && !isEnumerated(text, definition.enumeratedValues())) {
            problems.warning(
                    "NOT_ENUMERATED",
                    field.name() + " value '" + text + "' is not one of " + definition.enumeratedValues(),
                    field.line());
        }
    }

    private static boolean isEnumerated(String text, List<String> permitted) {
        for (String candidate : permitted) {
            if (candidate.equalsIgnoreCase(text)) {
                return true;
            }
        }
        return false;
    }
}
