package io.cifxform.core.validate;

import io.cifxform.core.dictionary.CanonicalField;
import io.cifxform.core.dictionary.DictionarySet;
import io.cifxform.core.dictionary.PrefixRegistry;
import io.cifxform.core.model.Block;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Entry;
import io.cifxform.core.model.Notation;
import io.cifxform.core.rules.Rule;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a rule set against the loaded dictionaries before it is applied: names written in the
 * other notation, repeated rules, several spellings of one field, deprecated names and names no
 * dictionary defines. {@link #fix} rewrites rule text to resolve every issue that has an
 * automatic fix.
 *
 * <p>
 * Names carrying a registered local prefix are never reported as unknown. Thread-safe.
 */
public final class RuleSetValidator {

    private static final Logger LOG = LoggerFactory.getLogger(RuleSetValidator.class);

    private static final Pattern LINE = Pattern.compile("([^\\r\\n]*)(\\r\\n|\\r|\\n|$)");
    private static final Pattern DESCRIPTION = Pattern.compile("(\\s*#\\s*)(_\\S+?)(\\s*:.*)");

    /** Share of dotted names above which a document counts as modern. */
    static final double MODERN_THRESHOLD = 0.7;
    /** Share of dotted names below which a document counts as legacy. */
    static final double LEGACY_THRESHOLD = 0.3;

    public enum IssueKind {
        /** A name written in the notation the rule set is not targeting. */
        MIXED_NOTATION,
        /** The same rule written more than once. */
        DUPLICATE_RULE,
        /** Two or more spellings of one field. */
        ALIAS_CONFLICT,
        /** A deprecated name, or a name of a superseded definition. */
        DEPRECATED_FIELD,
        /** A name no dictionary defines. */
        UNKNOWN_FIELD
    }

    public enum FixKind {
        /** {@link #fix} resolves the issue. */
        AUTOMATIC,
        /** Resolved automatically, using a legacy spelling no official dictionary defines. */
        LEGACY_EXTENSION,
        /** Needs a manual decision. */
        NONE
    }

    /**
     * One problem in a rule set.
     *
     * @param fields      the names involved, as written
     * @param lines       rule-file lines involved, ascending
     * @param replacement name the fields should be renamed to, or {@code null}
     */
    public record RuleIssue(
            IssueKind kind, List<String> fields, List<Integer> lines, String description, String replacement,
            FixKind fix) {

        public RuleIssue {
            Objects.requireNonNull(kind, "kind must not be null");
            fields = List.copyOf(fields);
            lines = List.copyOf(lines);
            Objects.requireNonNull(description, "description must not be null");
            Objects.requireNonNull(fix, "fix must not be null");
        }

        public boolean isAutoFixable() {
            return fix != FixKind.NONE;
        }
    }

    /**
     * Result of {@link #validate}.
     *
     * @param fieldCount     name occurrences across all rules
     * @param distinctFields distinct names
     * @param target         notation the rule set was checked against
     */
    public record RuleSetReport(List<RuleIssue> issues, int fieldCount, int distinctFields, Notation target) {

        public RuleSetReport {
            issues = List.copyOf(issues);
            Objects.requireNonNull(target, "target must not be null");
        }

        public List<RuleIssue> issues(IssueKind kind) {
            return issues.stream().filter(issue -> issue.kind() == kind).toList();
        }

        public boolean isClean() {
            return issues.isEmpty();
        }
    }

    /**
     * Rule text after {@link #fix}.
     *
     * @param changes one line per rename or dropped rule, in the order applied
     */
    public record RuleSetFix(String text, List<String> changes) {

        public RuleSetFix {
            Objects.requireNonNull(text, "text must not be null");
            changes = List.copyOf(changes);
        }
    }

    private final DictionarySet dictionaries;
    private final PrefixRegistry registry;

    public RuleSetValidator(DictionarySet dictionaries, PrefixRegistry registry) {
        this.dictionaries = Objects.requireNonNull(dictionaries, "dictionaries must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /** Checks the rules against the notation the document mostly uses. */
    public RuleSetReport validate(List<Rule> rules, Document document) {
        List<String> names = new ArrayList<>();
        for (Block block : document.blocks()) {
            for (Entry entry : block.entries()) {
                if (entry instanceof Entry.Field field) {
                    names.add(field.name());
                } else if (entry instanceof Entry.Loop loop) {
                    loop.columns().forEach(column -> names.add(column.name()));
                }
            }
        }
        return validate(rules, dominantNotation(names));
    }

    public RuleSetReport validate(List<Rule> rules, Notation target) {
        Objects.requireNonNull(target, "target must not be null");
        Map<String, Set<Integer>> occurrences = new LinkedHashMap<>();
        int fieldCount = 0;
        for (Rule rule : rules) {
            for (String name : namesOf(rule)) {
                occurrences.computeIfAbsent(name, key -> new TreeSet<>()).add(rule.line());
                fieldCount++;
            }
        }

        List<RuleIssue> issues = new ArrayList<>(duplicates(rules));
        Map<String, Set<String>> spellingsById = new LinkedHashMap<>();
        for (Map.Entry<String, Set<Integer>> occurrence : occurrences.entrySet()) {
            String name = occurrence.getKey();
            List<Integer> lines = List.copyOf(occurrence.getValue());
            Optional<CanonicalField> resolved = dictionaries.resolveWithCaseFallback(name);
            if (resolved.isEmpty()) {
                unknown(name, lines).ifPresent(issues::add);
                continue;
            }
            CanonicalField field = resolved.get();
            spellingsById.computeIfAbsent(field.canonicalId(), key -> new LinkedHashSet<>()).add(name);
            if (field.isDeprecatedSpelling(name) || field.isDeprecated()) {
                String replacement = dictionaries.preferredSpelling(dictionaries.terminal(field.canonicalId()), target);
                boolean replaceable = !replacement.equals(name) && dictionaries.resolve(replacement)
                        .filter(current -> !current.isDeprecated())
                        .isPresent();
                issues.add(new RuleIssue(
                        IssueKind.DEPRECATED_FIELD,
                        List.of(name),
                        lines,
                        replaceable ? name + " is deprecated; use " + replacement : name + " is deprecated",
                        replaceable ? replacement : null,
                        replaceable ? fixKind(replacement) : FixKind.NONE));
                continue;
            }
            String preferred = dictionaries.preferredSpelling(field.canonicalId(), target);
            if (Notation.of(name) != target && !preferred.equals(name)) {
                issues.add(new RuleIssue(
                        IssueKind.MIXED_NOTATION,
                        List.of(name),
                        lines,
                        name + " is not in " + target.name().toLowerCase(Locale.ROOT) + " notation; use " + preferred,
                        preferred,
                        fixKind(preferred)));
            }
        }
        for (Map.Entry<String, Set<String>> spellings : spellingsById.entrySet()) {
            if (spellings.getValue().size() > 1) {
                String preferred = dictionaries.preferredSpelling(dictionaries.terminal(spellings.getKey()), target);
                Set<Integer> lines = new TreeSet<>();
                spellings.getValue().forEach(name -> lines.addAll(occurrences.get(name)));
                issues.add(new RuleIssue(
                        IssueKind.ALIAS_CONFLICT,
                        List.copyOf(spellings.getValue()),
                        List.copyOf(lines),
                        "Several spellings of " + spellings.getKey() + ": " + spellings.getValue()
                                + "; use " + preferred,
                        preferred,
                        fixKind(preferred)));
            }
        }

        RuleSetReport report = new RuleSetReport(issues, fieldCount, occurrences.size(), target);
        LOG.info(
                "Validated rules: rules={}, fields={}, target={}, issues={}",
                rules.size(),
                occurrences.size(),
                target,
                issues.size());
        return report;
    }

    /**
     * Applies every automatic fix of the report to the rule text it was produced from: renames
     * whole names outside quotes and trailing comments, including {@code # _field:} description
     * headers, and drops repeated rules after their first occurrence. Line breaks are kept as
     * written.
     */
    public RuleSetFix fix(String ruleText, RuleSetReport report) {
        Map<String, String> renames = new LinkedHashMap<>();
        Set<Integer> dropped = new HashSet<>();
        for (RuleIssue issue : report.issues()) {
            if (!issue.isAutoFixable()) {
                continue;
            }
            if (issue.kind() == IssueKind.DUPLICATE_RULE) {
                dropped.addAll(issue.lines().subList(1, issue.lines().size()));
            } else if (issue.replacement() != null) {
                for (String field : issue.fields()) {
                    if (!field.equals(issue.replacement())) {
                        renames.putIfAbsent(field, issue.replacement());
                    }
                }
            }
        }

        List<String> changes = new ArrayList<>();
        Set<String> reported = new HashSet<>();
        StringBuilder out = new StringBuilder(ruleText.length());
        Matcher line = LINE.matcher(ruleText);
        int lineNumber = 0;
        while (line.find()) {
            if (line.group().isEmpty()) {
                break;
            }
            lineNumber++;
            if (dropped.contains(lineNumber)) {
                changes.add("Dropped repeated rule at line " + lineNumber);
                continue;
            }
            out.append(renameLine(line.group(1), renames, changes, reported)).append(line.group(2));
        }
        LOG.info("Fixed rules: renames={}, dropped={}", renames.size(), dropped.size());
        return new RuleSetFix(out.toString(), changes);
    }

    /**
     * Returns the notation most names are written in: modern at or above
     * {@value #MODERN_THRESHOLD} dotted names, legacy at or below {@value #LEGACY_THRESHOLD},
     * and modern for anything between or an empty list.
     */
    public static Notation dominantNotation(Collection<String> names) {
        if (names.isEmpty()) {
            return Notation.MODERN;
        }
        long modern = names.stream().filter(name -> Notation.of(name) == Notation.MODERN).count();
        double ratio = (double) modern / names.size();
        return ratio <= LEGACY_THRESHOLD ? Notation.LEGACY : Notation.MODERN;
    }

    // ── Issues ──

    private static List<RuleIssue> duplicates(List<Rule> rules) {
        Map<String, List<Rule>> bySource = new LinkedHashMap<>();
        for (Rule rule : rules) {
            bySource.computeIfAbsent(rule.toSource(), key -> new ArrayList<>()).add(rule);
        }
        List<RuleIssue> issues = new ArrayList<>();
        for (Map.Entry<String, List<Rule>> entry : bySource.entrySet()) {
            List<Rule> copies = entry.getValue();
            if (copies.size() > 1) {
                issues.add(new RuleIssue(
                        IssueKind.DUPLICATE_RULE,
                        List.of(copies.get(0).field()),
                        copies.stream().map(Rule::line).toList(),
                        "'" + entry.getKey() + "' appears " + copies.size() + " times",
                        null,
                        FixKind.AUTOMATIC));
            }
        }
        return issues;
    }

    private Optional<RuleIssue> unknown(String name, List<Integer> lines) {
        if (registry.isRegistered(PrefixRegistry.prefixOf(name))) {
            return Optional.empty();
        }
        for (String variant : variants(name)) {
            Optional<CanonicalField> match = dictionaries.resolve(variant);
            if (match.isPresent()) {
                String replacement = dictionaries.preferredSpelling(
                        dictionaries.terminal(match.get().canonicalId()), Notation.of(variant));
                return Optional.of(new RuleIssue(
                        IssueKind.UNKNOWN_FIELD,
                        List.of(name),
                        lines,
                        name + " is not defined; did you mean " + replacement + "?",
                        replacement,
                        fixKind(replacement)));
            }
        }
        return Optional.of(new RuleIssue(
                IssueKind.UNKNOWN_FIELD, List.of(name), lines, name + " is not defined", null, FixKind.NONE));
    }

    /** Spelling a mistyped name may have been meant as: dots as underscores, or the first underscore as a dot. */
    private static List<String> variants(String name) {
        List<String> variants = new ArrayList<>();
        if (name.indexOf('.') > 0) {
            variants.add(name.replace('.', '_'));
        } else {
            int underscore = name.indexOf('_', 1);
            if (underscore > 0) {
                variants.add(name.substring(0, underscore) + "." + name.substring(underscore + 1));
            }
        }
        return variants;
    }

    private FixKind fixKind(String replacement) {
        return dictionaries.isLegacyExtension(replacement) ? FixKind.LEGACY_EXTENSION : FixKind.AUTOMATIC;
    }

    private static List<String> namesOf(Rule rule) {
        List<String> names = new ArrayList<>();
        names.add(rule.field());
        if (rule instanceof Rule.Rename rename) {
            names.add(rename.newName());
        } else if (rule instanceof Rule.Calculate calculate) {
            for (String reference : calculate.expression().references()) {
                if (!names.contains(reference)) {
                    names.add(reference);
                }
            }
        }
        return names;
    }

    // ── Text rewriting ──

    private static String renameLine(
            String text, Map<String, String> renames, List<String> changes, Set<String> reported) {
        if (renames.isEmpty()) {
            return text;
        }
        Matcher description = DESCRIPTION.matcher(text);
        if (description.matches()) {
            String replacement = renames.get(description.group(2));
            return replacement == null
                    ? text
                    : description.group(1) + replacement + description.group(3);
        }
        if (text.strip().startsWith("#") || text.strip().startsWith("//")) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        char quote = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            boolean atBoundary = i == 0 || isDelimiter(text.charAt(i - 1));
            if (quote != 0) {
                out.append(c);
                if (c == quote && (i + 1 == text.length() || Character.isWhitespace(text.charAt(i + 1)))) {
                    quote = 0;
                }
                i++;
            } else if ((c == '\'' || c == '"') && atBoundary) {
                quote = c;
                out.append(c);
                i++;
            } else if (c == '#' && i > 0 && Character.isWhitespace(text.charAt(i - 1))) {
                out.append(text, i, text.length());
                break;
            } else if (c == '_' && atBoundary) {
                int end = nameEnd(text, i);
                String name = text.substring(i, end);
                String replacement = renames.get(name);
                if (replacement != null) {
                    out.append(replacement);
                    if (reported.add(name)) {
                        changes.add("Renamed " + name + " to " + replacement);
                    }
                } else {
                    out.append(name);
                }
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static int nameEnd(String text, int start) {
        int end = start + 1;
        while (end < text.length()) {
            char c = text.charAt(end);
            if (c == '-') {
                if (end + 1 < text.length()
                        && Character.isLetter(text.charAt(end + 1))
                        && Character.isLetterOrDigit(text.charAt(end - 1))) {
                    end++;
                    continue;
                }
                break;
            }
            if (isDelimiter(c)) {
                break;
            }
            end++;
        }
        return end;
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || "()+*/=,:-".indexOf(c) >= 0;
    }
}
