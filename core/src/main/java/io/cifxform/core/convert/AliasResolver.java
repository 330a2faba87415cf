package io.cifxform.core.convert;

import io.cifxform.core.dictionary.CanonicalField;
import io.cifxform.core.dictionary.DictionarySet;
import io.cifxform.core.model.Block;
import io.cifxform.core.model.ChangeLog;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Entry;
import io.cifxform.core.model.Notation;
import io.cifxform.core.rewrite.EditOp;
import io.cifxform.core.rewrite.RewriteEngine;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes duplicate spellings of the same field within a block.
 *
 * <p>
 * Single-valued fields are grouped by canonical id; names the dictionaries cannot resolve are
 * grouped by exact spelling. In every group with more than one occurrence one survives and the
 * others are deleted with their whole extent. The survivor is chosen by, in order:
 * <ol>
 * <li>the only value that is neither a placeholder nor the declared default;</li>
 * <li>the only candidate spelled in the block's dominant notation;</li>
 * <li>the first candidate in document order.</li>
 * </ol>
 * A resolved survivor is renamed to the preferred spelling for the dominant notation.
 */
public final class AliasResolver {

    private static final Logger LOG = LoggerFactory.getLogger(AliasResolver.class);

    private final DictionarySet dictionaries;
    private final RewriteEngine rewriteEngine;
    private final NotationDetector notationDetector;
    private final boolean caseFallback;

    public AliasResolver(DictionarySet dictionaries) {
        this(dictionaries, new RewriteEngine(), true);
    }

    public AliasResolver(DictionarySet dictionaries, RewriteEngine rewriteEngine, boolean caseFallback) {
        this.dictionaries = Objects.requireNonNull(dictionaries, "dictionaries must not be null");
        this.rewriteEngine = Objects.requireNonNull(rewriteEngine, "rewriteEngine must not be null");
        this.notationDetector = new NotationDetector();
        this.caseFallback = caseFallback;
    }

    public AliasOutcome resolveAliases(Document document) {
        List<EditOp> ops = new ArrayList<>();
        List<AliasResolution> resolutions = new ArrayList<>();
        ChangeLog.Builder log = ChangeLog.builder();

        for (Block block : document.blocks()) {
            Notation dominant = notationDetector.dominantNotation(block);
            for (Group group : groups(block).values()) {
                if (group.fields.size() < 2) {
                    continue;
                }
                resolutions.add(settle(block, group, dominant, ops, log));
            }
        }

        Document resolved = rewriteEngine.apply(document, ops);
        LOG.info("Resolved aliases: source={}, conflicts={}", document.sourceName(), resolutions.size());
        return new AliasOutcome(resolved, log.build(), resolutions);
    }

    private Map<String, Group> groups(Block block) {
        Map<String, Group> groups = new LinkedHashMap<>();
        for (Entry.Field field : block.fields()) {
            Optional<CanonicalField> canonical = caseFallback
                    ? dictionaries.resolveWithCaseFallback(field.name())
                    : dictionaries.resolve(field.name());
            String key = canonical.map(c -> "id:" + c.canonicalId()).orElse("name:" + field.name());
            groups.computeIfAbsent(key, k -> new Group(canonical.orElse(null))).fields.add(field);
        }
        return groups;
    }

    private AliasResolution settle(
            Block block, Group group, Notation dominant, List<EditOp> ops, ChangeLog.Builder log) {
        List<Entry.Field> candidates = group.fields;
        AliasResolution.TieBreak tieBreak = AliasResolution.TieBreak.FIRST_OCCURRENCE;

        List<Entry.Field> nonDefault = new ArrayList<>();
        for (Entry.Field field : candidates) {
            if (!isDefault(field, group.canonical)) {
                nonDefault.add(field);
            }
        }
        Entry.Field kept = null;
        if (nonDefault.size() == 1) {
            kept = nonDefault.get(0);
            tieBreak = AliasResolution.TieBreak.NON_DEFAULT_VALUE;
        } else {
            if (nonDefault.size() > 1) {
                candidates = nonDefault;
            }
            List<Entry.Field> dominantSpelled = new ArrayList<>();
            for (Entry.Field field : candidates) {
                if (field.notation() == dominant) {
                    dominantSpelled.add(field);
                }
            }
            if (dominantSpelled.size() == 1) {
                kept = dominantSpelled.get(0);
                tieBreak = AliasResolution.TieBreak.DOMINANT_NOTATION;
            } else if (!dominantSpelled.isEmpty()) {
                candidates = dominantSpelled;
            }
        }
        if (kept == null) {
            kept = candidates.get(0);
        }

        List<String> discarded = new ArrayList<>();
        for (Entry.Field field : group.fields) {
            if (field != kept) {
                ops.add(EditOp.deleteEntry(field.extent()));
                discarded.add(field.name());
            }
        }
        String normalized = kept.name();
        String canonicalId = kept.name();
        if (group.canonical != null) {
            canonicalId = group.canonical.canonicalId();
            normalized = dictionaries.preferredSpelling(canonicalId, dominant);
            if (!normalized.equals(kept.name())) {
                ops.add(EditOp.rename(kept.nameSpan(), normalized));
            }
        }
        log.info(
                "ALIAS_RESOLVED",
                "Kept " + kept.name() + (normalized.equals(kept.name()) ? "" : " as " + normalized) + ", removed "
                        + String.join(", ", discarded) + " (" + tieBreak + ")",
                kept.line());
        LOG.debug("Block {}: kept {} over {} by {}", block.name(), kept.name(), discarded, tieBreak);
        return new AliasResolution(block.name(), canonicalId, kept.name(), normalized, discarded, tieBreak);
    }

    private static boolean isDefault(Entry.Field field, CanonicalField canonical) {
        if (field.value().isPlaceholder()) {
            return true;
        }
        return canonical != null
                && canonical.defaultValue() != null
                && canonical.defaultValue().equals(field.value().text());
    }

    private static final class Group {

        private final CanonicalField canonical;
        private final List<Entry.Field> fields = new ArrayList<>();

        Group(CanonicalField canonical) {
            this.canonical = canonical;
        }
    }
}
