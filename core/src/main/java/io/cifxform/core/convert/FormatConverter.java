package io.cifxform.core.convert;

import io.cifxform.core.dictionary.CanonicalField;
import io.cifxform.core.dictionary.DictionarySet;
import io.cifxform.core.error.ConversionException;
import io.cifxform.core.model.Block;
import io.cifxform.core.model.ChangeLog;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Entry;
import io.cifxform.core.model.Notation;
import io.cifxform.core.model.Span;
import io.cifxform.core.model.TransformOutcome;
import io.cifxform.core.rewrite.EditOp;
import io.cifxform.core.rewrite.RewriteEngine;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retargets every data name of a document to one notation.
 *
 * <p>
 * Each field and loop column is resolved through the dictionary set, followed along its
 * deprecation chain to the field in current use, and renamed at its recorded name span when the
 * preferred spelling differs. Names the dictionaries do not know are left alone and reported as
 * {@code NO_MAPPING} warnings. Values, loop rows, comments and text blocks are never edited.
 *
 * <p>
 * Thread-safe if the dictionary set is (it is immutable).
 */
public final class FormatConverter {

    private static final Logger LOG = LoggerFactory.getLogger(FormatConverter.class);

    static final String MODERN_MARKER = "#\\#CIF_2.0";
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final DictionarySet dictionaries;
    private final RewriteEngine rewriteEngine;
    private final boolean caseFallback;

    public FormatConverter(DictionarySet dictionaries) {
        this(dictionaries, new RewriteEngine(), true);
    }

    public FormatConverter(DictionarySet dictionaries, RewriteEngine rewriteEngine, boolean caseFallback) {
        this.dictionaries = Objects.requireNonNull(dictionaries, "dictionaries must not be null");
        this.rewriteEngine = Objects.requireNonNull(rewriteEngine, "rewriteEngine must not be null");
        this.caseFallback = caseFallback;
    }

    /**
     * Converts the document to the target notation.
     *
     * @throws ConversionException if two columns of one loop would end up with the same name, or
     *                             the rewrite fails; the input document is unaffected
     */
    public TransformOutcome convert(Document document, Notation target) {
        List<EditOp> ops = new ArrayList<>();
        ChangeLog.Builder log = ChangeLog.builder();
        Set<String> unmapped = new LinkedHashSet<>();

        for (Block block : document.blocks()) {
            for (Entry entry : block.entries()) {
                if (entry instanceof Entry.Field field) {
                    retarget(field.name(), field.nameSpan(), field.line(), target, ops, log, unmapped);
                } else if (entry instanceof Entry.Loop loop) {
                    retargetLoop(document, loop, target, ops, log, unmapped);
                }
            }
        }
        versionMarker(document, target, ops, log);

        Document converted = rewriteEngine.apply(document, ops);
        long renamed = ops.stream().filter(op -> op.kind() == EditOp.Kind.RENAME).count();
        if (!unmapped.isEmpty()) {
            LOG.warn("No dictionary mapping for {} data name(s): {}", unmapped.size(), unmapped);
        }
        LOG.info(
                "Converted document: source={}, target={}, renamed={}, unmapped={}",
                document.sourceName(),
                target,
                renamed,
                unmapped.size());
        return new TransformOutcome(converted, log.build());
    }

    private void retargetLoop(
            Document document,
            Entry.Loop loop,
            Notation target,
            List<EditOp> ops,
            ChangeLog.Builder log,
            Set<String> unmapped) {
        Set<String> newNames = new LinkedHashSet<>();
        for (Entry.LoopColumn column : loop.columns()) {
            String newName = retarget(column.name(), column.nameSpan(), loop.line(), target, ops, log, unmapped);
            if (!newNames.add(newName)) {
                throw new ConversionException(
                        "Converting loop at line " + loop.line() + " would produce duplicate column " + newName,
                        document.sourceName());
            }
        }
    }

    /** Adds a rename when needed and returns the name the data item will carry. */
    private String retarget(
            String name,
            Span nameSpan,
            int line,
            Notation target,
            List<EditOp> ops,
            ChangeLog.Builder log,
            Set<String> unmapped) {
        Optional<CanonicalField> resolved =
                caseFallback ? dictionaries.resolveWithCaseFallback(name) : dictionaries.resolve(name);
        if (resolved.isEmpty()) {
            unmapped.add(name);
            log.warning("NO_MAPPING", "No dictionary mapping for " + name + "; left unchanged", line);
            return name;
        }
        String terminal = dictionaries.terminal(resolved.get().canonicalId());
        String preferred = dictionaries.preferredSpelling(terminal, target);
        if (preferred.equals(name)) {
            return name;
        }
        ops.add(EditOp.rename(nameSpan, preferred));
        log.info("RENAMED", name + " -> " + preferred, line);
        if (dictionaries.isLegacyExtension(preferred)) {
            log.info("LEGACY_EXTENSION", preferred + " is a legacy spelling no dictionary defines", line);
        }
        LOG.debug("Rename {} -> {} at line {}", name, preferred, line);
        return preferred;
    }

    private static void versionMarker(Document document, Notation target, List<EditOp> ops, ChangeLog.Builder log) {
        Optional<Entry.Comment> marker = document.versionMarker();
        if (target == Notation.MODERN) {
            if (marker.isEmpty()) {
                int offset = document.text().startsWith(BYTE_ORDER_MARK) ? BYTE_ORDER_MARK.length() : 0;
                ops.add(EditOp.insert(offset, MODERN_MARKER + document.lineTerminator()));
                log.info("VERSION_MARKER_ADDED", "Added " + MODERN_MARKER + " version marker", 1);
            } else if (!"2.0".equals(marker.get().declaredVersion())) {
                Entry.Comment comment = marker.get();
                String replaced = document.slice(comment.extent()).replace(comment.text(), MODERN_MARKER);
                ops.add(EditOp.replaceEntry(comment.extent(), replaced));
                log.info(
                        "VERSION_MARKER_REPLACED",
                        "Replaced " + comment.text() + " with " + MODERN_MARKER,
                        comment.line());
            }
        } else if (marker.isPresent() && "2.0".equals(marker.get().declaredVersion())) {
            Span extent = marker.get().extent();
            if (extent.start() == 0 && document.text().startsWith(BYTE_ORDER_MARK)) {
                ops.add(EditOp.replaceEntry(extent, BYTE_ORDER_MARK));
            } else {
                ops.add(EditOp.deleteEntry(extent));
            }
            log.info("VERSION_MARKER_REMOVED", "Removed " + MODERN_MARKER + " version marker", marker.get().line());
        }
    }
}
