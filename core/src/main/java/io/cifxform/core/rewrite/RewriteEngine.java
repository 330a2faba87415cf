package io.cifxform.core.rewrite;

import io.cifxform.core.error.CifParseException;
import io.cifxform.core.error.ConversionException;
import io.cifxform.core.model.Block;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Entry;
import io.cifxform.core.model.ProtectedSpan;
import io.cifxform.core.model.Span;
import io.cifxform.core.parse.CifParser;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The only component that produces new document text. Applies a set of {@link EditOp}s to a
 * {@link Document} by splicing replacements into the source at their recorded spans; every other
 * character is copied unchanged.
 *
 * <p>
 * Targets are checked against the spans the parser recorded, never located by searching text.
 * After splicing, each protected span no op touched is compared against its shifted position in
 * the output.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class RewriteEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RewriteEngine.class);

    private static final Comparator<EditOp> BY_TARGET = Comparator.comparing(EditOp::target);
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final CifParser parser;

    public RewriteEngine() {
        this(new CifParser());
    }

    public RewriteEngine(CifParser parser) {
        this.parser = parser;
    }

    /**
     * Applies the ops and re-parses the result.
     *
     * @throws ConversionException if an op is invalid, ops overlap, a protected span would change,
     *                             or the produced text no longer parses
     */
    public Document apply(Document document, Collection<EditOp> ops) {
        if (ops.isEmpty()) {
            return document;
        }
        String text = render(document, ops);
        try {
            return parser.parse(text, document.sourceName());
        } catch (CifParseException e) {
            throw new ConversionException(
                    "Rewritten document no longer parses: " + e.getMessage(), e, document.sourceName());
        }
    }

    /**
     * Applies the ops and returns the new text.
     *
     * @throws ConversionException if an op is invalid, ops overlap, or a protected span would
     *                             change
     */
    public String render(Document document, Collection<EditOp> ops) {
        String source = document.text();
        if (ops.isEmpty()) {
            return source;
        }
        RecordedSpans recorded = RecordedSpans.of(document);
        List<EditOp> sorted = new ArrayList<>(ops);
        for (EditOp op : sorted) {
            recorded.check(op, document);
        }
        sorted.sort(BY_TARGET);
        for (int i = 1; i < sorted.size(); i++) {
            EditOp previous = sorted.get(i - 1);
            EditOp current = sorted.get(i);
            if (current.target().start() < previous.target().end()) {
                throw new ConversionException(
                        "Overlapping edits: " + previous.kind() + " " + previous.target() + " and " + current.kind()
                                + " " + current.target(),
                        document.sourceName());
            }
        }

        StringBuilder sb = new StringBuilder(source.length());
        int lastEnd = 0;
        for (EditOp op : sorted) {
            sb.append(source, lastEnd, op.target().start());
            sb.append(op.replacement());
            lastEnd = op.target().end();
            LOG.debug("Applied {} at {}", op.kind(), op.target());
        }
        sb.append(source, lastEnd, source.length());
        String output = sb.toString();

        verifyProtectedSpans(document, sorted, output);
        return output;
    }

    private static void verifyProtectedSpans(Document document, List<EditOp> sorted, String output) {
        String source = document.text();
        for (ProtectedSpan protectedSpan : document.protectedSpans()) {
            Span span = protectedSpan.span();
            int shift = 0;
            boolean touched = false;
            for (EditOp op : sorted) {
                Span target = op.target();
                if (!target.isEmpty() && (target.overlaps(span) || target.encloses(span))) {
                    touched = true;
                    break;
                }
                if (target.end() <= span.start()) {
                    shift += op.replacement().length() - target.length();
                }
            }
            if (touched) {
                continue;
            }
            int shifted = span.start() + shift;
            if (shifted < 0
                    || shifted + span.length() > output.length()
                    || !output.regionMatches(shifted, source, span.start(), span.length())) {
                throw new ConversionException(
                        "Protected " + protectedSpan.kind() + " at " + span + " was not preserved by the rewrite",
                        document.sourceName());
            }
        }
    }

    /** Index of every span the parser recorded, per edit kind. */
    private static final class RecordedSpans {

        private final Set<Span> names = new HashSet<>();
        private final Set<Span> values = new HashSet<>();
        private final Set<Span> extents = new HashSet<>();
        private final Set<Integer> boundaries = new HashSet<>();

        static RecordedSpans of(Document document) {
            RecordedSpans recorded = new RecordedSpans();
            recorded.boundaries.add(0);
            if (document.text().startsWith(BYTE_ORDER_MARK)) {
                recorded.boundaries.add(BYTE_ORDER_MARK.length());
            }
            recorded.boundaries.add(document.text().length());
            recorded.addEntries(document.leading());
            for (Block block : document.blocks()) {
                recorded.boundaries.add(block.headerExtent().start());
                recorded.boundaries.add(block.headerExtent().end());
                recorded.addEntries(block.entries());
            }
            return recorded;
        }

        private void addEntries(List<Entry> entries) {
            for (Entry entry : entries) {
                extents.add(entry.extent());
                boundaries.add(entry.extent().start());
                boundaries.add(entry.extent().end());
                if (entry instanceof Entry.Field field) {
                    names.add(field.nameSpan());
                    values.add(field.valueSpan());
                } else if (entry instanceof Entry.Loop loop) {
                    for (Entry.LoopColumn column : loop.columns()) {
                        names.add(column.nameSpan());
                    }
                }
            }
        }

        void check(EditOp op, Document document) {
            Span target = op.target();
            boolean recorded = switch (op.kind()) {
                case RENAME -> names.contains(target);
                case REPLACE_VALUE -> values.contains(target);
                case DELETE_ENTRY, REPLACE_ENTRY -> extents.contains(target);
                case INSERT -> boundaries.contains(target.start());
            };
            if (!recorded) {
                throw new ConversionException(
                        op.kind() + " target " + target + " is not a span recorded by the parser",
                        document.sourceName());
            }
            if (op.kind() == EditOp.Kind.RENAME && !isDataName(op.replacement())) {
                throw new ConversionException(
                        "Invalid data name '" + op.replacement() + "' in RENAME", document.sourceName());
            }
        }

        private static boolean isDataName(String name) {
            if (name.length() < 2 || name.charAt(0) != '_') {
                return false;
            }
            for (int i = 0; i < name.length(); i++) {
                if (Character.isWhitespace(name.charAt(i))) {
                    return false;
                }
            }
            return true;
        }
    }
}
