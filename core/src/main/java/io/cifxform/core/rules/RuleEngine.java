package io.cifxform.core.rules;

import io.cifxform.core.error.ConversionException;
import io.cifxform.core.error.RuleEvaluationException;
import io.cifxform.core.model.Block;
import io.cifxform.core.model.ChangeEntry;
import io.cifxform.core.model.ChangeLog;
import io.cifxform.core.model.CifNumbers;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Entry;
import io.cifxform.core.model.Span;
import io.cifxform.core.model.Value;
import io.cifxform.core.rewrite.EditOp;
import io.cifxform.core.rewrite.RewriteEngine;
import io.cifxform.core.rewrite.ValueFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies an ordered list of {@link Rule}s to one block of a document.
 *
 * <p>
 * Rules run one after another against the evolving document: every rule turns into edit ops for
 * the {@link RewriteEngine}, and the next rule sees the re-parsed result. The first
 * {@link RuleEvaluationException} aborts the run; the result then holds the document as it was
 * before the failing rule.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class RuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEngine.class);

    private final RewriteEngine rewriteEngine;
    private final ValueFormatter formatter;

    public RuleEngine() {
        this(new RewriteEngine(), new ValueFormatter());
    }

    public RuleEngine(RewriteEngine rewriteEngine, ValueFormatter formatter) {
        this.rewriteEngine = Objects.requireNonNull(rewriteEngine, "rewriteEngine must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
    }

    /**
     * Applies the rules to the first {@code data_} block.
     *
     * @throws IllegalArgumentException if the document has no data block
     */
    public RuleRunResult apply(Document document, List<Rule> rules) {
        if (document.firstDataBlock().isEmpty()) {
            throw new IllegalArgumentException("Document " + document.sourceName() + " has no data block");
        }
        return run(document, rules, doc -> doc.firstDataBlock().orElseThrow());
    }

    /**
     * Applies the rules to the first block with the given name.
     *
     * @throws IllegalArgumentException if there is no such block
     */
    public RuleRunResult apply(Document document, String blockName, List<Rule> rules) {
        if (document.block(blockName).isEmpty()) {
            throw new IllegalArgumentException("Document " + document.sourceName() + " has no block " + blockName);
        }
        return run(document, rules, doc -> doc.block(blockName).orElseThrow());
    }

    private RuleRunResult run(Document document, List<Rule> rules, Function<Document, Block> target) {
        Document current = document;
        List<RuleOutcome> outcomes = new ArrayList<>();
        ChangeLog.Builder log = ChangeLog.builder();
        RuleEvaluationException failure = null;

        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            Step step = null;
            try {
                step = execute(i, rule, current, target.apply(current));
                current = rewriteEngine.apply(current, step.ops());
            } catch (RuleEvaluationException e) {
                failure = tag(e, i, rule);
            } catch (ConversionException e) {
                failure = new RuleEvaluationException(e.getMessage(), rule.field(), rule.toSource(), i);
                failure.initCause(e);
            }
            if (failure != null) {
                outcomes.add(new RuleOutcome(i, rule, RuleOutcome.Status.FAILED, failure.getMessage(), null));
                log.error(
                        "RULE_FAILED",
                        "Rule " + (i + 1) + " (" + rule.toSource() + "): " + failure.getMessage(),
                        lineOf(rule));
                LOG.warn("Rule run aborted at rule {}: field={}, reason={}", i, rule.field(), failure.getMessage());
                break;
            }
            outcomes.add(step.outcome());
            log.add(step.entry());
        }

        LOG.info(
                "Applied rules: source={}, rules={}, ran={}, aborted={}",
                document.sourceName(),
                rules.size(),
                outcomes.size(),
                failure != null);
        return new RuleRunResult(current, log.build(), outcomes, failure);
    }

    private Step execute(int index, Rule rule, Document document, Block block) {
        if (rule instanceof Rule.Check check) {
            return check(index, check, block);
        } else if (rule instanceof Rule.Delete delete) {
            return delete(index, delete, document, block);
        } else if (rule instanceof Rule.Edit edit) {
            return edit(index, edit, document, block);
        } else if (rule instanceof Rule.Rename rename) {
            return rename(index, rename, block);
        } else if (rule instanceof Rule.Calculate calculate) {
            return calculate(index, calculate, document, block);
        } else if (rule instanceof Rule.Append append) {
            return append(index, append, document, block);
        }
        throw new IllegalStateException("Unhandled rule type: " + rule.getClass().getName());
    }

    // ── CHECK ──

    private Step check(int index, Rule.Check rule, Block block) {
        Optional<Entry.Field> field = block.field(rule.field());
        if (field.isPresent()) {
            String value = field.get().value().text();
            boolean matches = value.equals(rule.expectedDefault());
            RuleOutcome.Status status =
                    matches ? RuleOutcome.Status.MATCHES_DEFAULT : RuleOutcome.Status.DIFFERS_FROM_DEFAULT;
            String detail = matches
                    ? rule.field() + " has the default value " + value
                    : rule.field() + " is " + value + ", default is " + rule.expectedDefault();
            return noChange(index, rule, status, detail, value, ChangeEntry.Severity.INFO, "CHECK_" + status);
        }
        if (block.loopWithColumn(rule.field()).isPresent()) {
            return noChange(
                    index,
                    rule,
                    RuleOutcome.Status.IN_LOOP,
                    rule.field() + " is a loop column",
                    null,
                    ChangeEntry.Severity.INFO,
                    "CHECK_IN_LOOP");
        }
        return noChange(
                index,
                rule,
                RuleOutcome.Status.MISSING,
                rule.field() + " is missing" + (rule.description() != null ? ": " + rule.description() : ""),
                null,
                ChangeEntry.Severity.WARNING,
                "CHECK_MISSING");
    }

    // ── DELETE ──

    private Step delete(int index, Rule.Delete rule, Document document, Block block) {
        List<EditOp> ops = new ArrayList<>();
        for (Entry.Field field : block.fieldsNamed(rule.field())) {
            ops.add(EditOp.deleteEntry(field.extent()));
        }
        Optional<Entry.Loop> loop = block.loopWithColumn(rule.field());
        if (loop.isPresent()) {
            ops.add(deleteColumn(document, loop.get(), rule.field()));
        }
        if (ops.isEmpty()) {
            return skipped(index, rule, rule.field() + " is not present");
        }
        return changed(index, rule, ops, RuleOutcome.Status.APPLIED, "Deleted " + rule.field(), null, "DELETED");
    }

    private EditOp deleteColumn(Document document, Entry.Loop loop, String column) {
        if (loop.columns().size() == 1) {
            return EditOp.deleteEntry(loop.extent());
        }
        int drop = loop.columnIndex(column);
        List<String> columns = new ArrayList<>(loop.columnNames());
        columns.remove(drop);
        List<List<Value>> rows = new ArrayList<>();
        for (List<Value> row : loop.rows()) {
            List<Value> kept = new ArrayList<>(row);
            kept.remove(drop);
            rows.add(kept);
        }
        ValueFormatter layout = formatter(document);
        String rendered = layout.loop(columns, rows);
        if (!endsWithLineBreak(document.slice(loop.extent()))) {
            rendered = rendered.substring(0, rendered.length() - layout.lineTerminator().length());
        }
        return EditOp.replaceEntry(loop.extent(), rendered);
    }

    // ── EDIT ──

    private Step edit(int index, Rule.Edit rule, Document document, Block block) {
        Optional<Entry.Field> field = block.field(rule.field());
        if (field.isEmpty()) {
            String why = block.loopWithColumn(rule.field()).isPresent()
                    ? rule.field() + " is a loop column; EDIT applies to single-valued fields"
                    : rule.field() + " is not present";
            return skipped(index, rule, why);
        }
        String rendered = render(rule.field(), () -> formatter(document).formatLike(rule.value(), field.get().value()));
        return changed(
                index,
                rule,
                List.of(replaceValue(document, field.get(), rendered)),
                RuleOutcome.Status.APPLIED,
                "Set " + rule.field(),
                rule.value(),
                "EDITED");
    }

    // ── RENAME ──

    private Step rename(int index, Rule.Rename rule, Block block) {
        List<EditOp> ops = new ArrayList<>();
        for (Entry.Field field : block.fieldsNamed(rule.field())) {
            ops.add(EditOp.rename(field.nameSpan(), rule.newName()));
        }
        Optional<Entry.Loop> loop = block.loopWithColumn(rule.field());
        if (loop.isPresent()) {
            if (loop.get().columnIndex(rule.newName()) >= 0) {
                throw new RuleEvaluationException(
                        "Loop already has a column named " + rule.newName(), rule.field());
            }
            ops.add(EditOp.rename(loop.get().column(rule.field()).orElseThrow().nameSpan(), rule.newName()));
        }
        if (ops.isEmpty()) {
            return skipped(index, rule, rule.field() + " is not present");
        }
        return changed(
                index,
                rule,
                ops,
                RuleOutcome.Status.APPLIED,
                "Renamed " + rule.field() + " to " + rule.newName(),
                null,
                "RENAMED");
    }

    // ── CALCULATE ──

    private Step calculate(int index, Rule.Calculate rule, Document document, Block block) {
        if (block.field(rule.field()).isEmpty() && block.loopWithColumn(rule.field()).isPresent()) {
            throw new RuleEvaluationException("Cannot CALCULATE loop column " + rule.field(), rule.field());
        }
        double result = rule.expression().evaluate(name -> numericValue(block, name));
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new RuleEvaluationException("Result of " + rule.expressionText() + " is not finite", rule.field());
        }
        String formatted = CifNumbers.format(result);
        Optional<Entry.Field> field = block.field(rule.field());
        if (field.isPresent()) {
            String rendered = render(rule.field(), () -> formatter(document).formatLike(formatted, field.get().value()));
            return changed(
                    index,
                    rule,
                    List.of(replaceValue(document, field.get(), rendered)),
                    RuleOutcome.Status.APPLIED,
                    rule.field() + " = " + formatted,
                    formatted,
                    "CALCULATED");
        }
        return changed(
                index,
                rule,
                List.of(insertField(document, block, rule.field(), formatter(document).format(formatted))),
                RuleOutcome.Status.CREATED,
                "Created " + rule.field() + " = " + formatted,
                formatted,
                "CREATED");
    }

    private static double numericValue(Block block, String name) {
        Optional<Entry.Field> field = block.field(name);
        if (field.isEmpty()) {
            String why = block.loopWithColumn(name).isPresent() ? " is a loop column" : " is missing";
            throw new RuleEvaluationException("Referenced field " + name + why, name);
        }
        Value value = field.get().value();
        OptionalDouble number = value.isPlaceholder() ? OptionalDouble.empty() : CifNumbers.parse(value.text());
        if (number.isEmpty()) {
            throw new RuleEvaluationException(
                    "Referenced field " + name + " is not numeric: '" + value.text() + "'", name);
        }
        return number.getAsDouble();
    }

    // ── APPEND ──

    private Step append(int index, Rule.Append rule, Document document, Block block) {
        Optional<Entry.Field> field = block.field(rule.field());
        if (field.isEmpty()) {
            if (block.loopWithColumn(rule.field()).isPresent()) {
                throw new RuleEvaluationException("Cannot APPEND to loop column " + rule.field(), rule.field());
            }
            String rendered = render(rule.field(), () -> formatter(document).formatTextBlock(rule.text()));
            return changed(
                    index,
                    rule,
                    List.of(insertField(document, block, rule.field(), rendered)),
                    RuleOutcome.Status.CREATED,
                    "Created " + rule.field() + " as a text block",
                    rule.text(),
                    "CREATED");
        }
        Value existing = field.get().value();
        String combined = existing.isPlaceholder() ? rule.text() : existing.text() + "\n" + rule.text();
        String rendered = render(rule.field(), () -> formatter(document).formatTextBlock(combined));
        return changed(
                index,
                rule,
                List.of(replaceValue(document, field.get(), rendered)),
                RuleOutcome.Status.APPLIED,
                "Appended to " + rule.field(),
                combined,
                "APPENDED");
    }

    // ── Ops ──

    /**
     * Replaces a field's value. When an inline value becomes a text block the block must start at
     * column 0, so the whole entry is rewritten if it holds nothing but this field; otherwise the
     * block goes on lines of its own after the name.
     */
    private EditOp replaceValue(Document document, Entry.Field field, String rendered) {
        boolean textBlock = rendered.startsWith(";");
        if (!textBlock || field.value() instanceof Value.TextBlock) {
            return EditOp.replaceValue(field.valueSpan(), rendered);
        }
        Span extent = field.extent();
        String before = document.text().substring(extent.start(), field.nameSpan().start());
        String after = document.text().substring(field.valueSpan().end(), extent.end());
        ValueFormatter layout = formatter(document);
        String eol = layout.lineTerminator();
        if (before.isBlank() && after.isBlank()) {
            String line = layout.fieldLine(field.name(), rendered);
            if (!endsWithLineBreak(after)) {
                line = line.substring(0, line.length() - eol.length());
            }
            return EditOp.replaceEntry(extent, before + line);
        }
        return EditOp.replaceValue(field.valueSpan(), eol + rendered + eol);
    }

    /** Inserts a new field after the last content entry of the block. */
    private EditOp insertField(Document document, Block block, String name, String rendered) {
        int offset = block.headerExtent().end();
        for (Entry entry : block.entries()) {
            if (!(entry instanceof Entry.BlankLine) && !(entry instanceof Entry.Marker)) {
                offset = entry.extent().end();
            }
        }
        ValueFormatter layout = formatter(document);
        String line = layout.fieldLine(name, rendered);
        if (offset > 0 && document.text().charAt(offset - 1) != '\n' && document.text().charAt(offset - 1) != '\r') {
            line = layout.lineTerminator() + line;
        }
        return EditOp.insert(offset, line);
    }

    /** The configured formatter, breaking lines the way the document does. */
    private ValueFormatter formatter(Document document) {
        return formatter.withLineTerminator(document.lineTerminator());
    }

    private static String render(String field, Supplier<String> formatting) {
        try {
            return formatting.get();
        } catch (IllegalArgumentException e) {
            throw new RuleEvaluationException(e.getMessage(), field);
        }
    }

    private static boolean endsWithLineBreak(String text) {
        return text.endsWith("\n") || text.endsWith("\r");
    }

    // ── Outcomes ──

    private static RuleEvaluationException tag(RuleEvaluationException e, int index, Rule rule) {
        if (e.field() != null) {
            return e.atRule(index, rule.toSource());
        }
        RuleEvaluationException tagged =
                new RuleEvaluationException(e.getMessage(), rule.field(), rule.toSource(), index);
        tagged.setStackTrace(e.getStackTrace());
        return tagged;
    }

    private static Integer lineOf(Rule rule) {
        return rule.line() > 0 ? rule.line() : null;
    }

    private static Step noChange(
            int index,
            Rule rule,
            RuleOutcome.Status status,
            String detail,
            String value,
            ChangeEntry.Severity severity,
            String code) {
        return new Step(
                List.of(),
                new RuleOutcome(index, rule, status, detail, value),
                new ChangeEntry(severity, code, detail, lineOf(rule)));
    }

    private static Step skipped(int index, Rule rule, String detail) {
        return noChange(index, rule, RuleOutcome.Status.SKIPPED, detail, null, ChangeEntry.Severity.INFO, "SKIPPED");
    }

    private static Step changed(
            int index,
            Rule rule,
            List<EditOp> ops,
            RuleOutcome.Status status,
            String detail,
            String value,
            String code) {
        LOG.debug("Rule {} ({}): {}", index, rule.toSource(), detail);
        return new Step(
                ops,
                new RuleOutcome(index, rule, status, detail, value),
                new ChangeEntry(ChangeEntry.Severity.INFO, code, detail, lineOf(rule)));
    }

    private record Step(List<EditOp> ops, RuleOutcome outcome, ChangeEntry entry) {}
}
