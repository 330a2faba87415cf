package io.cifxform.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One item in a {@link Block}, or in the preamble of a {@link Document}.
 *
 * <p>
 * The extents of all entries tile the document: each extent starts where the previous one ended
 * and, when the entry is the last thing on its line, runs through the line terminator. Deleting an
 * entry therefore means deleting its extent.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Entry {

    /** The characters this entry owns, including leading indentation and trailing comment. */
    Span extent();

    /** 1-based line on which the entry's first token starts. */
    int line();

    /**
     * A single-valued data item.
     *
     * @param name      the data name as written
     * @param nameSpan  where the name token sits
     * @param value     the parsed value
     * @param valueSpan where the value sits, delimiters included
     * @param extent    the whole entry
     * @param line      line of the name token
     */
    record Field(String name, Span nameSpan, Value value, Span valueSpan, Span extent, int line) implements Entry {
        public Field {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(nameSpan, "nameSpan must not be null");
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(valueSpan, "valueSpan must not be null");
            Objects.requireNonNull(extent, "extent must not be null");
        }

        public Notation notation() {
            return Notation.of(name);
        }
    }

    /**
     * A declared loop column.
     *
     * @param name     the data name as written
     * @param nameSpan where the name token sits
     */
    record LoopColumn(String name, Span nameSpan) {
        public LoopColumn {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(nameSpan, "nameSpan must not be null");
        }
    }

    /**
     * A {@code loop_} table. Every row holds exactly one value per column; the parser rejects input
     * that does not.
     *
     * @param keywordSpan where the {@code loop_} keyword sits
     * @param columns     declared columns, unique by name
     * @param rows        data rows
     * @param extent      the whole loop
     * @param line        line of the {@code loop_} keyword
     */
    record Loop(Span keywordSpan, List<LoopColumn> columns, List<List<Value>> rows, Span extent, int line)
            implements Entry {
        public Loop {
            Objects.requireNonNull(keywordSpan, "keywordSpan must not be null");
            Objects.requireNonNull(extent, "extent must not be null");
            columns = List.copyOf(columns);
            if (columns.isEmpty()) {
                throw new IllegalArgumentException("A loop needs at least one column");
            }
            Set<String> seen = new HashSet<>();
            for (LoopColumn column : columns) {
                if (!seen.add(column.name())) {
                    throw new IllegalArgumentException("Duplicate loop column: " + column.name());
                }
            }
            List<List<Value>> copied = new ArrayList<>(rows.size());
            for (List<Value> row : rows) {
                if (row.size() != columns.size()) {
                    throw new IllegalArgumentException(
                            "Row has " + row.size() + " values for " + columns.size() + " columns");
                }
                copied.add(List.copyOf(row));
            }
            rows = Collections.unmodifiableList(copied);
        }

        public List<String> columnNames() {
            List<String> names = new ArrayList<>(columns.size());
            for (LoopColumn column : columns) {
                names.add(column.name());
            }
            return names;
        }

        /** Returns the column's position, or -1 if the loop has no such column. */
        public int columnIndex(String name) {
            for (int i = 0; i < columns.size(); i++) {
                if (columns.get(i).name().equals(name)) {
                    return i;
                }
            }
            return -1;
        }

        public Optional<LoopColumn> column(String name) {
            int index = columnIndex(name);
            return index < 0 ? Optional.empty() : Optional.of(columns.get(index));
        }

        /** Returns the values of one column, top to bottom. */
        public List<Value> values(String name) {
            int index = columnIndex(name);
            if (index < 0) {
                return List.of();
            }
            List<Value> values = new ArrayList<>(rows.size());
            for (List<Value> row : rows) {
                values.add(row.get(index));
            }
            return values;
        }
    }

    /**
     * A comment line. {@code text} starts with {@code #} and excludes the line terminator.
     *
     * @param text   the comment as written
     * @param extent the whole entry
     * @param line   line of the comment
     */
    record Comment(String text, Span extent, int line) implements Entry {
        public Comment {
            Objects.requireNonNull(text, "text must not be null");
            Objects.requireNonNull(extent, "extent must not be null");
        }

        /** Returns {@code true} for a {@code #\#CIF_x.y} version marker. */
        public boolean isVersionMarker() {
            return text.startsWith("#\\#CIF_");
        }

        /** The version declared by a marker, e.g. {@code 2.0}, or {@code null} for ordinary comments. */
        public String declaredVersion() {
            if (!isVersionMarker()) {
                return null;
            }
            String rest = text.substring("#\\#CIF_".length());
            int space = 0;
            while (space < rest.length() && !Character.isWhitespace(rest.charAt(space))) {
                space++;
            }
            return rest.substring(0, space);
        }
    }

    /**
     * A line holding nothing but whitespace.
     *
     * @param extent the line, terminator included
     * @param line   its line number
     */
    record BlankLine(Span extent, int line) implements Entry {
        public BlankLine {
            Objects.requireNonNull(extent, "extent must not be null");
        }
    }

    /**
     * A structural keyword that is not a block header: the {@code save_} frame terminator or
     * {@code stop_}.
     *
     * @param kind   which keyword
     * @param extent the whole entry
     * @param line   line of the keyword
     */
    record Marker(Kind kind, Span extent, int line) implements Entry {

        /** Marker keywords. */
        public enum Kind {
            SAVE_END,
            STOP
        }

        public Marker {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(extent, "extent must not be null");
        }
    }
}
