package io.cifxform.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named section of a CIF document: a {@code data_} block, a {@code save_} frame or the
 * {@code global_} block. Blocks are flat; a save frame is its own block and its terminator is the
 * last {@link Entry.Marker} among its entries.
 *
 * <p>
 * Thread-safe and immutable.
 *
 * @param name         the block name without its keyword ({@code global_} has an empty name)
 * @param kind         which header opened the block
 * @param headerExtent the header line
 * @param entries      entries in document order
 * @param extent       header through the last entry
 * @param line         line of the header
 */
public record Block(String name, Kind kind, Span headerExtent, List<Entry> entries, Span extent, int line) {

    /** Block header keywords. */
    public enum Kind {
        DATA("data_"),
        SAVE("save_"),
        GLOBAL("global_");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    public Block {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(headerExtent, "headerExtent must not be null");
        Objects.requireNonNull(extent, "extent must not be null");
        entries = List.copyOf(entries);
    }

    public List<Entry.Field> fields() {
        List<Entry.Field> fields = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry instanceof Entry.Field field) {
                fields.add(field);
            }
        }
        return fields;
    }

    public List<Entry.Loop> loops() {
        List<Entry.Loop> loops = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry instanceof Entry.Loop loop) {
                loops.add(loop);
            }
        }
        return loops;
    }

    /** Returns the first single-valued field with exactly this name. */
    public Optional<Entry.Field> field(String name) {
        for (Entry entry : entries) {
            if (entry instanceof Entry.Field field && field.name().equals(name)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    /** Returns every single-valued field with exactly this name, in document order. */
    public List<Entry.Field> fieldsNamed(String name) {
        List<Entry.Field> matches = new ArrayList<>();
        for (Entry.Field field : fields()) {
            if (field.name().equals(name)) {
                matches.add(field);
            }
        }
        return matches;
    }

    /** Returns the first loop declaring a column with exactly this name. */
    public Optional<Entry.Loop> loopWithColumn(String name) {
        for (Entry.Loop loop : loops()) {
            if (loop.columnIndex(name) >= 0) {
                return Optional.of(loop);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the values recorded for a data name, whether it is a single field or a loop column.
     * Empty when the block does not mention the name.
     */
    public List<Value> valuesOf(String name) {
        Optional<Entry.Field> field = field(name);
        if (field.isPresent()) {
            return List.of(field.get().value());
        }
        return loopWithColumn(name).map(loop -> loop.values(name)).orElse(List.of());
    }

    /** Convenience for the first non-placeholder value of a data name, as text. */
    public Optional<String> text(String name) {
        for (Value value : valuesOf(name)) {
            if (!value.isPlaceholder()) {
                return Optional.of(value.text());
            }
        }
        return Optional.empty();
    }

    /** Every data name in the block: field names and loop columns, in document order. */
    public List<String> dataNames() {
        List<String> names = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry instanceof Entry.Field field) {
                names.add(field.name());
            } else if (entry instanceof Entry.Loop loop) {
                names.addAll(loop.columnNames());
            }
        }
        return names;
    }

    /** The header as written, e.g. {@code data_sample}. */
    public String header() {
        return kind.keyword() + name;
    }
}
