package io.cifxform.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, immutable list of diagnostics returned next to every transformation result. Nothing a
 * transformation warns about is dropped; it ends up here.
 */
public final class ChangeLog {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ChangeLog EMPTY = new ChangeLog(List.of());

    private final List<ChangeEntry> entries;

    private ChangeLog(List<ChangeEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static ChangeLog empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ChangeEntry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /** Entries at exactly the given severity. */
    public List<ChangeEntry> entries(ChangeEntry.Severity severity) {
        List<ChangeEntry> matches = new ArrayList<>();
        for (ChangeEntry entry : entries) {
            if (entry.severity() == severity) {
                matches.add(entry);
            }
        }
        return matches;
    }

    /** Entries with the given code. */
    public List<ChangeEntry> withCode(String code) {
        List<ChangeEntry> matches = new ArrayList<>();
        for (ChangeEntry entry : entries) {
            if (entry.code().equals(code)) {
                matches.add(entry);
            }
        }
        return matches;
    }

    public List<ChangeEntry> warnings() {
        return entries(ChangeEntry.Severity.WARNING);
    }

    public boolean hasErrors() {
        return !entries(ChangeEntry.Severity.ERROR).isEmpty();
    }

    /** Returns a log holding this log's entries followed by {@code other}'s. */
    public ChangeLog plus(ChangeLog other) {
        if (other.isEmpty()) {
            return this;
        }
        List<ChangeEntry> combined = new ArrayList<>(entries);
        combined.addAll(other.entries);
        return new ChangeLog(combined);
    }

    /**
     * Renders the log as a JSON array of {@code {severity, code, message, line}} objects for the
     * editor layer. {@code line} is omitted when unknown.
     */
    public ArrayNode toJson() {
        ArrayNode array = MAPPER.createArrayNode();
        for (ChangeEntry entry : entries) {
            ObjectNode node = array.addObject();
            node.put("severity", entry.severity().name());
            node.put("code", entry.code());
            node.put("message", entry.message());
            if (entry.line() != null) {
                node.put("line", entry.line());
            }
        }
        return array;
    }

    @Override
    public String toString() {
        return "ChangeLog" + entries;
    }

    /** Accumulates entries in order. Not thread-safe. */
    public static final class Builder {

        private final List<ChangeEntry> entries = new ArrayList<>();

        Builder() {}

        public Builder add(ChangeEntry entry) {
            entries.add(entry);
            return this;
        }

        public Builder info(String code, String message, Integer line) {
            return add(new ChangeEntry(ChangeEntry.Severity.INFO, code, message, line));
        }

        public Builder warning(String code, String message, Integer line) {
            return add(new ChangeEntry(ChangeEntry.Severity.WARNING, code, message, line));
        }

        public Builder error(String code, String message, Integer line) {
            return add(new ChangeEntry(ChangeEntry.Severity.ERROR, code, message, line));
        }

        public Builder addAll(ChangeLog log) {
            entries.addAll(log.entries());
            return this;
        }

        public ChangeLog build() {
            return entries.isEmpty() ? EMPTY : new ChangeLog(entries);
        }
    }
}
