package io.cifxform.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.ArrayNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ChangeLog")
class ChangeLogTest {

    @Test
    void keepsEntriesInInsertionOrder() {
        ChangeLog log = ChangeLog.builder()
                .info("RENAMED", "_a -> _b", 3)
                .warning("NO_MAPPING", "No dictionary mapping for _x", 5)
                .error("RULE_FAILED", "Division by zero", null)
                .build();

        assertThat(log.entries()).extracting(ChangeEntry::code).containsExactly("RENAMED", "NO_MAPPING", "RULE_FAILED");
        assertThat(log.warnings()).hasSize(1);
        assertThat(log.hasErrors()).isTrue();
        assertThat(log.withCode("RENAMED")).singleElement().extracting(ChangeEntry::line).isEqualTo(3);
    }

    @Test
    void plusConcatenatesWithoutMutating() {
        ChangeLog first = ChangeLog.builder().info("A", "first", 1).build();
        ChangeLog second = ChangeLog.builder().info("B", "second", 2).build();

        ChangeLog combined = first.plus(second);

        assertThat(combined.size()).isEqualTo(2);
        assertThat(first.size()).isEqualTo(1);
        assertThat(ChangeLog.empty().isEmpty()).isTrue();
    }

    @Test
    void rendersJsonOmittingUnknownLine() {
        ArrayNode json = ChangeLog.builder()
                .warning("DICTIONARY_SKIPPED", "Dictionary broken.dic skipped", null)
                .info("RENAMED", "_a -> _b", 4)
                .build()
                .toJson();

        assertThat(json).hasSize(2);
        assertThat(json.get(0).get("severity").asText()).isEqualTo("WARNING");
        assertThat(json.get(0).has("line")).isFalse();
        assertThat(json.get(1).get("line").asInt()).isEqualTo(4);
    }

    @Test
    void entryRequiresCodeAndMessage() {
        assertThatThrownBy(() -> new ChangeEntry(ChangeEntry.Severity.INFO, null, "m", null))
                .isInstanceOf(NullPointerException.class);
        assertThat(new ChangeEntry(ChangeEntry.Severity.WARNING, "X", "msg", 7).toString())
                .isEqualTo("WARNING X: msg (line 7)");
    }
}
