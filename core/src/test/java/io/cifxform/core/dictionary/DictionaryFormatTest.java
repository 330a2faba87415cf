package io.cifxform.core.dictionary;

import static org.assertj.core.api.Assertions.assertThat;

import io.cifxform.core.testkit.Fixtures;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DictionaryFormatTest {

    @ParameterizedTest
    @CsvSource({
        "dictionaries/mini_core.dic, DDLM",
        "dictionaries/legacy_core.dic, DDL1",
        "dictionaries/mmcif_ddl2.dic, DDL2",
        "documents/legacy_sample.cif, UNKNOWN"
    })
    void detectsDialect(String fixture, DictionaryFormat expected) {
        assertThat(DictionaryFormat.detect(Fixtures.read(fixture))).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"real, REAL", "Count, INTEGER", "Code, CODE", "Text, TEXT", "Implied, UNKNOWN"})
    void mapsDdlmContents(String contents, ValueKind expected) {
        assertThat(ValueKind.fromDdlm(contents)).isEqualTo(expected);
    }
}
