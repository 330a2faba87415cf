package io.cifxform.core.convert;

import static io.cifxform.core.testkit.Fixtures.assertExtentsTile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cifxform.core.dictionary.DictionaryManager;
import io.cifxform.core.dictionary.DictionarySet;
import io.cifxform.core.error.ConversionException;
import io.cifxform.core.model.ChangeEntry;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Notation;
import io.cifxform.core.model.TransformOutcome;
import io.cifxform.core.parse.CifParser;
import io.cifxform.core.rewrite.RewriteEngine;
import io.cifxform.core.testkit.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FormatConverter")
class FormatConverterTest {

    private final CifParser parser = new CifParser();
    private final DictionarySet dictionaries = Fixtures.miniCore();
    private final FormatConverter converter = new FormatConverter(dictionaries);

    private Document parse(String text) {
        return parser.parse(text, "convert.cif");
    }

    @Nested
    @DisplayName("to modern")
    class ToModern {

        private final Document sample = parser.parse(Fixtures.read("documents/legacy_sample.cif"), "legacy_sample.cif");

        @Test
        void renamesFieldButLeavesTextBlockBody() {
            TransformOutcome outcome = converter.convert(sample, Notation.MODERN);
            String output = outcome.document().serialize();

            assertThat(output).contains("_diffrn.ambient_temperature       293.15  # measured");
            assertThat(output).contains("Cited for _diffrn_ambient_temperature handling.");
            assertThat(output).contains("Crystal mounted at _diffrn_ambient_temperature in oil.");
            assertThat(outcome.document().firstDataBlock().orElseThrow().text("_diffrn.ambient_temperature"))
                    .contains("293.15");
            assertExtentsTile(outcome.document());
        }

        @Test
        void renamesEveryKnownName() {
            TransformOutcome outcome = converter.convert(sample, Notation.MODERN);

            assertThat(outcome.document().firstDataBlock().orElseThrow().dataNames()).contains(
                    "_audit.creation_method",
                    "_chemical_name.common",
                    "_diffrn_source.make",
                    "_cell.length_a",
                    "_publ_section.references",
                    "_shelx_res_file",
                    "_atom_site_label");
            assertThat(outcome.changeLog().withCode("RENAMED")).hasSize(6);
        }

        @Test
        void unknownNamesAreReportedAndKept() {
            TransformOutcome outcome = converter.convert(sample, Notation.MODERN);

            assertThat(outcome.changeLog().withCode("NO_MAPPING"))
                    .extracting(ChangeEntry::message)
                    .anySatisfy(message -> assertThat(message).contains("_shelx_res_file"))
                    .anySatisfy(message -> assertThat(message).contains("_atom_site_fract_x"));
            assertThat(outcome.changeLog().hasErrors()).isFalse();
        }

        @Test
        void replacesLegacyVersionMarker() {
            TransformOutcome outcome = converter.convert(sample, Notation.MODERN);

            assertThat(outcome.document().serialize()).startsWith("#\\#CIF_2.0\n# Sample structure report");
            assertThat(outcome.changeLog().withCode("VERSION_MARKER_REPLACED")).hasSize(1);
        }

        @Test
        void addsMarkerWhenMissing() {
            TransformOutcome outcome = converter.convert(parse("data_x\n_cell_length_a 5.1\n"), Notation.MODERN);

            assertThat(outcome.document().serialize()).isEqualTo("#\\#CIF_2.0\ndata_x\n_cell.length_a 5.1\n");
            assertThat(outcome.changeLog().withCode("VERSION_MARKER_ADDED")).hasSize(1);
        }

        @Test
        void markerGoesAfterByteOrderMark() {
            TransformOutcome outcome =
                    converter.convert(parse("\uFEFFdata_x\n_diffrn_ambient_temperature 293\n"), Notation.MODERN);

            assertThat(outcome.document().serialize())
                    .isEqualTo("\uFEFF#\\#CIF_2.0\ndata_x\n_diffrn.ambient_temperature 293\n");
            assertThat(outcome.document().versionMarker()).isPresent();
            assertExtentsTile(outcome.document());
        }

        @Test
        void markerUsesDocumentLineBreaks() {
            TransformOutcome outcome =
                    converter.convert(parse("data_x\r\n_diffrn_ambient_temperature 293\r\n"), Notation.MODERN);

            assertThat(outcome.document().serialize())
                    .isEqualTo("#\\#CIF_2.0\r\ndata_x\r\n_diffrn.ambient_temperature 293\r\n");
        }

        @Test
        void followsDeprecationToCurrentField() {
            TransformOutcome outcome =
                    converter.convert(parse("data_x\n_refine_ls_abs_structure_Rogers 0.02\n"), Notation.MODERN);

            assertThat(outcome.document().serialize()).contains("_refine_ls.abs_structure_Flack 0.02");
        }

        @Test
        void loopColumnsAreRenamedRowsUntouched() {
            Document document = parse("data_x\nloop_\n_cell_length_a\n_diffrn_reflns_number\n5.1 100\n6.2 200\n");

            String output = converter.convert(document, Notation.MODERN).document().serialize();

            assertThat(output).endsWith("loop_\n_cell.length_a\n_diffrn_reflns.number\n5.1 100\n6.2 200\n");
        }
    }

    @Nested
    @DisplayName("to legacy")
    class ToLegacy {

        @Test
        void removesModernMarker() {
            TransformOutcome outcome =
                    converter.convert(parse("#\\#CIF_2.0\ndata_x\n_cell.length_a 5.1\n"), Notation.LEGACY);

            assertThat(outcome.document().serialize()).isEqualTo("data_x\n_cell_length_a 5.1\n");
            assertThat(outcome.changeLog().withCode("VERSION_MARKER_REMOVED")).hasSize(1);
        }

        @Test
        void dottedOnlyFieldUsesLegacyExtension() {
            FormatConverter extended = new FormatConverter(
                    new DictionaryManager().load(Fixtures.path("dictionaries/cif2_only.dic")));

            TransformOutcome outcome = extended.convert(
                    parse("#\\#CIF_2.0\ndata_x\n_refine_diff.potential_max 0.31\n"), Notation.LEGACY);

            assertThat(outcome.document().serialize()).isEqualTo("data_x\n_refine_diff_potential_max 0.31\n");
            assertThat(outcome.changeLog().withCode("LEGACY_EXTENSION")).hasSize(1);
        }

        @Test
        void removingMarkerKeepsByteOrderMark() {
            TransformOutcome outcome =
                    converter.convert(parse("\uFEFF#\\#CIF_2.0\ndata_x\n_cell.length_a 5.1\n"), Notation.LEGACY);

            assertThat(outcome.document().serialize()).isEqualTo("\uFEFFdata_x\n_cell_length_a 5.1\n");
        }

        @Test
        void usesNonDeprecatedAliasAsLegacySpelling() {
            String output = converter.convert(parse("data_x\n_space_group.name_H-M_alt 'P 21/c'\n"), Notation.LEGACY)
                    .document()
                    .serialize();

            assertThat(output).isEqualTo("data_x\n_space_group_name_H-M_alt 'P 21/c'\n");
        }

        @Test
        void alreadyLegacyDocumentIsUnchanged() {
            Document document = parse("data_x\n_cell_length_a 5.1\n");

            TransformOutcome outcome = converter.convert(document, Notation.LEGACY);

            assertThat(outcome.document()).isSameAs(document);
            assertThat(outcome.changeLog().isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("name lookup")
    class Lookup {

        @Test
        void caseFallbackResolvesUpperCaseNames() {
            String output = converter.convert(parse("data_x\n_CELL_LENGTH_A 5.1\n"), Notation.MODERN)
                    .document()
                    .serialize();

            assertThat(output).contains("_cell.length_a 5.1");
        }

        @Test
        void withoutCaseFallbackUpperCaseNamesAreUnmapped() {
            FormatConverter strict = new FormatConverter(dictionaries, new RewriteEngine(), false);

            TransformOutcome outcome = strict.convert(parse("data_x\n_CELL_LENGTH_A 5.1\n"), Notation.MODERN);

            assertThat(outcome.document().serialize()).contains("_CELL_LENGTH_A 5.1");
            assertThat(outcome.changeLog().withCode("NO_MAPPING")).hasSize(1);
        }

        @Test
        void emptyDictionaryLeavesNamesAlone() {
            FormatConverter bare = new FormatConverter(DictionarySet.empty());

            TransformOutcome outcome = bare.convert(parse("data_x\n_cell_length_a 5.1\n"), Notation.MODERN);

            assertThat(outcome.document().serialize()).isEqualTo("#\\#CIF_2.0\ndata_x\n_cell_length_a 5.1\n");
        }
    }

    @Test
    void loopCollisionFailsAndLeavesInputIntact() {
        String text = "data_x\nloop_\n_diffrn_source_type\n_diffrn_source_make\na b\n";
        Document document = parse(text);

        assertThatThrownBy(() -> converter.convert(document, Notation.MODERN))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("duplicate column _diffrn_source.make");
        assertThat(document.serialize()).isEqualTo(text);
    }

    @Test
    void roundTripRestoresLegacySpellings() {
        Document document = parse("data_x\n_cell_length_a 5.1\n_diffrn_ambient_temperature 100\n");

        Document modern = converter.convert(document, Notation.MODERN).document();
        Document legacy = converter.convert(modern, Notation.LEGACY).document();

        assertThat(legacy.serialize()).isEqualTo(document.serialize());
    }
}
