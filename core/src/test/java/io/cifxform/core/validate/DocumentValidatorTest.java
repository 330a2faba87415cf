package io.cifxform.core.validate;

import static org.assertj.core.api.Assertions.assertThat;

import io.cifxform.core.dictionary.DictionarySet;
import io.cifxform.core.dictionary.PrefixRegistry;
import io.cifxform.core.model.ChangeEntry;
import io.cifxform.core.parse.CifParser;
import io.cifxform.core.testkit.Fixtures;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("DocumentValidator")
class DocumentValidatorTest {

    private final CifParser parser = new CifParser();
    private final DictionarySet dictionaries = Fixtures.miniCore();
    private final DocumentValidator validator = new DocumentValidator(dictionaries);

    private ValidationReport validate(String text) {
        return validator.validate(parser.parse(text, "validate.cif"));
    }

    @Nested
    @DisplayName("classification")
    class Classification {

        @Test
        void sampleDocumentCategories() {
            ValidationReport report =
                    validator.validate(parser.parse(Fixtures.read("documents/legacy_sample.cif"), "sample.cif"));

            assertThat(report.checks(FieldCategory.VALID))
                    .extracting(DataNameCheck::name)
                    .contains("_diffrn_ambient_temperature", "_cell_length_a", "_diffrn_source_type");
            assertThat(report.checks(FieldCategory.REGISTERED_LOCAL))
                    .extracting(DataNameCheck::name)
                    .containsExactly("_shelx_res_file");
            assertThat(report.checks(FieldCategory.UNKNOWN))
                    .extracting(DataNameCheck::name)
                    .contains("_publ_contact_author_name", "_atom_site_label", "_publ_author_address");
            assertThat(report.checks()).hasSize(14);
        }

        @Test
        void deprecatedAliasPointsToReplacementInSameNotation() {
            ValidationReport report = validate("data_x\n_symmetry_space_group_name_H-M 'P 1'\n");

            assertThat(report.checks()).singleElement().satisfies(check -> {
                assertThat(check.category()).isEqualTo(FieldCategory.DEPRECATED);
                assertThat(check.canonicalId()).isEqualTo("_space_group.name_H-M_alt");
                assertThat(check.replacement()).isEqualTo("_space_group_name_H-M_alt");
            });
            assertThat(report.problems().withCode("DEPRECATED_NAME")).hasSize(1);
        }

        @Test
        void supersededDefinitionIsDeprecated() {
            ValidationReport report = validate("data_x\n_refine_ls.abs_structure_Rogers 0.1\n");

            assertThat(report.checks().get(0).category()).isEqualTo(FieldCategory.DEPRECATED);
            assertThat(report.checks().get(0).replacement()).isEqualTo("_refine_ls.abs_structure_Flack");
        }

        @Test
        void allowListIsConsultedBeforePrefixes() {
            DocumentValidator configured = new DocumentValidator(
                    dictionaries, List.of("_olex2_", "mylab"), List.of("_shelx_custom", "_lab.owner"), true);

            ValidationReport report = configured.validate(parser.parse(
                    "data_x\n_shelx_custom 1\n_lab.owner me\n_mylab.batch 7\n_shelx_res_file a\n", "v.cif"));

            assertThat(report.checks())
                    .extracting(DataNameCheck::category)
                    .containsExactly(
                            FieldCategory.USER_ALLOWED,
                            FieldCategory.USER_ALLOWED,
                            FieldCategory.REGISTERED_LOCAL,
                            FieldCategory.UNKNOWN);
            assertThat(report.problems().withCode("UNKNOWN_NAME")).hasSize(1);
        }

        @Test
        void loopColumnsAreClassifiedAtTheLoopLine() {
            ValidationReport report = validate("data_x\n_cell_length_a 5\nloop_\n_diffrn_source_type\n_foo_bar\nx y\n");

            assertThat(report.checks())
                    .extracting(DataNameCheck::line)
                    .containsExactly(2, 3, 3);
            assertThat(report.checks().get(2).category()).isEqualTo(FieldCategory.UNKNOWN);
        }

        @Test
        void caseFallbackCanBeTurnedOff() {
            DocumentValidator strict =
                    new DocumentValidator(dictionaries, PrefixRegistry.bundled(), List.of(), false);

            assertThat(strict.validate(parser.parse("data_x\n_CELL_LENGTH_A 5\n", "v.cif")).checks().get(0).category())
                    .isEqualTo(FieldCategory.UNKNOWN);
            assertThat(validate("data_x\n_CELL_LENGTH_A 5\n").checks().get(0).category())
                    .isEqualTo(FieldCategory.VALID);
        }
    }

    @Nested
    @DisplayName("local prefixes")
    class LocalPrefixes {

        private DataNameCheck single(String name) {
            ValidationReport report = validate("data_x\n" + name + " 1\n");
            assertThat(report.checks()).hasSize(1);
            return report.checks().get(0);
        }

        @Test
        void leadingPrefixCarriesItsDictionary() {
            DataNameCheck check = single("_shelx_res_file");

            assertThat(check.category()).isEqualTo(FieldCategory.REGISTERED_LOCAL);
            assertThat(check.localPrefix()).isEqualTo("shelx");
            assertThat(check.suggestedName()).isNull();
            assertThat(check.suggestedDictionary()).isEqualTo("cif_shelxl.dic");
        }

        @Test
        void prefixAfterCategoryIsAccepted() {
            ValidationReport report = validate("data_x\n_diffrn_oxdiff_ac3_digest 1\n");

            assertThat(report.checks()).singleElement().satisfies(check -> {
                assertThat(check.category()).isEqualTo(FieldCategory.REGISTERED_LOCAL);
                assertThat(check.localPrefix()).isEqualTo("oxdiff");
                assertThat(check.suggestedName()).isEqualTo("_diffrn.oxdiff_ac3_digest");
            });
            assertThat(report.isClean()).isTrue();
        }

        @Test
        void dottedNameWithPrefixAfterCategory() {
            DataNameCheck check = single("_diffrn.oxdiff_ac3_digest");

            assertThat(check.category()).isEqualTo(FieldCategory.REGISTERED_LOCAL);
            assertThat(check.localPrefix()).isEqualTo("oxdiff");
            assertThat(check.suggestedName()).isNull();
        }

        @Test
        void longestCategoryWins() {
            DataNameCheck check = single("_diffrn_source_shelx_flag");

            assertThat(check.suggestedName()).isEqualTo("_diffrn_source.shelx_flag");
            assertThat(check.suggestedDictionary()).isEqualTo("cif_shelxl.dic");
        }

        @Test
        void categoriesComeFromLoadedDictionaries() {
            DocumentValidator withoutDictionaries = new DocumentValidator(DictionarySet.empty());
            String text = "data_x\n_chemical_name_olex2_label 1\n";

            assertThat(validate(text).checks().get(0).suggestedName()).isEqualTo("_chemical_name.olex2_label");
            assertThat(withoutDictionaries.validate(parser.parse(text, "v.cif")).checks().get(0).category())
                    .isEqualTo(FieldCategory.UNKNOWN);
        }

        @Test
        void unregisteredSegmentAfterCategoryStaysUnknown() {
            assertThat(single("_diffrn_mylab_value").category()).isEqualTo(FieldCategory.UNKNOWN);
        }

        @Test
        void unknownNameGetsDictionaryHint() {
            ValidationReport report =
                    validate("data_x\n_shelx_hkl_file a\n_pd_meas_2theta_range_min 5\n_twin_individual_id 1\n");

            assertThat(report.checks().get(1).category()).isEqualTo(FieldCategory.UNKNOWN);
            assertThat(report.checks().get(1).suggestedDictionary()).isEqualTo("cif_pow.dic");
            assertThat(report.problems().withCode("UNKNOWN_NAME"))
                    .extracting(ChangeEntry::message)
                    .containsExactly(
                            "_pd_meas_2theta_range_min is not defined by any loaded dictionary; try cif_pow.dic",
                            "_twin_individual_id is not defined by any loaded dictionary; try cif_twin.dic");
            assertThat(report.suggestedDictionaries()).containsExactly("cif_shelxl.dic", "cif_pow.dic", "cif_twin.dic");
        }
    }

    @Nested
    @DisplayName("values")
    class Values {

        @Test
        void typeMismatchesAreReported() {
            ValidationReport report = validate("""
                    data_x
                    _diffrn_reflns_number 12.5
                    _cell_length_a abc
                    _diffrn_ambient_temperature 293.15(2)
                    _chemical_name_common ?
                    """);

            assertThat(report.problems().withCode("TYPE_MISMATCH"))
                    .extracting(ChangeEntry::line)
                    .containsExactly(2, 3);
        }

        @Test
        void enumerationIsCaseInsensitive() {
            ValidationReport report = validate(
                    "data_x\n_exptl_absorpt_correction_type MULTI-SCAN\n_exptl_absorpt.correction_type lunar\n");

            assertThat(report.problems().withCode("NOT_ENUMERATED"))
                    .singleElement()
                    .extracting(ChangeEntry::line)
                    .isEqualTo(3);
        }

        @Test
        void cleanDocument() {
            assertThat(validate("data_x\n_cell_length_a 5.1\n_audit_creation_method 'by hand'\n").isClean())
                    .isTrue();
        }
    }

    @ParameterizedTest
    @CsvSource({"_shelx_res_file, shelx", "_shelx.hkl_file, shelx", "_OLEX2_refine, olex2", "_cell, ''"})
    void prefixOfDataName(String name, String expected) {
        assertThat(DocumentValidator.prefixOf(name)).isEqualTo(expected);
    }
}
