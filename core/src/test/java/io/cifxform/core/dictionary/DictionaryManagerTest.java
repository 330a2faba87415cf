package io.cifxform.core.dictionary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cifxform.core.error.DictionaryLoadException;
import io.cifxform.core.model.ChangeEntry;
import io.cifxform.core.model.Notation;
import io.cifxform.core.parse.CifParser;
import io.cifxform.core.testkit.Fixtures;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DictionaryManager")
class DictionaryManagerTest {

    private static final Path MINI_CORE = Fixtures.path("dictionaries/mini_core.dic");
    private static final Path LEGACY_CORE = Fixtures.path("dictionaries/legacy_core.dic");

    private final DictionaryManager manager = new DictionaryManager();

    static DictionarySource ddlm(String name, String... frames) {
        return new DictionarySource(name, "data_TEST\n_dictionary.title TEST\n\n" + String.join("", frames));
    }

    static String frame(String id, String extra) {
        return "save_" + id.substring(1) + "\n_definition.id '" + id + "'\n" + extra + "save_\n\n";
    }

    @Nested
    @DisplayName("DDLm")
    class Ddlm {

        private final DictionarySet set = manager.load(MINI_CORE);

        @Test
        void loadsDefinitionFramesOnly() {
            assertThat(set.size()).isEqualTo(14);
            assertThat(set.field("MINI_CORE")).isEmpty();
            assertThat(set.field("DIFFRN")).isEmpty();
            assertThat(set.sources()).containsExactly(MINI_CORE.toString());
            assertThat(set.conflicts()).isEmpty();
            assertThat(set.warnings().isEmpty()).isTrue();
        }

        @Test
        void resolvesEverySpellingToOneCanonicalId() {
            assertThat(set.resolve("_diffrn_ambient_temperature")).get()
                    .extracting(CanonicalField::canonicalId)
                    .isEqualTo("_diffrn.ambient_temperature");
            assertThat(set.resolve("_diffrn.ambient_temperature")).get()
                    .extracting(CanonicalField::canonicalId)
                    .isEqualTo("_diffrn.ambient_temperature");
            assertThat(set.resolve("_diffrn_source_type")).get()
                    .extracting(CanonicalField::canonicalId)
                    .isEqualTo("_diffrn_source.make");
            assertThat(set.resolve("_unknown_name")).isEmpty();
        }

        @Test
        void preferredSpellingPerNotation() {
            assertThat(set.preferredSpelling("_diffrn.ambient_temperature", Notation.LEGACY))
                    .isEqualTo("_diffrn_ambient_temperature");
            assertThat(set.preferredSpelling("_diffrn.ambient_temperature", Notation.MODERN))
                    .isEqualTo("_diffrn.ambient_temperature");
            assertThat(set.preferredSpelling("_diffrn_source.make", Notation.LEGACY))
                    .isEqualTo("_diffrn_source_make");
            assertThat(set.preferredSpelling("_space_group.name_H-M_alt", Notation.LEGACY))
                    .isEqualTo("_space_group_name_H-M_alt");
            assertThatThrownBy(() -> set.preferredSpelling("_nope", Notation.LEGACY))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void readsMetadata() {
            CanonicalField correction = set.field("_exptl_absorpt.correction_type").orElseThrow();
            assertThat(correction.valueKind()).isEqualTo(ValueKind.CODE);
            assertThat(correction.enumeratedValues()).hasSize(11).contains("multi-scan", "none");
            assertThat(correction.defaultValue()).isEqualTo("none");
            assertThat(correction.category()).isEqualTo("exptl_absorpt");

            CanonicalField temperature = set.field("_diffrn.ambient_temperature").orElseThrow();
            assertThat(temperature.valueKind()).isEqualTo(ValueKind.REAL);
            assertThat(temperature.description()).startsWith("Mean temperature in kelvins");

            assertThat(set.field("_diffrn_reflns.number").orElseThrow().valueKind()).isEqualTo(ValueKind.INTEGER);
        }

        @Test
        void datedAliasIsDeprecatedSpelling() {
            CanonicalField spaceGroup = set.resolve("_symmetry_space_group_name_H-M").orElseThrow();

            assertThat(spaceGroup.isDeprecatedSpelling("_symmetry_space_group_name_H-M")).isTrue();
            assertThat(spaceGroup.isDeprecatedSpelling("_space_group_name_H-M_alt")).isFalse();
            assertThat(spaceGroup.isDeprecated()).isFalse();
        }

        @Test
        void caseFallbackOnlyAfterExactMiss() {
            assertThat(set.resolve("_CELL_LENGTH_A")).isEmpty();
            assertThat(set.resolveWithCaseFallback("_CELL_LENGTH_A")).get()
                    .extracting(CanonicalField::canonicalId)
                    .isEqualTo("_cell.length_a");
        }

        @Test
        void deprecationChainWalksToTerminal() {
            assertThat(set.deprecationChain("_refine_ls.abs_structure_Rogers"))
                    .containsExactly("_refine_ls.abs_structure_Rogers", "_refine_ls.abs_structure_Flack");
            assertThat(set.terminal("_refine_ls.abs_structure_Rogers")).isEqualTo("_refine_ls.abs_structure_Flack");
            assertThat(set.terminal("_cell.length_a")).isEqualTo("_cell.length_a");
        }
    }

    @Nested
    @DisplayName("CIF2 syntax")
    class Cif2Syntax {

        private final DictionarySet set = manager.load(Fixtures.path("dictionaries/cif2_import.dic"));

        @Test
        void importListsDoNotStopTheLoad() {
            assertThat(set.size()).isEqualTo(3);
            assertThat(set.resolve("_cell_length_a")).get()
                    .extracting(CanonicalField::canonicalId)
                    .isEqualTo("_cell.length_a");
            assertThat(set.resolve("_cell_length_b")).get()
                    .extracting(CanonicalField::canonicalId)
                    .isEqualTo("_cell.length_b");
        }

        @Test
        void quotedValuesCloseAtTheirQuote() {
            assertThat(set.field("_cell.setting").orElseThrow().enumeratedValues())
                    .containsExactly("triclinic", "monoclinic");
            assertThat(set.preferredSpelling("_cell.setting", Notation.LEGACY)).isEqualTo("_symmetry_cell_setting");
        }

        @Test
        void markerAfterByteOrderMarkEnablesCif2() {
            DictionarySource source = ddlm(
                    "inline-import.dic",
                    frame("_cell.angle_alpha",
                            "_alias.definition_id '_cell_angle_alpha'\n"
                                    + "_import.get [{'file':'templ_attr.cif'  'save':'cell_angle'}]\n"));
            DictionarySet inline = manager.load(
                    new DictionarySource(source.name(), "\uFEFF#\\#CIF_2.0\n" + source.content()));

            assertThat(inline.resolve("_cell_angle_alpha")).isPresent();
        }

        @Test
        void withoutMarkerTheSameSourceIsMalformed() {
            DictionarySource source = ddlm(
                    "cif1-import.dic",
                    frame("_cell.angle_alpha", "_import.get [{'file':'templ_attr.cif'  'save':'cell_angle'}]\n"));

            assertThatThrownBy(() -> manager.load(source)).isInstanceOf(DictionaryLoadException.class);
        }
    }

    @Nested
    @DisplayName("legacy spelling extensions")
    class LegacyExtensions {

        private final DictionarySet set = manager.load(Fixtures.path("dictionaries/cif2_only.dic"));

        @Test
        void dottedOnlyFieldGainsLegacySpelling() {
            assertThat(set.preferredSpelling("_refine_diff.potential_max", Notation.LEGACY))
                    .isEqualTo("_refine_diff_potential_max");
            assertThat(set.resolve("_refine_diff_potential_max")).get()
                    .extracting(CanonicalField::canonicalId)
                    .isEqualTo("_refine_diff.potential_max");
            assertThat(set.preferredSpelling("_refine_ls.abs_structure_z-score", Notation.LEGACY))
                    .isEqualTo("_refine_ls_abs_structure_z-score");
        }

        @Test
        void extensionsAreTracked() {
            assertThat(set.legacyExtensions())
                    .containsExactly("_refine_diff_potential_max", "_refine_ls_abs_structure_z-score");
            assertThat(set.isLegacyExtension("_refine_diff_potential_max")).isTrue();
            assertThat(set.isLegacyExtension("_diffrn_source")).isFalse();
        }

        @Test
        void spellingClaimedByAnotherDefinitionIsNotReused() {
            assertThat(set.resolve("_diffrn_source")).get()
                    .extracting(CanonicalField::canonicalId)
                    .isEqualTo("_diffrn_source.make");
            assertThat(set.preferredSpelling("_diffrn_source.device", Notation.LEGACY))
                    .isEqualTo("_diffrn_source.device");
            assertThat(set.conflicts()).isEmpty();
        }

        @Test
        void officialLegacySpellingIsKept() {
            assertThat(manager.load(MINI_CORE).legacyExtensions()).isEmpty();
        }

        @Test
        void extensionsSurviveMerging() {
            DictionarySet merged = manager.merge(List.of(manager.load(MINI_CORE), set));

            assertThat(merged.isLegacyExtension("_refine_diff_potential_max")).isTrue();
            assertThat(merged.preferredSpelling("_refine_diff.potential_max", Notation.LEGACY))
                    .isEqualTo("_refine_diff_potential_max");
        }

        @Test
        void managerWithoutExtensionsLeavesDottedOnlyFields() {
            DictionarySet plain = new DictionaryManager(new CifParser(), LegacySpellingExtensions.none())
                    .load(Fixtures.path("dictionaries/cif2_only.dic"));

            assertThat(plain.resolve("_refine_diff_potential_max")).isEmpty();
            assertThat(plain.legacyExtensions()).isEmpty();
        }

        @Test
        void bundledMappingsCoverKnownDottedOnlyFields() {
            LegacySpellingExtensions bundled = LegacySpellingExtensions.bundled();

            assertThat(bundled.legacyFor("_diffrn_source.device")).contains("_diffrn_source");
            assertThat(bundled.modernFor("_exptl_crystal_mosaicity")).contains("_exptl_crystal.mosaicity");
            assertThat(bundled.size()).isEqualTo(25);
        }
    }

    @Nested
    @DisplayName("DDL1")
    class Ddl1 {

        private final DictionarySet set = manager.load(LEGACY_CORE);

        @Test
        void loopedNamesShareBlockMetadata() {
            assertThat(set.field("_cell_length_b")).get().satisfies(field -> {
                assertThat(field.legacySpelling()).isEqualTo("_cell_length_b");
                assertThat(field.modernSpelling()).isNull();
                assertThat(field.valueKind()).isEqualTo(ValueKind.REAL);
                assertThat(field.category()).isEqualTo("cell");
                assertThat(field.description()).isEqualTo("Unit-cell lengths in angstroms.");
            });
            assertThat(set.size()).isEqualTo(7);
        }

        @Test
        void replaceRelationBecomesDeprecation() {
            assertThat(set.field("_refine_ls_abs_structure_Rogers").orElseThrow().deprecatedBy())
                    .isEqualTo("_refine_ls_abs_structure_Flack");
            assertThat(set.field("_diffrn_radiation_type").orElseThrow().isDeprecated()).isFalse();
        }

        @Test
        void loopedEnumeration() {
            CanonicalField flag = set.field("_atom_site_calc_flag").orElseThrow();

            assertThat(flag.enumeratedValues()).containsExactly("d", "calc", "c", "dum");
            assertThat(flag.defaultValue()).isEqualTo("d");
            assertThat(flag.valueKind()).isEqualTo(ValueKind.TEXT);
        }

        @Test
        void legacyOnlyFieldFallsBackForModernSpelling() {
            assertThat(set.preferredSpelling("_cell_length_a", Notation.MODERN)).isEqualTo("_cell_length_a");
        }
    }

    @Nested
    @DisplayName("merging")
    class Merging {

        @Test
        void laterSourceOverridesSharedSpellings() {
            DictionarySet merged = manager.merge(List.of(manager.load(LEGACY_CORE), manager.load(MINI_CORE)));

            assertThat(merged.sources()).containsExactly(LEGACY_CORE.toString(), MINI_CORE.toString());
            assertThat(merged.resolve("_cell_length_a")).get()
                    .extracting(CanonicalField::canonicalId)
                    .isEqualTo("_cell.length_a");
            assertThat(merged.conflicts())
                    .extracting(MergeConflict::spelling)
                    .containsExactly(
                            "_cell_length_a", "_refine_ls_abs_structure_Flack", "_refine_ls_abs_structure_Rogers");
            assertThat(merged.conflicts()).allSatisfy(conflict -> {
                assertThat(conflict.kind()).isEqualTo(MergeConflict.Kind.OVERRIDE);
                assertThat(conflict.keptSource()).isEqualTo(MINI_CORE.toString());
                assertThat(conflict.discardedSource()).isEqualTo(LEGACY_CORE.toString());
            });
            assertThat(merged.resolve("_cell_length_b")).isPresent();
        }

        @Test
        void precedenceFollowsListOrder() {
            DictionarySet merged = manager.merge(List.of(manager.load(MINI_CORE), manager.load(LEGACY_CORE)));

            assertThat(merged.resolve("_cell_length_a")).get()
                    .extracting(CanonicalField::canonicalId)
                    .isEqualTo("_cell_length_a");
            assertThat(merged.resolve("_cell.length_a")).get()
                    .extracting(CanonicalField::canonicalId)
                    .isEqualTo("_cell.length_a");
        }

        @Test
        void sameSourceDuplicateIdIsTieAndFirstWins() {
            DictionarySet set = manager.load(ddlm(
                    "dup.dic",
                    frame("_cell.volume", "_description.text first\n"),
                    frame("_cell.volume", "_description.text second\n")));

            assertThat(set.field("_cell.volume").orElseThrow().description()).isEqualTo("first");
            assertThat(set.conflicts()).singleElement().satisfies(conflict -> {
                assertThat(conflict.kind()).isEqualTo(MergeConflict.Kind.TIE);
                assertThat(conflict.spelling()).isEqualTo("_cell.volume");
            });
        }

        @Test
        void sameSourceAliasClaimIsTie() {
            DictionarySet set = manager.load(ddlm(
                    "alias-tie.dic",
                    frame("_cell.volume", "_alias.definition_id '_cell_volume'\n"),
                    frame("_cell.volume_su", "_alias.definition_id '_cell_volume'\n")));

            assertThat(set.resolve("_cell_volume")).get()
                    .extracting(CanonicalField::canonicalId)
                    .isEqualTo("_cell.volume");
            assertThat(set.conflicts()).singleElement().satisfies(conflict -> {
                assertThat(conflict.kind()).isEqualTo(MergeConflict.Kind.TIE);
                assertThat(conflict.keptId()).isEqualTo("_cell.volume");
                assertThat(conflict.discardedId()).isEqualTo("_cell.volume_su");
            });
        }

        @Test
        void mergingTwiceDoesNotDuplicateConflicts() {
            DictionarySet once = manager.merge(List.of(manager.load(LEGACY_CORE), manager.load(MINI_CORE)));
            DictionarySet twice = manager.merge(List.of(once));

            assertThat(twice.conflicts()).hasSameSizeAs(once.conflicts());
        }

        @Test
        void deprecationCycleIsReportedOnceAndWalkStops() {
            DictionarySet set = manager.load(ddlm(
                    "cycle.dic",
                    frame("_a.one", "_definition_replaced.by '_a.two'\n"),
                    frame("_a.two", "_definition_replaced.by '_a.one'\n")));

            assertThat(set.deprecationChain("_a.one")).containsExactly("_a.one", "_a.two");
            assertThat(set.warnings().withCode("DEPRECATION_CYCLE")).hasSize(1);
        }

        @Test
        void replacementOutsideTheSetEndsTheChain() {
            DictionarySet set = manager.load(ddlm("dangling.dic", frame("_a.one", "_definition_replaced.by '_a.gone'\n")));

            assertThat(set.field("_a.one").orElseThrow().isDeprecated()).isTrue();
            assertThat(set.terminal("_a.one")).isEqualTo("_a.one");
        }
    }

    @Nested
    @DisplayName("loading failures")
    class Failures {

        @Test
        void ddl2IsRejected() {
            assertThatThrownBy(() -> manager.load(Fixtures.path("dictionaries/mmcif_ddl2.dic")))
                    .isInstanceOf(DictionaryLoadException.class)
                    .hasMessageContaining("DDL2");
        }

        @Test
        void unknownFormatIsRejected() {
            assertThatThrownBy(() -> manager.load(new DictionarySource("plain.txt", "just some text\n")))
                    .isInstanceOf(DictionaryLoadException.class)
                    .hasMessageContaining("Unrecognized dictionary format");
        }

        @Test
        void malformedSourceIsRejected() {
            assertThatThrownBy(() -> manager.load(Fixtures.path("dictionaries/broken.dic")))
                    .isInstanceOf(DictionaryLoadException.class)
                    .hasMessageContaining("Malformed DDLm dictionary")
                    .hasCauseInstanceOf(io.cifxform.core.error.CifParseException.class);
        }

        @Test
        void dictionaryWithoutFieldsIsRejected() {
            assertThatThrownBy(() -> manager.load(ddlm("empty.dic")))
                    .isInstanceOf(DictionaryLoadException.class)
                    .hasMessageContaining("defines no fields");
        }

        @Test
        void loadAllSkipsBrokenSourcesWithWarning() {
            DictionaryLoadResult result = manager.loadFiles(List.of(
                    MINI_CORE,
                    Fixtures.path("dictionaries/broken.dic"),
                    Fixtures.path("dictionaries/mmcif_ddl2.dic"),
                    Fixtures.path("dictionaries/missing.dic")));

            assertThat(result.set().size()).isEqualTo(14);
            assertThat(result.changeLog().withCode("DICTIONARY_SKIPPED"))
                    .hasSize(3)
                    .allSatisfy(entry -> assertThat(entry.severity()).isEqualTo(ChangeEntry.Severity.WARNING));
        }

        @Test
        void loadAllWithNothingLoadableYieldsEmptySet() {
            DictionaryLoadResult result = manager.loadAll(List.of(new DictionarySource("x", "nothing")));

            assertThat(result.set().isEmpty()).isTrue();
            assertThat(result.changeLog().warnings()).hasSize(1);
        }

        @Test
        void fetchLoadsFetchedBytes() {
            String content = "data_TEST\n_dictionary.title TEST\n" + frame("_cell.volume", "");

            DictionarySet set = manager.fetch(
                    (uri, timeout) -> content.getBytes(StandardCharsets.UTF_8),
                    URI.create("https://example.org/cell.dic"),
                    Duration.ofSeconds(5));

            assertThat(set.resolve("_cell.volume")).isPresent();
            assertThat(set.sources()).containsExactly("https://example.org/cell.dic");
        }

        @Test
        void failedFetchIsLoadError() {
            assertThatThrownBy(() -> manager.fetch(
                            (uri, timeout) -> {
                                throw new IOException("connection refused");
                            },
                            URI.create("https://example.org/cell.dic"),
                            Duration.ofSeconds(5)))
                    .isInstanceOf(DictionaryLoadException.class)
                    .hasMessageContaining("connection refused");
        }
    }
}
