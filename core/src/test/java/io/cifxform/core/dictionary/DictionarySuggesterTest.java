package io.cifxform.core.dictionary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cifxform.core.dictionary.DictionarySuggester.Candidate;
import io.cifxform.core.dictionary.DictionarySuggester.DictionarySuggestion;
import io.cifxform.core.model.Document;
import io.cifxform.core.parse.CifParser;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DictionarySuggester")
class DictionarySuggesterTest {

    private final CifParser parser = new CifParser();
    private final DictionarySuggester suggester = DictionarySuggester.bundled();

    private Document parse(String text) {
        return parser.parse(text, "suggest.cif");
    }

    @Test
    void bundledCandidates() {
        assertThat(suggester.candidates())
                .extracting(Candidate::key)
                .containsExactly("modulated", "powder", "magnetic", "twinning");
        assertThat(suggester.candidates().get(3).localFile()).isEqualTo("dictionaries/cif_twin.dic");
    }

    @Test
    void powderFieldsSuggestPowderDictionary() {
        List<DictionarySuggestion> suggestions = suggester.suggest(parse("""
                data_x
                _pd_meas_2theta_range_min 5
                _pd_meas.2theta_range_max 90
                _pd_spec_mounting 'glass capillary'
                _cell_length_a 5
                """));

        assertThat(suggestions).singleElement().satisfies(suggestion -> {
            assertThat(suggestion.candidate().key()).isEqualTo("powder");
            assertThat(suggestion.triggerFields())
                    .containsExactly("_pd_meas_2theta_range_min", "_pd_meas.2theta_range_max", "_pd_spec_mounting");
            assertThat(suggestion.confidence()).isEqualTo(1.0);
        });
    }

    @Test
    void loopColumnsAndLaterBlocksCount() {
        List<DictionarySuggestion> suggestions = suggester.suggest(parse("""
                data_a
                _cell_length_a 5
                data_b
                loop_
                _twin_individual_id
                _twin_individual_mass_fraction_refined
                1 0.6
                2 0.4
                _atom_site_moment_label Fe1
                """));

        assertThat(suggestions)
                .extracting(suggestion -> suggestion.candidate().key())
                .containsExactly("twinning", "magnetic");
        assertThat(suggestions.get(0).confidence()).isEqualTo(1.0);
        assertThat(suggestions.get(1).confidence()).isEqualTo(0.4);
    }

    @Test
    void namesMatchIgnoringCase() {
        assertThat(suggester.suggest(parse("data_x\n_SPACE_GROUP_MAGN_NAME_BNS 'P 1'\n")))
                .extracting(suggestion -> suggestion.candidate().key())
                .containsExactly("magnetic");
    }

    @Test
    void plainCoreDocumentGetsNoSuggestion() {
        assertThat(suggester.suggest(parse("data_x\n_cell_length_a 5\n"))).isEmpty();
    }

    @Test
    void customCandidate() {
        DictionarySuggester extended = DictionarySuggester.of(List.of()).withCandidate(new Candidate(
                "lab", "Lab dictionary", null, null, "dictionaries/lab.dic", List.of("_lab_batch", "_lab_operator")));

        List<DictionarySuggestion> suggestions = extended.suggest(parse("data_x\n_lab.batch 7\n"));

        assertThat(suggestions).singleElement().satisfies(suggestion -> {
            assertThat(suggestion.triggerFields()).containsExactly("_lab.batch");
            assertThat(suggestion.confidence()).isEqualTo(1.0);
        });
    }

    @Test
    void candidateNeedsTriggers() {
        assertThatThrownBy(() -> new Candidate("empty", "Empty", "", null, null, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no trigger fields");
    }
}
