package io.cifxform.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: the abstract roots, phases and carried context. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void cifExceptionIsAbstractAndUnchecked() {
        assertThat(CifException.class).isAbstract();
        assertThat(CifException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void cifLoadExceptionIsAbstract() {
        assertThat(CifLoadException.class).isAbstract();
        assertThat(CifLoadException.class.getSuperclass()).isEqualTo(CifException.class);
    }

    // --- Parse ---

    @Test
    void parseExceptionCarriesOffsetAndLine() {
        var ex = new CifParseException("Unterminated text block", "a.cif", 42, 7);

        assertThat(ex.phase()).isEqualTo(CifException.Phase.PARSE);
        assertThat(ex.source()).isEqualTo("a.cif");
        assertThat(ex.lastGoodOffset()).isEqualTo(42);
        assertThat(ex.line()).isEqualTo(7);
        assertThat(ex.getMessage()).isEqualTo("Unterminated text block (line 7)");
    }

    @Test
    void parseExceptionWrapsIoCause() {
        var cause = new java.io.IOException("disk gone");
        var ex = new CifParseException("Failed to read", cause, "a.cif");

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.line()).isZero();
    }

    // --- Load-time exceptions extend CifLoadException ---

    @Test
    void dictionaryLoadExceptionIsLoadPhase() {
        var ex = new DictionaryLoadException("DDL2 dictionaries are not supported", "mmcif.dic");

        assertThat(ex).isInstanceOf(CifLoadException.class);
        assertThat(ex.phase()).isEqualTo(CifException.Phase.LOAD);
        assertThat(ex.detail()).isEqualTo("DDL2 dictionaries are not supported");
    }

    @Test
    void ruleParseExceptionCarriesLine() {
        var ex = new RuleParseException("Unknown directive 'FOO'", "checks.cif_rules", 3);

        assertThat(ex).isInstanceOf(CifLoadException.class);
        assertThat(ex.line()).isEqualTo(3);
        assertThat(ex.getMessage()).endsWith("(line 3)");
    }

    @Test
    void configLoadExceptionIsLoadPhase() {
        var ex = new ConfigLoadException("Configuration file not found", "cif-xform.yml");

        assertThat(ex).isInstanceOf(CifLoadException.class);
        assertThat(ex.source()).isEqualTo("cif-xform.yml");
    }

    // --- Conversion and evaluation ---

    @Test
    void conversionExceptionIsConversionPhase() {
        var ex = new ConversionException("Overlapping edits", "a.cif");

        assertThat(ex).isNotInstanceOf(CifLoadException.class);
        assertThat(ex.phase()).isEqualTo(CifException.Phase.CONVERSION);
    }

    @Test
    void ruleEvaluationExceptionIsTaggedWithRuleIndex() {
        var ex = new RuleEvaluationException("Division by zero", "_diffrn.flux_density");

        assertThat(ex.ruleIndex()).isNull();
        var tagged = ex.atRule(2, "checks.cif_rules");

        assertThat(tagged.phase()).isEqualTo(CifException.Phase.EVALUATION);
        assertThat(tagged.ruleIndex()).isEqualTo(2);
        assertThat(tagged.field()).isEqualTo("_diffrn.flux_density");
        assertThat(tagged.source()).isEqualTo("checks.cif_rules");
        assertThat(tagged.getMessage()).isEqualTo("Division by zero");
    }
}
