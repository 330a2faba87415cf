package io.cifxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.cifxform.core.convert.FormatConverter;
import io.cifxform.core.dictionary.DictionaryManager;
import io.cifxform.core.dictionary.DictionarySource;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Notation;
import io.cifxform.core.rules.Rule;
import io.cifxform.core.rules.RuleEngine;
import io.cifxform.core.testkit.Fixtures;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Log entries emitted while the engine works on a document carry the document's source name in
 * the {@code cif.document} MDC key.
 */
@DisplayName("StructuredLoggingTest")
class StructuredLoggingTest {

    private final List<Logger> loggers = List.of(
            (Logger) LoggerFactory.getLogger(CifEngine.class),
            (Logger) LoggerFactory.getLogger(FormatConverter.class),
            (Logger) LoggerFactory.getLogger(RuleEngine.class),
            (Logger) LoggerFactory.getLogger(DictionaryManager.class));

    private ListAppender<ILoggingEvent> logAppender;
    private CifEngine engine;

    @BeforeEach
    void setUp() {
        engine = new CifEngine();
        engine.reload(List.of(Fixtures.path("dictionaries/mini_core.dic")));

        // Capture the MDC at logging time; the engine restores it before the test reads the events.
        logAppender = new ListAppender<>() {
            @Override
            protected void append(ILoggingEvent event) {
                event.prepareForDeferredProcessing();
                super.append(event);
            }
        };
        logAppender.start();
        loggers.forEach(logger -> logger.addAppender(logAppender));
    }

    @AfterEach
    void tearDown() {
        loggers.forEach(logger -> logger.detachAppender(logAppender));
        logAppender.stop();
    }

    private List<ILoggingEvent> events(String messagePrefix) {
        return logAppender.list.stream()
                .filter(e -> e.getMessage() != null && e.getMessage().startsWith(messagePrefix))
                .toList();
    }

    @Test
    @DisplayName("Conversion logs carry the document name")
    void conversionLogsCarryDocumentName() {
        Document document = engine.parse("data_x\n_cell_length_a 1\n_shelx_res_file a\n", "sample.cif");

        engine.convert(document, Notation.MODERN);

        assertThat(events("Parsed document")).singleElement().satisfies(event -> assertThat(
                        event.getMDCPropertyMap())
                .containsEntry(CifEngine.MDC_DOCUMENT, "sample.cif"));

        ILoggingEvent converted = events("Converted document").get(0);
        assertThat(converted.getLevel()).isEqualTo(Level.INFO);
        assertThat(converted.getFormattedMessage())
                .isEqualTo("Converted document: source=sample.cif, target=MODERN, renamed=1, unmapped=1");
        assertThat(converted.getMDCPropertyMap()).containsEntry(CifEngine.MDC_DOCUMENT, "sample.cif");

        ILoggingEvent unmapped = events("No dictionary mapping").get(0);
        assertThat(unmapped.getLevel()).isEqualTo(Level.WARN);
        assertThat(unmapped.getFormattedMessage()).contains("_shelx_res_file");
    }

    @Test
    @DisplayName("Aborted rule run logs a warning with the failing field")
    void abortedRuleRunLogsWarning() {
        Document document = engine.parse("data_x\n_a_b 1\n", "rules.cif");

        engine.applyRules(document, List.of(new Rule.Calculate(
                "_a_b", new io.cifxform.core.rules.Expression.FieldRef("_missing_x"), "_missing_x", 0)));

        assertThat(events("Rule run aborted")).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage()).contains("field=_a_b");
            assertThat(event.getMDCPropertyMap()).containsEntry(CifEngine.MDC_DOCUMENT, "rules.cif");
        });
        assertThat(events("Applied rules")).singleElement().satisfies(event -> assertThat(
                        event.getFormattedMessage())
                .endsWith("rules=1, ran=1, aborted=true"));
    }

    @Test
    @DisplayName("Dictionary swap and skipped sources are logged")
    void dictionarySwapIsLogged() {
        engine.loadDictionaries(List.of(new DictionarySource("junk.dic", "not a dictionary")));

        assertThat(events("Skipping dictionary")).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage()).contains("source=junk.dic", "Unrecognized dictionary format");
        });
        assertThat(events("Dictionaries swapped")).singleElement().satisfies(event -> assertThat(
                        event.getFormattedMessage())
                .isEqualTo("Dictionaries swapped: fields=0, sources=[], previousFields=14"));
        assertThat(engine.dictionaries().isEmpty()).isTrue();
    }
}
