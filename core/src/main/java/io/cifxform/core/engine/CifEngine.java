package io.cifxform.core.engine;

import io.cifxform.core.config.CifConfig;
import io.cifxform.core.convert.AliasOutcome;
import io.cifxform.core.convert.AliasResolver;
import io.cifxform.core.convert.CifVersion;
import io.cifxform.core.convert.FormatConverter;
import io.cifxform.core.convert.NotationDetector;
import io.cifxform.core.dictionary.DictionaryLoadResult;
import io.cifxform.core.dictionary.DictionaryManager;
import io.cifxform.core.dictionary.DictionarySet;
import io.cifxform.core.dictionary.DictionarySource;
import io.cifxform.core.dictionary.DictionarySuggester;
import io.cifxform.core.dictionary.PrefixRegistry;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Notation;
import io.cifxform.core.model.TransformOutcome;
import io.cifxform.core.parse.CifParser;
import io.cifxform.core.rewrite.RewriteEngine;
import io.cifxform.core.rewrite.ValueFormatter;
import io.cifxform.core.rules.Rule;
import io.cifxform.core.rules.RuleEngine;
import io.cifxform.core.rules.RuleParser;
import io.cifxform.core.rules.RuleRunResult;
import io.cifxform.core.validate.DocumentValidator;
import io.cifxform.core.validate.RuleSetValidator;
import io.cifxform.core.validate.ValidationReport;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point tying the parser, dictionaries, converter, alias resolver, rule engine and
 * validator together.
 *
 * <p>
 * Thread-safe: the current {@link DictionarySet} sits in an {@link AtomicReference}.
 * {@link #loadDictionaries} and {@link #reload} build a complete new set and swap it in; a call
 * already running keeps the snapshot it started with.
 */
public final class CifEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CifEngine.class);

    /** MDC key holding the source name of the document being processed. */
    public static final String MDC_DOCUMENT = "cif.document";

    private final CifParser parser;
    private final DictionaryManager dictionaryManager;
    private final RewriteEngine rewriteEngine;
    private final RuleEngine ruleEngine;
    private final NotationDetector notationDetector = new NotationDetector();
    private final DictionarySuggester suggester = DictionarySuggester.bundled();
    private final PrefixRegistry prefixRegistry;
    private final CifConfig config;
    private final List<Rule> configuredRules;
    private final AtomicReference<DictionarySet> dictionariesRef = new AtomicReference<>(DictionarySet.empty());

    /** Creates an engine with default settings and no dictionaries. */
    public CifEngine() {
        this(CifConfig.defaults(), List.of());
    }

    private CifEngine(CifConfig config, List<Rule> configuredRules) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.configuredRules = List.copyOf(configuredRules);
        this.parser = new CifParser();
        this.dictionaryManager = new DictionaryManager(parser);
        this.rewriteEngine = new RewriteEngine(parser);
        this.ruleEngine = new RuleEngine(rewriteEngine, new ValueFormatter());
        PrefixRegistry registry = config.prefixRegistry() == null
                ? PrefixRegistry.bundled()
                : PrefixRegistry.load(config.prefixRegistry());
        this.prefixRegistry = registry.withPrefixes(config.registeredPrefixes());
    }

    /**
     * Creates an engine from a configuration: loads its dictionaries (skipping broken ones with a
     * warning) and parses its rule file, if any.
     *
     * @throws io.cifxform.core.error.RuleParseException if the configured rule file is invalid
     * @throws io.cifxform.core.error.ConfigLoadException if the configured prefix registry is
     *                                                    missing or malformed
     */
    public static CifEngine fromConfig(CifConfig config) {
        List<Rule> rules = config.rules() == null ? List.of() : new RuleParser().parse(config.rules());
        CifEngine engine = new CifEngine(config, rules);
        if (!config.dictionaries().isEmpty()) {
            engine.reload(config.dictionaries());
        }
        return engine;
    }

    // ── Dictionaries ──

    /** Loads and merges the sources, lowest precedence first, and swaps the result in. */
    public DictionaryLoadResult loadDictionaries(List<DictionarySource> sources) {
        return swap(dictionaryManager.loadAll(sources));
    }

    /** Like {@link #loadDictionaries}, reading the files first. */
    public DictionaryLoadResult reload(List<Path> paths) {
        return swap(dictionaryManager.loadFiles(paths));
    }

    /** Returns the current snapshot. */
    public DictionarySet dictionaries() {
        return dictionariesRef.get();
    }

    /** The prefix registry in use, including the configured extra prefixes. */
    public PrefixRegistry prefixRegistry() {
        return prefixRegistry;
    }

    public CifConfig config() {
        return config;
    }

    /** Rules read from the configured rule file; empty when none is configured. */
    public List<Rule> configuredRules() {
        return configuredRules;
    }

    private DictionaryLoadResult swap(DictionaryLoadResult result) {
        DictionarySet previous = dictionariesRef.getAndSet(result.set());
        LOG.info(
                "Dictionaries swapped: fields={}, sources={}, previousFields={}",
                result.set().size(),
                result.set().sources(),
                previous.size());
        return result;
    }

    // ── Documents ──

    public Document parse(byte[] bytes, String sourceName) {
        return withDocument(sourceName, () -> {
            Document document = parser.parse(bytes, sourceName);
            LOG.info("Parsed document: blocks={}", document.blocks().size());
            return document;
        });
    }

    public Document parse(String text) {
        return parse(text, CifParser.IN_MEMORY);
    }

    public Document parse(String text, String sourceName) {
        return withDocument(sourceName, () -> {
            Document document = parser.parse(text, sourceName);
            LOG.info("Parsed document: blocks={}", document.blocks().size());
            return document;
        });
    }

    public String serialize(Document document) {
        return document.serialize();
    }

    public byte[] serializeBytes(Document document) {
        return document.toBytes();
    }

    /** Converts to the configured target notation. */
    public TransformOutcome convert(Document document) {
        return convert(document, config.targetNotation());
    }

    public TransformOutcome convert(Document document, Notation target) {
        DictionarySet snapshot = dictionariesRef.get();
        return withDocument(
                document.sourceName(),
                () -> new FormatConverter(snapshot, rewriteEngine, config.caseFallback()).convert(document, target));
    }

    public AliasOutcome resolveAliases(Document document) {
        DictionarySet snapshot = dictionariesRef.get();
        return withDocument(
                document.sourceName(),
                () -> new AliasResolver(snapshot, rewriteEngine, config.caseFallback()).resolveAliases(document));
    }

    /** Applies the rules to the first data block. */
    public RuleRunResult applyRules(Document document, List<Rule> rules) {
        return withDocument(document.sourceName(), () -> ruleEngine.apply(document, rules));
    }

    public RuleRunResult applyRules(Document document, String blockName, List<Rule> rules) {
        return withDocument(document.sourceName(), () -> ruleEngine.apply(document, blockName, rules));
    }

    public ValidationReport validate(Document document) {
        DictionarySet snapshot = dictionariesRef.get();
        DocumentValidator validator =
                new DocumentValidator(snapshot, prefixRegistry, config.allowedFields(), config.caseFallback());
        return withDocument(document.sourceName(), () -> validator.validate(document));
    }

    /** Specialized dictionaries the document's names call for, most confident first. */
    public List<DictionarySuggester.DictionarySuggestion> suggestDictionaries(Document document) {
        return withDocument(document.sourceName(), () -> suggester.suggest(document));
    }

    /** Checks rules against the configured target notation. */
    public RuleSetValidator.RuleSetReport validateRules(List<Rule> rules) {
        return new RuleSetValidator(dictionariesRef.get(), prefixRegistry).validate(rules, config.targetNotation());
    }

    /** Checks rules against the notation the document mostly uses. */
    public RuleSetValidator.RuleSetReport validateRules(List<Rule> rules, Document document) {
        RuleSetValidator validator = new RuleSetValidator(dictionariesRef.get(), prefixRegistry);
        return withDocument(document.sourceName(), () -> validator.validate(rules, document));
    }

    public CifVersion detectVersion(Document document) {
        return withDocument(document.sourceName(), () -> {
            CifVersion version = notationDetector.detect(document);
            LOG.info("Detected version: version={}", version);
            return version;
        });
    }

    private static <T> T withDocument(String sourceName, Supplier<T> call) {
        String previous = MDC.get(MDC_DOCUMENT);
        MDC.put(MDC_DOCUMENT, sourceName);
        try {
            return call.get();
        } finally {
            if (previous == null) {
                MDC.remove(MDC_DOCUMENT);
            } else {
                MDC.put(MDC_DOCUMENT, previous);
            }
        }
    }
}
