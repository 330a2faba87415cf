package io.cifxform.core.dictionary;

import io.cifxform.core.error.DictionaryLoadException;
import io.cifxform.core.model.ChangeLog;
import io.cifxform.core.parse.CifParser;
import io.cifxform.core.spi.DictionaryFetcher;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads dictionary sources into {@link DictionarySet}s and merges them by precedence.
 *
 * <p>
 * The dialect of each source is detected from its content. DDLm and DDL1 are read with the CIF
 * parser; DDL2 and unrecognized sources are rejected.
 *
 * <p>
 * Loading has no side effects beyond building the returned set, so it can be repeated freely.
 * Thread-safe.
 */
public final class DictionaryManager {

    private static final Logger LOG = LoggerFactory.getLogger(DictionaryManager.class);

    private final DictionaryReader ddlmReader;
    private final DictionaryReader ddl1Reader;
    private final LegacySpellingExtensions extensions;

    public DictionaryManager() {
        this(new CifParser());
    }

    public DictionaryManager(CifParser parser) {
        this(parser, LegacySpellingExtensions.bundled());
    }

    /** @param extensions legacy spellings filled in for dotted-only definitions */
    public DictionaryManager(CifParser parser, LegacySpellingExtensions extensions) {
        Objects.requireNonNull(parser, "parser must not be null");
        this.ddlmReader = new DdlmDictionaryReader(parser);
        this.ddl1Reader = new Ddl1DictionaryReader(parser);
        this.extensions = Objects.requireNonNull(extensions, "extensions must not be null");
    }

    /**
     * Loads one dictionary.
     *
     * @throws DictionaryLoadException if the source is malformed, of an unsupported dialect, or
     *                                 defines no fields
     */
    public DictionarySet load(DictionarySource source) {
        DictionaryFormat format = DictionaryFormat.detect(source.content());
        DictionaryReader reader = switch (format) {
            case DDLM -> ddlmReader;
            case DDL1 -> ddl1Reader;
            case DDL2 -> throw new DictionaryLoadException(
                    "DDL2 (mmCIF) dictionaries are not supported", source.name());
            case UNKNOWN -> throw new DictionaryLoadException(
                    "Unrecognized dictionary format", source.name());
        };
        List<CanonicalField> fields = reader.read(source);
        if (fields.isEmpty()) {
            throw new DictionaryLoadException("Dictionary defines no fields", source.name());
        }
        DictionarySet.Builder builder = DictionarySet.builder().source(source.name());
        Set<String> claimed = new HashSet<>();
        for (CanonicalField field : fields) {
            claimed.addAll(field.spellings());
        }
        for (CanonicalField field : fields) {
            builder.add(extend(field, claimed, builder));
        }
        DictionarySet set = builder.build();
        LOG.info(
                "Loaded dictionary: source={}, format={}, fields={}, conflicts={}, extensions={}",
                source.name(),
                format,
                set.size(),
                set.conflicts().size(),
                set.legacyExtensions().size());
        return set;
    }

    private CanonicalField extend(CanonicalField field, Set<String> claimed, DictionarySet.Builder builder) {
        if (field.legacySpelling() != null || field.modernSpelling() == null) {
            return field;
        }
        Optional<String> legacy = extensions.legacyFor(field.modernSpelling());
        if (legacy.isEmpty() || !claimed.add(legacy.get())) {
            return field;
        }
        builder.legacyExtension(legacy.get());
        LOG.debug("Legacy spelling extension: {} -> {}", legacy.get(), field.canonicalId());
        return field.withLegacySpelling(legacy.get());
    }

    /** Reads and loads one dictionary file. */
    public DictionarySet load(Path path) {
        return load(DictionarySource.ofPath(path));
    }

    /**
     * Merges sets ordered by ascending precedence: a later set takes over every spelling and
     * canonical id it shares with an earlier one, and each takeover is recorded as a
     * {@link MergeConflict}.
     */
    public DictionarySet merge(List<DictionarySet> sets) {
        DictionarySet.Builder builder = DictionarySet.builder();
        for (DictionarySet set : sets) {
            builder.carry(set);
            for (String sourceName : set.sources()) {
                builder.source(sourceName);
                for (CanonicalField field : set.fields()) {
                    if (field.source().equals(sourceName)) {
                        builder.add(field);
                    }
                }
            }
        }
        return builder.build();
    }

    /**
     * Loads every source and merges the ones that succeed. A source that fails is skipped with a
     * warning in the returned change log.
     */
    public DictionaryLoadResult loadAll(List<DictionarySource> sources) {
        List<DictionarySet> loaded = new ArrayList<>();
        ChangeLog.Builder log = ChangeLog.builder();
        for (DictionarySource source : sources) {
            try {
                loaded.add(load(source));
            } catch (DictionaryLoadException e) {
                skip(log, source.name(), e);
            }
        }
        return merged(loaded, log);
    }

    /** Like {@link #loadAll}, reading each file first; unreadable files are skipped as well. */
    public DictionaryLoadResult loadFiles(List<Path> paths) {
        List<DictionarySet> loaded = new ArrayList<>();
        ChangeLog.Builder log = ChangeLog.builder();
        for (Path path : paths) {
            try {
                loaded.add(load(path));
            } catch (DictionaryLoadException e) {
                skip(log, path.toString(), e);
            }
        }
        return merged(loaded, log);
    }

    /**
     * Retrieves a dictionary through the fetcher and loads it. The fetcher owns retries; a failed
     * fetch is reported once.
     *
     * @throws DictionaryLoadException if the fetch fails or the content cannot be loaded
     */
    public DictionarySet fetch(DictionaryFetcher fetcher, URI uri, Duration timeout) {
        byte[] bytes;
        try {
            bytes = fetcher.fetch(uri, timeout);
        } catch (IOException e) {
            throw new DictionaryLoadException("Failed to fetch dictionary: " + e.getMessage(), e, uri.toString());
        }
        return load(DictionarySource.ofBytes(uri.toString(), bytes));
    }

    private static void skip(ChangeLog.Builder log, String sourceName, DictionaryLoadException e) {
        LOG.warn("Skipping dictionary source={}: {}", sourceName, e.getMessage());
        log.warning("DICTIONARY_SKIPPED", "Dictionary " + sourceName + " skipped: " + e.getMessage(), null);
    }

    private DictionaryLoadResult merged(List<DictionarySet> loaded, ChangeLog.Builder log) {
        DictionarySet set = loaded.size() == 1 ? loaded.get(0) : merge(loaded);
        return new DictionaryLoadResult(set, log.build().plus(set.warnings()));
    }
}
