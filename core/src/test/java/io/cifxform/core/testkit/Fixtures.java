package io.cifxform.core.testkit;

import static org.assertj.core.api.Assertions.assertThat;

import io.cifxform.core.dictionary.DictionaryManager;
import io.cifxform.core.dictionary.DictionarySet;
import io.cifxform.core.model.Block;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Entry;
import io.cifxform.core.model.Span;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Test resources and structural assertions shared across packages. */
public final class Fixtures {

    private static final Path ROOT = Path.of("src/test/resources");

    private static DictionarySet miniCore;

    private Fixtures() {}

    /** The reduced DDLm core dictionary, loaded once per test run. */
    public static synchronized DictionarySet miniCore() {
        if (miniCore == null) {
            miniCore = new DictionaryManager().load(path("dictionaries/mini_core.dic"));
        }
        return miniCore;
    }

    public static Path path(String relative) {
        return ROOT.resolve(relative);
    }

    public static String read(String relative) {
        try {
            return Files.readString(path(relative), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Asserts that the extents of all entries cover the text contiguously, start to end. */
    public static void assertExtentsTile(Document document) {
        List<Span> spans = new ArrayList<>();
        for (Entry entry : document.leading()) {
            spans.add(entry.extent());
        }
        for (Block block : document.blocks()) {
            spans.add(block.headerExtent());
            for (Entry entry : block.entries()) {
                spans.add(entry.extent());
            }
        }
        int cursor = 0;
        for (Span span : spans) {
            assertThat(span.start()).as("extent %s starts where the previous ended", span).isEqualTo(cursor);
            cursor = span.end();
        }
        assertThat(cursor).as("extents reach the end of the text").isEqualTo(document.text().length());
    }

    /** Asserts that every loop row holds one value per column. */
    public static void assertLoopShapes(Document document) {
        for (Block block : document.blocks()) {
            for (Entry.Loop loop : block.loops()) {
                for (var row : loop.rows()) {
                    assertThat(row).hasSameSizeAs(loop.columns());
                }
            }
        }
    }
}
