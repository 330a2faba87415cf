package io.cifxform.core.dictionary;

import io.cifxform.core.error.CifParseException;
import io.cifxform.core.error.DictionaryLoadException;
import io.cifxform.core.model.Block;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Value;
import io.cifxform.core.parse.CifParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads DDL1 dictionaries. Each data block with {@code _name} defines one field per name; a
 * looped {@code _name} defines a family sharing the block's metadata. The
 * {@code data_on_this_dictionary} block is metadata and skipped.
 */
final class Ddl1DictionaryReader implements DictionaryReader {

    private static final String METADATA_BLOCK = "on_this_dictionary";

    private final CifParser parser;

    Ddl1DictionaryReader(CifParser parser) {
        this.parser = parser;
    }

    @Override
    public List<CanonicalField> read(DictionarySource source) {
        Document document;
        try {
            document = parser.parse(source.content(), source.name());
        } catch (CifParseException e) {
            throw new DictionaryLoadException("Malformed DDL1 dictionary: " + e.getMessage(), e, source.name());
        }
        List<CanonicalField> fields = new ArrayList<>();
        for (Block block : document.blocks()) {
            if (block.kind() != Block.Kind.DATA || block.name().equalsIgnoreCase(METADATA_BLOCK)) {
                continue;
            }
            String replacement = replacement(block);
            for (Value name : block.valuesOf("_name")) {
                if (name.isPlaceholder()) {
                    continue;
                }
                CanonicalField.Builder builder =
                        CanonicalField.builder(name.text(), source.name()).legacySpelling(name.text());
                block.text("_category").ifPresent(builder::category);
                builder.valueKind(ValueKind.fromDdl1(block.text("_type").orElse(null)));
                for (Value value : block.valuesOf("_enumeration")) {
                    if (!value.isPlaceholder()) {
                        builder.enumeratedValue(value.text());
                    }
                }
                block.text("_enumeration_default").ifPresent(builder::defaultValue);
                block.text("_definition").ifPresent(text -> builder.description(text.strip()));
                if (replacement != null && !replacement.equals(name.text())) {
                    builder.deprecatedBy(replacement);
                }
                fields.add(builder.build());
            }
        }
        return fields;
    }

    /** The {@code _related_item} paired with a {@code _related_function} of {@code replace}. */
    private static String replacement(Block block) {
        List<Value> items = block.valuesOf("_related_item");
        List<Value> functions = block.valuesOf("_related_function");
        for (int i = 0; i < Math.min(items.size(), functions.size()); i++) {
            if (functions.get(i).text().toLowerCase(Locale.ROOT).equals("replace")) {
                return items.get(i).text();
            }
        }
        return null;
    }
}
