package io.cifxform.core.dictionary;

import io.cifxform.core.error.CifParseException;
import io.cifxform.core.error.DictionaryLoadException;
import io.cifxform.core.model.Block;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Entry;
import io.cifxform.core.model.Value;
import io.cifxform.core.parse.CifParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads DDLm dictionaries. Each save frame with a {@code _definition.id} is one field. Frames
 * without one are skipped, as are head and category frames ({@code _definition.scope} of
 * {@code Dictionary} or {@code Category}).
 */
final class DdlmDictionaryReader implements DictionaryReader {

    private final CifParser parser;

    DdlmDictionaryReader(CifParser parser) {
        this.parser = parser;
    }

    @Override
    public List<CanonicalField> read(DictionarySource source) {
        Document document;
        try {
            document = parser.parse(source.content(), source.name());
        } catch (CifParseException e) {
            throw new DictionaryLoadException("Malformed DDLm dictionary: " + e.getMessage(), e, source.name());
        }
        List<CanonicalField> fields = new ArrayList<>();
        for (Block block : document.blocks()) {
            if (block.kind() != Block.Kind.SAVE) {
                continue;
            }
            Optional<String> id = block.text("_definition.id");
            if (id.isPresent() && !isStructural(block)) {
                fields.add(definition(block, id.get(), source.name()));
            }
        }
        return fields;
    }

    private static boolean isStructural(Block frame) {
        return frame.text("_definition.scope")
                .map(scope -> scope.equalsIgnoreCase("Category") || scope.equalsIgnoreCase("Dictionary"))
                .orElse(false);
    }

    private static CanonicalField definition(Block frame, String id, String sourceName) {
        CanonicalField.Builder builder = CanonicalField.builder(id, sourceName);
        if (id.indexOf('.') >= 0) {
            builder.modernSpelling(id);
        }
        readAliases(frame, builder);
        builder.legacySpelling(legacySpelling(id, builder));
        frame.text("_definition_replaced.by").ifPresent(builder::deprecatedBy);
        builder.valueKind(ValueKind.fromDdlm(frame.text("_type.contents").orElse(null)));
        frame.text("_name.category_id").ifPresent(builder::category);
        for (Value state : frame.valuesOf("_enumeration_set.state")) {
            if (!state.isPlaceholder()) {
                builder.enumeratedValue(state.text());
            }
        }
        frame.text("_enumeration.default").ifPresent(builder::defaultValue);
        frame.text("_description.text").ifPresent(text -> builder.description(text.strip()));
        return builder.build();
    }

    private static void readAliases(Block frame, CanonicalField.Builder builder) {
        Optional<Entry.Loop> loop = frame.loopWithColumn("_alias.definition_id");
        if (loop.isPresent()) {
            List<Value> ids = loop.get().values("_alias.definition_id");
            List<Value> dates = loop.get().values("_alias.deprecation_date");
            for (int i = 0; i < ids.size(); i++) {
                Value date = dates.isEmpty() ? null : dates.get(i);
                builder.alias(ids.get(i).text(), date != null && !date.isPlaceholder());
            }
            return;
        }
        frame.field("_alias.definition_id").ifPresent(alias -> builder.alias(
                alias.value().text(),
                frame.field("_alias.deprecation_date")
                        .map(date -> !date.value().isPlaceholder())
                        .orElse(false)));
    }

    private static String legacySpelling(String id, CanonicalField.Builder builder) {
        String firstUndotted = null;
        for (String alias : builder.aliases()) {
            if (alias.indexOf('.') >= 0) {
                continue;
            }
            if (!builder.isDeprecatedAlias(alias)) {
                return alias;
            }
            if (firstUndotted == null) {
                firstUndotted = alias;
            }
        }
        if (firstUndotted != null) {
            return firstUndotted;
        }
        return id.indexOf('.') < 0 ? id : null;
    }
}
