package io.cifxform.core.dictionary;

import java.util.List;

/** Turns the text of one dictionary dialect into field definitions. */
interface DictionaryReader {

    /**
     * Reads every field definition in the source, in declaration order.
     *
     * @throws io.cifxform.core.error.DictionaryLoadException if the source is malformed
     */
    List<CanonicalField> read(DictionarySource source);
}
