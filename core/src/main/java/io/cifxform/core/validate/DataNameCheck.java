package io.cifxform.core.validate;

import java.util.Objects;

/**
 * The classification of one data name occurrence.
 *
 * @param block               name of the block holding it
 * @param name                the data name as written
 * @param line                1-based line of the field or loop
 * @param category            the classification
 * @param canonicalId         canonical id when the name resolves, otherwise {@code null}
 * @param replacement         spelling to use instead when {@link FieldCategory#DEPRECATED},
 *                            otherwise {@code null}
 * @param localPrefix         registered prefix the name carries, leading or embedded after its
 *                            category, otherwise {@code null}
 * @param suggestedName       dotted form of a name whose prefix sits after its category, such as
 *                            {@code _diffrn.oxdiff_ac3_digest}, otherwise {@code null}
 * @param suggestedDictionary dictionary file likely to define the name, otherwise {@code null}
 */
public record DataNameCheck(
        String block,
        String name,
        int line,
        FieldCategory category,
        String canonicalId,
        String replacement,
        String localPrefix,
        String suggestedName,
        String suggestedDictionary) {

    public DataNameCheck {
        Objects.requireNonNull(block, "block must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
    }

    static DataNameCheck defined(String block, String name, int line, FieldCategory category, String canonicalId,
            String replacement) {
        return new DataNameCheck(block, name, line, category, canonicalId, replacement, null, null, null);
    }
}
