package io.cifxform.core.dictionary;

import io.cifxform.core.error.DictionaryLoadException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Raw dictionary text and the name it is reported under.
 *
 * @param name    file path or URI, used in diagnostics and as {@link CanonicalField#source()}
 * @param content decoded dictionary text
 */
public record DictionarySource(String name, String content) {

    public DictionarySource {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Reads a dictionary file as UTF-8.
     *
     * @throws DictionaryLoadException if the file cannot be read or is not valid UTF-8
     */
    public static DictionarySource ofPath(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new DictionaryLoadException("Failed to read dictionary: " + e.getMessage(), e, path.toString());
        }
        return ofBytes(path.toString(), bytes);
    }

    /**
     * Decodes fetched dictionary bytes as UTF-8.
     *
     * @throws DictionaryLoadException if the bytes are not valid UTF-8
     */
    public static DictionarySource ofBytes(String name, byte[] bytes) {
        try {
            String content = StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return new DictionarySource(name, content);
        } catch (CharacterCodingException e) {
            throw new DictionaryLoadException("Dictionary is not valid UTF-8", e, name);
        }
    }
}
