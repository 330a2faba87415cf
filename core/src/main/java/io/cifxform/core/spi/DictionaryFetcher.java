package io.cifxform.core.spi;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * SPI for retrieving dictionary sources from outside the local filesystem.
 *
 * <p>
 * The core never opens network connections itself; an embedding application supplies an
 * implementation backed by whatever client it already uses. Retries, caching and authentication
 * belong to the implementation. The core applies no timeout of its own and passes the caller's
 * budget through unchanged.
 *
 * <p>
 * Implementations MUST be thread-safe if the same instance is shared across loads.
 */
@FunctionalInterface
public interface DictionaryFetcher {

    /**
     * Retrieves the raw bytes of a dictionary.
     *
     * @param uri     location of the dictionary
     * @param timeout upper bound the implementation should respect
     * @return the dictionary content, expected to be UTF-8
     * @throws IOException if the dictionary cannot be retrieved within the timeout
     */
    byte[] fetch(URI uri, Duration timeout) throws IOException;
}
