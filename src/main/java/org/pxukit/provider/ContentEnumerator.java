package org.pxukit.provider;

import java.io.IOException;

/**
 * Lists every file reachable from the directories of a provider.
 */
@FunctionalInterface
public interface ContentEnumerator {
    /**
     * Enumerates content files.
     *
     * @throws IOException when a content directory exists but cannot be walked at all
     */
    ContentEnumeration enumerate() throws IOException;
}
