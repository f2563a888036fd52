package org.pxukit.provider;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Translations for the gettext domain of a provider.
 */
@FunctionalInterface
public interface MessageCatalog {
    Optional<String> lookup(String msgid);

    static MessageCatalog empty() {
        return msgid -> Optional.empty();
    }

    static MessageCatalog of(final Map<String, String> translations) {
        final Map<String, String> copy = Map.copyOf(Objects.requireNonNull(translations, "translations"));
        return msgid -> Optional.ofNullable(copy.get(msgid));
    }
}
