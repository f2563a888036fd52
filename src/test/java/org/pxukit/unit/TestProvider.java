package org.pxukit.unit;

import java.util.Map;

final class TestProvider implements UnitProvider {
    private final Map<String, String> translations;

    TestProvider(final Map<String, String> translations) {
        this.translations = translations;
    }

    TestProvider() {
        this(Map.of());
    }

    @Override
    public String name() {
        return "2013.org.example:test";
    }

    @Override
    public String namespace() {
        return "2013.org.example";
    }

    @Override
    public String translate(final String msgid) {
        return translations.getOrDefault(msgid, msgid);
    }
}
