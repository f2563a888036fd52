package org.pxukit.unit;

/**
 * Non-owning view of the provider a unit was loaded for.
 *
 * <p>Units only use it to qualify identifiers with a namespace and to translate field values.
 */
public interface UnitProvider {
    String name();

    /**
     * Namespace that partial identifiers of this provider's units are qualified with.
     */
    String namespace();

    /**
     * Translated form of {@code msgid}, or {@code msgid} itself when no translation is known.
     */
    String translate(String msgid);
}
