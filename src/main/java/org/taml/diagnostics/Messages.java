package org.taml.diagnostics;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Internal i18n facade for parser diagnostics.
 * Uses ResourceBundles with the base name "taml_messages".
 */
public final class Messages {

    private static final String BUNDLE_BASE_NAME = "taml_messages";
    private static volatile ResourceBundle bundle = loadBundle(Locale.getDefault());

    private Messages() {}

    /**
     * Sets the locale for the message bundle.
     * @param locale The new locale.
     */
    public static void setLocale(Locale locale) {
        bundle = loadBundle(locale);
    }

    /**
     * Gets a message for the given key.
     * @param key The key of the message.
     * @return The message, or "!key!" if not found.
     */
    public static String get(String key) {
        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            return "!" + key + "!";
        }
    }

    /**
     * Gets a formatted message for the given key.
     * Numbers should be passed as strings, otherwise they are formatted with grouping separators.
     *
     * @param key The key of the message.
     * @param args The arguments for the message format.
     * @return The formatted message.
     */
    public static String get(String key, Object... args) {
        return MessageFormat.format(get(key), args);
    }

    private static ResourceBundle loadBundle(Locale locale) {
        try {
            return ResourceBundle.getBundle(BUNDLE_BASE_NAME, locale);
        } catch (MissingResourceException e) {
            return ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.ENGLISH);
        }
    }
}
