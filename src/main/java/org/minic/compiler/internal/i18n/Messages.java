package org.minic.compiler.internal.i18n;

import org.minic.compiler.diagnostics.ErrorKind;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Diagnostic texts from the "compiler_messages" bundle.
 * <p>
 * Each {@link ErrorKind} names its template; the bundle also holds the line format every
 * diagnostic is printed with. Arguments are substituted with {@link MessageFormat}, so
 * numbers should be passed as strings.
 */
public final class Messages {

    private static final String BUNDLE_BASE_NAME = "compiler_messages";
    private static final String LINE_FORMAT_KEY = "diagnostic.format";
    private static final ResourceBundle BUNDLE = ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.ROOT);

    private Messages() {}

    /**
     * @param kind The kind of semantic error.
     * @param args The values for the kind's placeholders, in template order.
     * @return The message body, without line prefix.
     */
    public static String describe(ErrorKind kind, Object... args) {
        return MessageFormat.format(template(kind.messageKey()), args);
    }

    /**
     * @param lineNumber The source line the error was detected on.
     * @param message A message produced by {@link #describe(ErrorKind, Object...)}.
     * @return The full diagnostic line, e.g. {@code [Line 3] semantic error: ...}.
     */
    public static String diagnosticLine(int lineNumber, String message) {
        return MessageFormat.format(template(LINE_FORMAT_KEY), String.valueOf(lineNumber), message);
    }

    static String template(String key) {
        try {
            return BUNDLE.getString(key);
        } catch (MissingResourceException e) {
            return "!" + key + "!";
        }
    }
}
