package org.minic.compiler.diagnostics;

import org.minic.compiler.internal.i18n.Messages;

/**
 * Represents a single semantic error detected while building the tree.
 *
 * @param kind The kind of error.
 * @param message The fully formatted message, without the line prefix.
 * @param lineNumber The source line that was current when the error was detected.
 */
public record Diagnostic(
        ErrorKind kind,
        String message,
        int lineNumber
) {
    @Override
    public String toString() {
        return Messages.diagnosticLine(lineNumber, message);
    }
}
