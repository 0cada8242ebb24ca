package org.minic.compiler.diagnostics;

/**
 * The line the scanner is currently on, used only to prefix diagnostics.
 * Starts at 1 and only ever moves forward during one compilation.
 */
public final class SourceLine {

    private int current = 1;

    /**
     * @return The current line number.
     */
    public int current() {
        return current;
    }

    /**
     * Moves to the next line.
     * @return The new line number.
     */
    public int advance() {
        return ++current;
    }
}
