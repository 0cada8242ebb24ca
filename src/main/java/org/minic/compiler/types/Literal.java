package org.minic.compiler.types;

import java.util.Objects;

/**
 * A raw lexeme as produced by the scanner, paired with its syntactic type.
 *
 * @param text The lexeme exactly as written in the source, e.g. {@code 3.5}.
 * @param type The type the scanner assigned to the lexeme.
 */
public record Literal(String text, Type type) {
    public Literal {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(type, "type");
    }
}
