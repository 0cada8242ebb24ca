package org.minic.compiler.frontend.semantics;

import org.minic.compiler.types.Type;

/**
 * Represents a single variable binding in the symbol table.
 *
 * @param name The identifier as written in the source.
 * @param type The declared type; for arrays, the element type.
 * @param kind Whether the name is bound to a scalar or an array.
 * @param arraySize The bound size expression as written, or {@code null} for scalars.
 */
public record Symbol(String name, Type type, Kind kind, String arraySize) {
    /**
     * The shape of the storage a symbol denotes.
     */
    public enum Kind {
        /** A single value. */
        SCALAR,
        /** A fixed-size array of values. */
        ARRAY
    }

    /**
     * Creates a scalar symbol.
     * @param name The identifier.
     * @param type The declared type.
     */
    public Symbol(String name, Type type) {
        this(name, type, Kind.SCALAR, null);
    }

    /**
     * @return {@code true} if this symbol was declared as an array.
     */
    public boolean isArray() {
        return kind == Kind.ARRAY;
    }
}
