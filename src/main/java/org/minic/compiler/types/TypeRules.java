package org.minic.compiler.types;

/**
 * Type equality and implicit widening rules.
 * <p>
 * The only implicit conversion is integer to float. Everything else needs an explicit cast.
 */
public final class TypeRules {

    private TypeRules() {}

    /**
     * @param target The type required by the context.
     * @param source The type actually supplied.
     * @return {@code true} if both types are identical.
     */
    public static boolean matches(Type target, Type source) {
        return target == source;
    }

    /**
     * Checks whether a value of {@code source} may be used where {@code target} is
     * required by inserting an implicit cast.
     * @param target The type required by the context.
     * @param source The type actually supplied.
     * @return {@code true} only for a FLOAT target and an INT source.
     */
    public static boolean canCoerce(Type target, Type source) {
        return target == Type.FLOAT && source == Type.INT;
    }

    /**
     * @param target The type required by the context.
     * @param source The type actually supplied.
     * @return {@code true} if the source matches the target or can be coerced to it.
     */
    public static boolean isAssignable(Type target, Type source) {
        return matches(target, source) || canCoerce(target, source);
    }

    /**
     * @param type The type to test.
     * @return {@code true} for {@link Type#ANY}, which never triggers further diagnostics.
     */
    public static boolean isTerminal(Type type) {
        return type == Type.ANY;
    }
}
