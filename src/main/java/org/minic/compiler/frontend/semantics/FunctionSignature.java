package org.minic.compiler.frontend.semantics;

import org.minic.compiler.types.Type;

import java.util.List;

/**
 * The declared shape of a function, used to check calls against it.
 *
 * @param name The function name.
 * @param parameterTypes The parameter types, in declaration order.
 * @param returnType The declared return type.
 */
public record FunctionSignature(String name, List<Type> parameterTypes, Type returnType) {
    public FunctionSignature {
        parameterTypes = List.copyOf(parameterTypes);
    }

    /**
     * @return The number of declared parameters.
     */
    public int arity() {
        return parameterTypes.size();
    }

    /**
     * Checks whether another declaration of the same name describes the same function.
     * @param other The other signature.
     * @return {@code true} if parameter types and return type are identical.
     */
    public boolean sameShapeAs(FunctionSignature other) {
        return parameterTypes.equals(other.parameterTypes) && returnType == other.returnType;
    }
}
