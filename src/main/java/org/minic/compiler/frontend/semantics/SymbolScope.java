package org.minic.compiler.frontend.semantics;

import org.minic.compiler.types.Type;

import java.util.List;
import java.util.Optional;

/**
 * The name store the AST consults while it validates itself.
 * <p>
 * Nodes only insert and look up. Entering and leaving nested scopes is the caller's
 * responsibility and happens in the same order as tree construction.
 */
public interface SymbolScope {

    /**
     * Declares a scalar variable in the innermost scope.
     * @param name The identifier.
     * @param type The declared type.
     * @return {@code false} if the name is already declared in the innermost scope; the
     *         existing declaration is kept.
     */
    boolean declare(String name, Type type);

    /**
     * Declares an array variable in the innermost scope.
     * @param name The identifier.
     * @param elementType The element type.
     * @param sizeText The bound size expression as written.
     * @return {@code false} if the name is already declared in the innermost scope.
     */
    boolean declareArray(String name, Type elementType, String sizeText);

    /**
     * Resolves a variable, searching from the innermost scope outwards.
     * @param name The identifier.
     * @return The visible declaration, or empty if there is none.
     */
    Optional<Symbol> lookup(String name);

    /**
     * Declares a function signature.
     * @param name The function name.
     * @param parameterTypes The parameter types, in order.
     * @param returnType The return type.
     * @return {@code false} if a function of that name is already declared.
     */
    boolean declareFunction(String name, List<Type> parameterTypes, Type returnType);

    /**
     * @param name The function name.
     * @return The declared signature, or empty if the function is unknown.
     */
    Optional<FunctionSignature> lookupFunction(String name);

    /**
     * Records that a body has been supplied for a declared function.
     * @param name The function name.
     * @return {@code false} if the function already had a body.
     */
    boolean markDefined(String name);

    /**
     * @param name The function name.
     * @return {@code true} once {@link #markDefined(String)} succeeded for the name.
     */
    boolean isDefined(String name);

    /**
     * Opens a nested scope.
     */
    void enterScope();

    /**
     * Closes the innermost scope. Has no effect on the global scope.
     */
    void leaveScope();
}
