package org.minic.compiler.frontend.semantics;

import org.minic.compiler.diagnostics.CompilerLogger;
import org.minic.compiler.types.Type;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A symbol table with nested lexical scopes.
 * Variables are resolved from the current scope upwards to the root; functions are global.
 */
public class SymbolTable implements SymbolScope {

    /**
     * Represents a single scope in the symbol table.
     */
    static final class Scope {
        private final Scope parent;
        private final int depth;
        private final Map<String, Symbol> symbols = new HashMap<>();

        Scope(Scope parent) {
            this.parent = parent;
            this.depth = parent == null ? 0 : parent.depth + 1;
        }
    }

    private final Scope rootScope = new Scope(null);
    private Scope currentScope = rootScope;
    private final Map<String, FunctionSignature> functions = new LinkedHashMap<>();
    private final Set<String> definedFunctions = new HashSet<>();

    @Override
    public boolean declare(String name, Type type) {
        return insert(new Symbol(name, type));
    }

    @Override
    public boolean declareArray(String name, Type elementType, String sizeText) {
        return insert(new Symbol(name, elementType, Symbol.Kind.ARRAY, sizeText));
    }

    private boolean insert(Symbol symbol) {
        if (currentScope.symbols.containsKey(symbol.name())) {
            return false;
        }
        currentScope.symbols.put(symbol.name(), symbol);
        CompilerLogger.trace("Declared " + symbol.name() + " at scope depth " + currentScope.depth);
        return true;
    }

    @Override
    public Optional<Symbol> lookup(String name) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean declareFunction(String name, List<Type> parameterTypes, Type returnType) {
        if (functions.containsKey(name)) {
            return false;
        }
        functions.put(name, new FunctionSignature(name, parameterTypes, returnType));
        return true;
    }

    @Override
    public Optional<FunctionSignature> lookupFunction(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    @Override
    public boolean markDefined(String name) {
        return definedFunctions.add(name);
    }

    @Override
    public boolean isDefined(String name) {
        return definedFunctions.contains(name);
    }

    @Override
    public void enterScope() {
        currentScope = new Scope(currentScope);
    }

    @Override
    public void leaveScope() {
        if (currentScope.parent != null) {
            currentScope = currentScope.parent;
        }
    }

    /**
     * @return The nesting depth of the current scope; 0 for the global scope.
     */
    public int depth() {
        return currentScope.depth;
    }

    /**
     * @return All declared function signatures, in declaration order.
     */
    public List<FunctionSignature> functions() {
        return List.copyOf(functions.values());
    }
}
