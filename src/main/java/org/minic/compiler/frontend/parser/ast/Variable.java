package org.minic.compiler.frontend.parser.ast;

import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.frontend.semantics.Symbol;
import org.minic.compiler.types.Type;

import java.util.Objects;
import java.util.Optional;

/**
 * A use of a scalar variable. Resolves its declaration on construction.
 */
public final class Variable implements Lvalue {

    private final String name;
    private final Type type;
    private final boolean failed;

    /**
     * Resolves {@code name} in the current scope. An unknown name is reported as
     * UNDECLARED_VARIABLE and leaves this node with type {@link Type#ANY}.
     *
     * @param context The analysis context.
     * @param name The identifier.
     */
    public Variable(AnalysisContext context, String name) {
        this.name = Objects.requireNonNull(name, "name");
        Optional<Symbol> symbol = context.scope().lookup(name);
        if (symbol.isPresent()) {
            this.type = symbol.get().type();
            this.failed = false;
        } else {
            context.diagnostics().reportUndeclaredVariable(name);
            this.type = Type.ANY;
            this.failed = true;
        }
    }

    public String name() {
        return name;
    }

    @Override
    public Type type() {
        return type;
    }

    @Override
    public boolean hasError() {
        return failed;
    }

    @Override
    public String render(int depth) {
        return RenderSupport.indent(depth) + name;
    }
}
