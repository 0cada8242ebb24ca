package org.minic.compiler.frontend.parser.features.memory;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.parser.ast.Lvalue;
import org.minic.compiler.frontend.parser.ast.RenderSupport;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.frontend.semantics.Symbol;
import org.minic.compiler.types.Type;
import org.minic.compiler.types.TypeRules;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An array element access, rendered as {@code name[index]}. Its type is the array's
 * element type.
 * <p>
 * Only the first problem is reported, in this order: unknown name, non-array name,
 * failed index, non-integer index.
 */
public final class ArrayIndex implements Lvalue {

    private final String name;
    private final AstNode index;
    private final Type type;
    private final boolean failed;

    /**
     * @param context The analysis context.
     * @param name The array name.
     * @param index The index expression, which must be an integer.
     */
    public ArrayIndex(AnalysisContext context, String name, AstNode index) {
        this.name = Objects.requireNonNull(name, "name");
        this.index = Objects.requireNonNull(index, "index");

        Optional<Symbol> symbol = context.scope().lookup(name);
        Type indexType = index.type();
        boolean ok = false;
        if (symbol.isEmpty()) {
            context.diagnostics().reportUndeclaredVariable(name);
        } else if (!symbol.get().isArray()) {
            context.diagnostics().reportNonArrayIndex();
        } else if (index.hasError() || TypeRules.isTerminal(indexType)) {
            // already reported by the index itself
        } else if (!TypeRules.matches(Type.INT, indexType)) {
            context.diagnostics().reportIncompatibleIndex(Type.INT, indexType);
        } else {
            ok = true;
        }
        this.failed = !ok;
        this.type = ok ? symbol.get().type() : Type.ANY;
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
        return RenderSupport.indent(depth) + name + "[" + index.render(0) + "]";
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(index);
    }
}
