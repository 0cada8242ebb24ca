package org.minic.compiler.frontend.parser.features.decl;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.parser.ast.RenderSupport;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Type;
import org.minic.compiler.types.TypeRules;

import java.util.List;
import java.util.Objects;

/**
 * A single variable binding with an optional initializer, rendered as
 * {@code type name [= initializer];}.
 * <p>
 * The initializer must have exactly the declared type; declarations do not coerce.
 */
public final class VarDecl implements AstNode {

    private final Type type;
    private final String name;
    private final AstNode initializer;
    private final boolean declared;
    private final boolean failed;

    /**
     * Inserts {@code name} into the current scope and checks the initializer.
     *
     * @param context The analysis context.
     * @param type The declared type.
     * @param name The identifier.
     * @param initializer The initial value, or {@code null}.
     */
    public VarDecl(AnalysisContext context, Type type, String name, AstNode initializer) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = Objects.requireNonNull(name, "name");
        this.initializer = initializer;

        this.declared = context.scope().declare(name, type);
        boolean ok = declared;
        if (!declared) {
            context.diagnostics().reportMultipleDefinition(name);
        }
        if (initializer != null) {
            if (initializer.hasError() || TypeRules.isTerminal(initializer.type())) {
                ok = false;
            } else if (!TypeRules.matches(type, initializer.type())) {
                context.diagnostics().reportIncompatibleAssignment(type, initializer.type());
                ok = false;
            }
        }
        this.failed = !ok;
    }

    /**
     * @param context The analysis context.
     * @param type The declared type.
     * @param name The identifier.
     */
    public VarDecl(AnalysisContext context, Type type, String name) {
        this(context, type, name, null);
    }

    public String name() {
        return name;
    }

    /**
     * @return {@code false} if the scope rejected the name as a redeclaration.
     */
    public boolean isDeclared() {
        return declared;
    }

    public boolean hasInitializer() {
        return initializer != null;
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
        StringBuilder out = new StringBuilder(RenderSupport.indent(depth))
                .append(type.targetName()).append(' ').append(name);
        if (initializer != null) {
            out.append(" = ").append(initializer.render(0));
        }
        return out.append(';').toString();
    }

    @Override
    public List<AstNode> getChildren() {
        return initializer == null ? List.of() : List.of(initializer);
    }
}
