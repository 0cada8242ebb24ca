package org.minic.compiler.frontend.parser.features.decl;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.parser.ast.RenderSupport;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Type;

import java.util.Objects;

/**
 * Declares a fixed-size array, rendered as {@code type name[size];}.
 * The size expression is kept verbatim; bounds are not checked here.
 */
public final class ArrayDecl implements AstNode {

    private final Type elementType;
    private final String name;
    private final String size;
    private final boolean failed;

    /**
     * @param context The analysis context.
     * @param elementType The element type.
     * @param name The identifier.
     * @param size The bound size expression as written.
     */
    public ArrayDecl(AnalysisContext context, Type elementType, String name, String size) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        this.name = Objects.requireNonNull(name, "name");
        this.size = Objects.requireNonNull(size, "size");
        boolean declared = context.scope().declareArray(name, elementType, size);
        if (!declared) {
            context.diagnostics().reportMultipleDefinition(name);
        }
        this.failed = !declared;
    }

    public String name() {
        return name;
    }

    public String size() {
        return size;
    }

    @Override
    public Type type() {
        return elementType;
    }

    @Override
    public boolean hasError() {
        return failed;
    }

    @Override
    public String render(int depth) {
        return RenderSupport.indent(depth) + elementType.targetName() + " " + name + "[" + size + "];";
    }
}
