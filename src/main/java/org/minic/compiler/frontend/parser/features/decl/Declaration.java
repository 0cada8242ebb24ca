package org.minic.compiler.frontend.parser.features.decl;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.parser.ast.Constant;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Literal;
import org.minic.compiler.types.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A declaration statement that introduces one or more variables of the same type,
 * e.g. {@code int x, y = 5}. Bindings are added one at a time as the parser reduces them
 * and render one per line.
 */
public final class Declaration implements AstNode {

    /** The kind label used when none is given. */
    public static final String DEFAULT_KIND = "var";

    private final AnalysisContext context;
    private final Type type;
    private final String kindLabel;
    private final List<VarDecl> bindings = new ArrayList<>();

    /**
     * @param context The analysis context.
     * @param type The type shared by all bindings.
     * @param kindLabel A label reserved for target-specific declaration sugar; not rendered.
     */
    public Declaration(AnalysisContext context, Type type, String kindLabel) {
        this.context = Objects.requireNonNull(context, "context");
        this.type = Objects.requireNonNull(type, "type");
        this.kindLabel = Objects.requireNonNull(kindLabel, "kindLabel");
    }

    public Declaration(AnalysisContext context, Type type) {
        this(context, type, DEFAULT_KIND);
    }

    /**
     * Adds an uninitialized binding.
     * @param name The identifier.
     * @return This declaration.
     */
    public Declaration add(String name) {
        return add(name, (AstNode) null);
    }

    /**
     * Adds a binding initialized with an expression.
     * A redeclared name is reported but still kept for rendering.
     * @param name The identifier.
     * @param initializer The initial value, or {@code null}.
     * @return This declaration.
     */
    public Declaration add(String name, AstNode initializer) {
        bindings.add(new VarDecl(context, type, name, initializer));
        return this;
    }

    /**
     * Adds a binding initialized with a scanner literal.
     * @param name The identifier.
     * @param literal The literal value.
     * @return This declaration.
     */
    public Declaration add(String name, Literal literal) {
        return add(name, new Constant(literal));
    }

    public String kindLabel() {
        return kindLabel;
    }

    /**
     * @return The number of bindings, including rejected redeclarations.
     */
    public int size() {
        return bindings.size();
    }

    @Override
    public Type type() {
        return type;
    }

    @Override
    public boolean hasError() {
        return bindings.stream().anyMatch(VarDecl::hasError);
    }

    @Override
    public String render(int depth) {
        return bindings.stream()
                .map(binding -> binding.render(depth))
                .collect(Collectors.joining("\n"));
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(bindings);
    }
}
