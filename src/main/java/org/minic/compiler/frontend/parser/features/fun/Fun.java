package org.minic.compiler.frontend.parser.features.fun;

import org.minic.compiler.diagnostics.CompilerLogger;
import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.parser.ast.RenderSupport;
import org.minic.compiler.frontend.parser.features.control.Block;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.frontend.semantics.FunctionSignature;
import org.minic.compiler.types.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A function declaration or definition, built incrementally as the parser reaches its
 * header and then each statement of its body.
 * <p>
 * A function without a body is a forward declaration. Whether a forward declaration is
 * ever completed is decided by the build driver, which reads {@link #hasBody()}.
 */
public final class Fun implements AstNode {

    private final AnalysisContext context;
    private final Type returnType;
    private final String name;
    private ParamList params;
    private Block body;
    private boolean failed;

    /**
     * @param context The analysis context.
     * @param returnType The declared return type.
     * @param name The function name.
     */
    public Fun(AnalysisContext context, Type returnType, String name) {
        this.context = Objects.requireNonNull(context, "context");
        this.returnType = Objects.requireNonNull(returnType, "returnType");
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Attaches the signature and, for a definition, the body. Registers the signature with the
     * symbol scope so that calls, including recursive ones, can be checked.
     * <p>
     * Redeclaring a known function with the same signature is allowed, as is supplying the
     * body of a forward declaration. A different signature or a second body is reported as
     * MULTIPLE_DEFINITION_FN.
     *
     * @param params The formal parameters.
     * @param body The body, or {@code null} for a forward declaration.
     * @throws IllegalStateException if the function was already bound.
     */
    public void bind(ParamList params, Block body) {
        if (this.params != null) {
            throw new IllegalStateException("Function " + name + " is already bound");
        }
        this.params = Objects.requireNonNull(params, "params");
        this.body = body;

        List<Type> types = params.types();
        if (!context.scope().declareFunction(name, types, returnType)) {
            Optional<FunctionSignature> existing = context.scope().lookupFunction(name);
            FunctionSignature ours = new FunctionSignature(name, types, returnType);
            if (existing.isPresent() && !existing.get().sameShapeAs(ours)) {
                context.diagnostics().reportMultipleFunctionDefinition(name);
                failed = true;
                return;
            }
        }
        if (body != null && !context.scope().markDefined(name)) {
            context.diagnostics().reportMultipleFunctionDefinition(name);
            failed = true;
        }
        CompilerLogger.trace("Bound function " + name + (body == null ? " (forward)" : ""));
    }

    /**
     * Appends a statement to the body.
     * @param statement The statement.
     * @throws IllegalStateException if this function has no body.
     */
    public void inject(AstNode statement) {
        if (body == null) {
            throw new IllegalStateException("Function " + name + " has no body to inject into");
        }
        body.add(statement);
    }

    public String name() {
        return name;
    }

    public Type returnType() {
        return returnType;
    }

    /**
     * @return {@code true} once a body has been attached.
     */
    public boolean hasBody() {
        return body != null;
    }

    public Optional<ParamList> params() {
        return Optional.ofNullable(params);
    }

    @Override
    public Type type() {
        return returnType;
    }

    @Override
    public boolean hasError() {
        return failed || (body != null && body.hasError());
    }

    @Override
    public String render(int depth) {
        String indent = RenderSupport.indent(depth);
        StringBuilder out = new StringBuilder(indent)
                .append(returnType.targetName()).append(' ').append(name)
                .append('(').append(params == null ? "" : params.render(0)).append(')');
        if (body == null) {
            return out.append(';').toString();
        }
        out.append(" {");
        RenderSupport.appendBody(out, body, depth + 1);
        return out.append('\n').append(indent).append('}').toString();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(2);
        if (params != null) children.add(params);
        if (body != null) children.add(body);
        return children;
    }
}
