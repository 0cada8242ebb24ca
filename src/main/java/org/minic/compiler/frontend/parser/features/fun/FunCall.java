package org.minic.compiler.frontend.parser.features.fun;

import org.minic.compiler.config.ParamCheckPolicy;
import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.parser.ast.RenderSupport;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.frontend.semantics.FunctionSignature;
import org.minic.compiler.types.Type;
import org.minic.compiler.types.TypeRules;

import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * A call of a declared function, rendered as {@code name(a, b)}.
 * <p>
 * The arguments are checked against the callee's signature: first the count, then each
 * position, where an INT argument may be passed for a FLOAT parameter. Whether every
 * mismatched position is reported or only the first one is decided by
 * {@link ParamCheckPolicy}. An argument that failed on its own is skipped, but the
 * count and the remaining positions are still checked.
 */
public final class FunCall implements AstNode {

    private final String name;
    private final ExpressionList args;
    private final BitSet coercedArgs = new BitSet();
    private final Type type;
    private final boolean failed;

    /**
     * @param context The analysis context.
     * @param name The called function.
     * @param args The call arguments.
     */
    public FunCall(AnalysisContext context, String name, ExpressionList args) {
        this.name = Objects.requireNonNull(name, "name");
        this.args = Objects.requireNonNull(args, "args");

        Optional<FunctionSignature> signature = context.scope().lookupFunction(name);
        if (signature.isEmpty()) {
            context.diagnostics().reportUndeclaredVariable(name);
            this.type = Type.ANY;
            this.failed = true;
            return;
        }
        FunctionSignature callee = signature.get();
        if (callee.arity() != args.size()) {
            context.diagnostics().reportWrongParamCount(name, callee.arity(), args.size());
            this.type = Type.ANY;
            this.failed = true;
            return;
        }
        this.type = callee.returnType();
        boolean argumentsOk = checkArguments(context, callee);
        this.failed = !argumentsOk || args.hasError();
    }

    private boolean checkArguments(AnalysisContext context, FunctionSignature callee) {
        boolean stopAtFirst = context.settings().paramCheck() == ParamCheckPolicy.FIRST;
        boolean ok = true;
        for (int i = 0; i < args.size(); i++) {
            AstNode arg = args.get(i);
            Type expected = callee.parameterTypes().get(i);
            Type actual = arg.type();
            // a failed argument has been reported where it failed
            if (arg.hasError() || TypeRules.isTerminal(actual) || TypeRules.matches(expected, actual)) {
                continue;
            }
            if (TypeRules.canCoerce(expected, actual)) {
                coercedArgs.set(i);
                continue;
            }
            context.diagnostics().reportIncompatibleParam(name, expected, actual);
            ok = false;
            if (stopAtFirst) {
                break;
            }
        }
        return ok;
    }

    public String name() {
        return name;
    }

    public ExpressionList args() {
        return args;
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
        StringJoiner joined = new StringJoiner(", ", name + "(", ")");
        for (int i = 0; i < args.size(); i++) {
            String text = args.get(i).render(0);
            joined.add(coercedArgs.get(i) ? RenderSupport.cast(Type.FLOAT, text) : text);
        }
        return RenderSupport.indent(depth) + joined;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(args);
    }
}
