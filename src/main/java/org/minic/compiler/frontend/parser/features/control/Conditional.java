package org.minic.compiler.frontend.parser.features.control;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.parser.ast.RenderSupport;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An {@code if} statement with an optional {@code else} branch.
 */
public final class Conditional implements AstNode {

    private final AstNode condition;
    private final AstNode accepted;
    private final AstNode rejected;
    private final boolean failed;

    /**
     * @param context The analysis context.
     * @param condition The test, which must be boolean.
     * @param accepted The branch taken when the test holds.
     * @param rejected The branch taken otherwise, or {@code null}.
     */
    public Conditional(AnalysisContext context, AstNode condition, AstNode accepted, AstNode rejected) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.accepted = Objects.requireNonNull(accepted, "accepted");
        this.rejected = rejected;
        this.failed = !ConditionCheck.checkCondition(context, condition);
    }

    public Conditional(AnalysisContext context, AstNode condition, AstNode accepted) {
        this(context, condition, accepted, null);
    }

    public boolean hasElse() {
        return rejected != null;
    }

    @Override
    public Type type() {
        return Type.VOID;
    }

    @Override
    public boolean hasError() {
        return failed || accepted.hasError() || (rejected != null && rejected.hasError());
    }

    @Override
    public String render(int depth) {
        String indent = RenderSupport.indent(depth);
        String test = condition.render(0);
        StringBuilder out = new StringBuilder(indent).append("if ")
                .append(condition.bracketsItself() ? test : "(" + test + ")").append(" {");
        RenderSupport.appendBody(out, accepted, depth + 1);
        out.append('\n').append(indent).append('}');
        if (rejected != null) {
            out.append(" else {");
            RenderSupport.appendBody(out, rejected, depth + 1);
            out.append('\n').append(indent).append('}');
        }
        return out.toString();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(List.of(condition, accepted));
        if (rejected != null) {
            children.add(rejected);
        }
        return children;
    }
}
