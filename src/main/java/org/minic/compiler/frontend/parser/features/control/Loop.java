package org.minic.compiler.frontend.parser.features.control;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.parser.ast.RenderSupport;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A counted loop, rendered as
 * <pre>
 * for (init; test; update) {
 *     body
 * }
 * </pre>
 * Only the test is type-checked here; init, update and body validated themselves.
 */
public final class Loop implements AstNode {

    private final AstNode init;
    private final AstNode test;
    private final AstNode update;
    private final AstNode body;
    private final boolean failed;

    /**
     * @param context The analysis context.
     * @param init The statement run once before the loop, or {@code null}.
     * @param test The loop condition, which must be boolean.
     * @param update The statement run after each iteration, or {@code null}.
     * @param body The loop body.
     */
    public Loop(AnalysisContext context, AstNode init, AstNode test, AstNode update, AstNode body) {
        this.init = init;
        this.test = Objects.requireNonNull(test, "test");
        this.update = update;
        this.body = Objects.requireNonNull(body, "body");
        this.failed = !ConditionCheck.checkCondition(context, test);
    }

    @Override
    public Type type() {
        return Type.VOID;
    }

    @Override
    public boolean hasError() {
        return failed || getChildren().stream().anyMatch(AstNode::hasError);
    }

    @Override
    public String render(int depth) {
        String indent = RenderSupport.indent(depth);
        StringBuilder out = new StringBuilder(indent)
                .append("for (").append(header(init))
                .append("; ").append(test.render(0))
                .append("; ").append(header(update))
                .append(") {");
        RenderSupport.appendBody(out, body, depth + 1);
        return out.append('\n').append(indent).append('}').toString();
    }

    private static String header(AstNode statement) {
        return statement == null ? "" : RenderSupport.withoutTerminator(statement.render(0));
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(4);
        if (init != null) children.add(init);
        children.add(test);
        if (update != null) children.add(update);
        children.add(body);
        return children;
    }
}
