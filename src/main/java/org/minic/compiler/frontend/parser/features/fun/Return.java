package org.minic.compiler.frontend.parser.features.fun;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.parser.ast.RenderSupport;
import org.minic.compiler.types.Type;

import java.util.List;

/**
 * A {@code return} statement. Its type is the returned value's type, or VOID for a bare return.
 * Whether that matches the enclosing function is not checked here.
 *
 * @param operand The returned value, or {@code null}.
 */
public record Return(AstNode operand) implements AstNode {

    public static Return empty() {
        return new Return(null);
    }

    @Override
    public Type type() {
        return operand == null ? Type.VOID : operand.type();
    }

    @Override
    public boolean hasError() {
        return operand != null && operand.hasError();
    }

    @Override
    public String render(int depth) {
        String indent = RenderSupport.indent(depth);
        return operand == null ? indent + "return;" : indent + "return " + operand.render(0) + ";";
    }

    @Override
    public List<AstNode> getChildren() {
        return operand == null ? List.of() : List.of(operand);
    }
}
