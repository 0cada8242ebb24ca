package org.minic.compiler.frontend.parser.features.op;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Operator;
import org.minic.compiler.types.Type;

/**
 * A logical connective ({@code &}, {@code |}, or unary {@code !}). Every operand,
 * the first included, must already be boolean.
 */
public class BoolOperation extends Operation {

    public BoolOperation(AnalysisContext context, Operator op, AstNode... operands) {
        super(context, requireBoolean(op), Type.BOOL, operands);
    }

    private static Operator requireBoolean(Operator op) {
        if (!op.isBoolean()) {
            throw new IllegalArgumentException(op + " is not a boolean operator");
        }
        return op;
    }

    /**
     * Creates a logical negation.
     * @param context The analysis context.
     * @param operand The negated operand.
     * @return The {@code !operand} node.
     */
    public static BoolOperation not(AnalysisContext context, AstNode operand) {
        return new BoolOperation(context, Operator.NOT, operand);
    }
}
