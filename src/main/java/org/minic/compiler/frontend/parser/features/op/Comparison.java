package org.minic.compiler.frontend.parser.features.op;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Operator;
import org.minic.compiler.types.Type;

/**
 * A relational operation. Operands follow the usual operand rules; the result is always boolean.
 */
public class Comparison extends Operation {

    public Comparison(AnalysisContext context, Operator op, AstNode first, AstNode... rest) {
        super(context, requireComparison(op), first, rest);
        overrideResultType(Type.BOOL);
    }

    private static Operator requireComparison(Operator op) {
        if (!op.isComparison()) {
            throw new IllegalArgumentException(op + " is not a comparison operator");
        }
        return op;
    }
}
