package org.minic.compiler.frontend.parser.features.op;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Operator;

/**
 * Arithmetic negation, rendered as {@code -operand}.
 */
public class UnaryMinus extends Operation {

    public UnaryMinus(AnalysisContext context, AstNode operand) {
        super(context, Operator.UNARY_MINUS, operand);
    }
}
