package org.minic.compiler.frontend.parser.features.op;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Operator;

/**
 * Source-level parentheses. Has the operand's type and renders {@code (operand)}, unless the
 * operand already renders its own parentheses.
 */
public class Parenthesis extends Operation {

    public Parenthesis(AnalysisContext context, AstNode operand) {
        super(context, Operator.PAR, operand);
    }

    @Override
    public boolean bracketsItself() {
        return true;
    }

    @Override
    protected String renderExpression() {
        AstNode operand = getChildren().get(0);
        String text = renderOperand(operand);
        return operand.bracketsItself() ? text : "(" + text + ")";
    }
}
