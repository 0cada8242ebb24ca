package org.minic.compiler.frontend.parser.features.op;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.parser.ast.RenderSupport;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Operator;
import org.minic.compiler.types.Type;

import java.util.Objects;

/**
 * An explicit conversion, rendered as {@code [type]operand}.
 * Any value may be cast; only a statement operand is rejected.
 */
public class Cast extends Operation {

    private final Type targetType;

    /**
     * @param context The analysis context.
     * @param targetType The type converted to.
     * @param operand The converted value.
     */
    public Cast(AnalysisContext context, Type targetType, AstNode operand) {
        super(context, Operator.CAST, operand);
        this.targetType = Objects.requireNonNull(targetType, "targetType");
        overrideResultType(targetType);
    }

    public Type targetType() {
        return targetType;
    }

    @Override
    protected String renderExpression() {
        return RenderSupport.cast(targetType, renderOperand(getChildren().get(0)));
    }
}
