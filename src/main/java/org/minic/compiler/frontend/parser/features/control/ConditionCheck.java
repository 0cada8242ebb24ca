package org.minic.compiler.frontend.parser.features.control;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Type;
import org.minic.compiler.types.TypeRules;

/**
 * The condition check shared by {@link Conditional} and {@link Loop}.
 */
final class ConditionCheck {

    private ConditionCheck() {}

    /**
     * A condition that already failed is rejected silently; any other non-boolean
     * condition is reported as INCOMPATIBLE_TEST.
     *
     * @param context The analysis context.
     * @param condition The condition node.
     * @return {@code true} if the condition is a valid boolean test.
     */
    static boolean checkCondition(AnalysisContext context, AstNode condition) {
        Type actual = condition.type();
        if (condition.hasError() || TypeRules.isTerminal(actual)) {
            return false;
        }
        if (!TypeRules.matches(Type.BOOL, actual)) {
            context.diagnostics().reportIncompatibleTest(actual);
            return false;
        }
        return true;
    }
}
