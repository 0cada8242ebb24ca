package org.minic.compiler.frontend.parser.features.assign;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.parser.ast.RenderSupport;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Type;
import org.minic.compiler.types.TypeRules;

import java.util.List;
import java.util.Objects;

/**
 * Stores a value into a target, rendered as {@code target = value;}.
 * Assignment is a statement: its type is {@link Type#VOID}.
 */
public final class Assignment implements AstNode {

    private final AstNode target;
    private final AstNode value;
    private final boolean failed;
    private final boolean coerced;

    /**
     * The value must have the target's type, or be an INT stored into a FLOAT.
     * If either side already failed, the assignment fails without a new diagnostic.
     *
     * @param context The analysis context.
     * @param target The assigned location.
     * @param value The assigned value.
     */
    public Assignment(AnalysisContext context, AstNode target, AstNode value) {
        this.target = Objects.requireNonNull(target, "target");
        this.value = Objects.requireNonNull(value, "value");

        Type targetType = target.type();
        Type valueType = value.type();
        if (target.hasError() || value.hasError()
                || TypeRules.isTerminal(targetType) || TypeRules.isTerminal(valueType)) {
            this.failed = true;
            this.coerced = false;
        } else if (targetType != Type.VOID && TypeRules.isAssignable(targetType, valueType)) {
            this.failed = false;
            this.coerced = TypeRules.canCoerce(targetType, valueType);
        } else {
            context.diagnostics().reportIncompatibleAssignment(targetType, valueType);
            this.failed = true;
            this.coerced = false;
        }
    }

    public AstNode target() {
        return target;
    }

    public AstNode value() {
        return value;
    }

    @Override
    public Type type() {
        return Type.VOID;
    }

    @Override
    public boolean hasError() {
        return failed;
    }

    @Override
    public String render(int depth) {
        String valueText = value.render(0);
        if (coerced) {
            valueText = RenderSupport.cast(target.type(), valueText);
        }
        return RenderSupport.indent(depth) + target.render(0) + " = " + valueText + ";";
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, value);
    }
}
