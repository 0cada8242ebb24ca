package org.minic.compiler.frontend.parser.features.op;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.parser.ast.RenderSupport;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Operator;
import org.minic.compiler.types.Type;
import org.minic.compiler.types.TypeRules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An operator applied to one or more operands.
 * <p>
 * The operands are checked in order against a running operand type. Without an explicit
 * operand type, the first operand sets it. A later operand is accepted if it has the same
 * type, or if one side is INT and the other FLOAT; in that case the operand type widens to
 * FLOAT and every INT operand renders with an explicit cast. Any other mismatch is
 * reported once as INCOMPATIBLE_OPERANDS and turns the node's type into {@link Type#ANY}.
 * <p>
 * Once the node has failed, including because an operand arrived already failed, no
 * further diagnostics are produced for it.
 */
public class Operation implements AstNode {

    private final Operator op;
    private final List<AstNode> children = new ArrayList<>();
    private final boolean explicitOperandType;
    private Type operandType;
    private Type resultOverride;
    private boolean failed;
    private boolean needsCoercion;

    /**
     * Creates an operation whose operand type is set by its first operand.
     *
     * @param context The analysis context.
     * @param op The operator.
     * @param first The first operand.
     * @param rest The remaining operands.
     */
    public Operation(AnalysisContext context, Operator op, AstNode first, AstNode... rest) {
        this(context, op, null, concat(first, rest));
    }

    /**
     * Creates an operation whose operands must all have, or coerce to, {@code operandType}.
     *
     * @param context The analysis context.
     * @param op The operator.
     * @param operandType The operand type every operand is checked against.
     * @param operands The operands, at least one.
     */
    public Operation(AnalysisContext context, Operator op, Type operandType, AstNode... operands) {
        this(context, op, Objects.requireNonNull(operandType, "operandType"), Arrays.asList(operands));
    }

    /**
     * @param context The analysis context.
     * @param op The operator.
     * @param operandType The required operand type, or {@code null} to take it from the first operand.
     * @param operands The operands, at least one.
     */
    public Operation(AnalysisContext context, Operator op, Type operandType, List<AstNode> operands) {
        this.op = Objects.requireNonNull(op, "op");
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("Operation " + op + " needs at least one operand");
        }
        this.explicitOperandType = operandType != null;
        this.operandType = operandType;
        for (AstNode operand : operands) {
            children.add(Objects.requireNonNull(operand, "operand"));
            if (failed) {
                continue;
            }
            if (operand.hasError() || TypeRules.isTerminal(operand.type())) {
                failed = true;
                continue;
            }
            check(context, operand.type());
        }
    }

    private static List<AstNode> concat(AstNode first, AstNode[] rest) {
        List<AstNode> all = new ArrayList<>(rest.length + 1);
        all.add(first);
        all.addAll(Arrays.asList(rest));
        return all;
    }

    private void check(AnalysisContext context, Type actual) {
        if (actual == Type.VOID) {
            fail(context, operandType == null ? Type.ANY : operandType, actual);
        } else if (operandType == null) {
            operandType = actual;
        } else if (TypeRules.matches(operandType, actual)) {
            // accepted as is
        } else if (TypeRules.canCoerce(operandType, actual)) {
            needsCoercion = true;
        } else if (!explicitOperandType && TypeRules.canCoerce(actual, operandType)) {
            operandType = actual;
            needsCoercion = true;
        } else {
            fail(context, operandType, actual);
        }
    }

    private void fail(AnalysisContext context, Type expected, Type actual) {
        context.diagnostics().reportIncompatibleOperands(op, expected, actual);
        failed = true;
    }

    /**
     * Replaces the result type. Only called once, from a subclass constructor.
     * @param type The type this node yields regardless of its operand type.
     */
    protected final void overrideResultType(Type type) {
        this.resultOverride = type;
    }

    public Operator op() {
        return op;
    }

    /**
     * @return The type the operands were unified to, or {@link Type#ANY} if that failed.
     */
    public Type operandType() {
        return failed || operandType == null ? Type.ANY : operandType;
    }

    /**
     * @return {@code true} if at least one INT operand is implicitly widened to FLOAT.
     */
    public boolean needsCoercion() {
        return needsCoercion && !failed;
    }

    @Override
    public boolean bracketsItself() {
        return children.size() > 1;
    }

    @Override
    public Type type() {
        if (failed) {
            return Type.ANY;
        }
        return resultOverride != null ? resultOverride : operandType;
    }

    @Override
    public boolean hasError() {
        return failed;
    }

    @Override
    public String render(int depth) {
        return RenderSupport.indent(depth) + renderExpression();
    }

    /**
     * Renders the operation without indentation: {@code (a + b)} for several operands,
     * {@code -a} for one.
     * @return The expression text.
     */
    protected String renderExpression() {
        if (children.size() == 1) {
            return op.symbol() + renderOperand(children.get(0));
        }
        return children.stream()
                .map(this::renderOperand)
                .collect(Collectors.joining(" " + op.symbol() + " ", "(", ")"));
    }

    /**
     * @param operand One of this node's operands.
     * @return The operand's text, with a cast prefix if it is widened implicitly.
     */
    protected final String renderOperand(AstNode operand) {
        String text = operand.render(0);
        if (needsCoercion() && operandType == Type.FLOAT && operand.type() == Type.INT) {
            return RenderSupport.cast(Type.FLOAT, text);
        }
        return text;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(children);
    }
}
