package org.minic.compiler.types;

/**
 * Every operator an operation node can carry, together with its canonical symbol
 * in generated code and its name in diagnostics.
 * <p>
 * {@link #PAR}, {@link #CAST} and {@link #TEST} are markers: they have no symbol of
 * their own and only appear in node bookkeeping or messages.
 */
public enum Operator {
    EQUAL("==", "equal"),
    NOT_EQUAL("!=", "different"),
    GREATER_THAN(">", "greater than"),
    LESS_THAN("<", "less than"),
    GREATER_EQUAL_THAN(">=", "greater or equal than"),
    LESS_EQUAL_THAN("<=", "less or equal than"),
    AND("&", "and"),
    OR("|", "or"),
    NOT("!", "negation"),
    PLUS("+", "addition"),
    MINUS("-", "subtraction"),
    TIMES("*", "multiplication"),
    DIVIDE("/", "division"),
    UNARY_MINUS("-", "unary minus"),
    ASSIGN("=", "attribution"),
    PAR("", "parenthesis"),
    CAST("", "cast"),
    TEST("", "test");

    private final String symbol;
    private final String printableName;

    Operator(String symbol, String printableName) {
        this.symbol = symbol;
        this.printableName = printableName;
    }

    /**
     * @return The canonical symbol used when rendering, possibly empty for marker operators.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @return The operator's name in diagnostics, e.g. {@code addition}.
     */
    public String printableName() {
        return printableName;
    }

    /**
     * @return {@code true} for the six relational operators.
     */
    public boolean isComparison() {
        return switch (this) {
            case EQUAL, NOT_EQUAL, GREATER_THAN, LESS_THAN, GREATER_EQUAL_THAN, LESS_EQUAL_THAN -> true;
            default -> false;
        };
    }

    /**
     * @return {@code true} for the logical connectives, whose operands must be boolean.
     */
    public boolean isBoolean() {
        return this == AND || this == OR || this == NOT;
    }

    /**
     * @return {@code true} for operators that take exactly one operand.
     */
    public boolean isUnary() {
        return this == NOT || this == UNARY_MINUS || this == PAR || this == CAST;
    }
}
