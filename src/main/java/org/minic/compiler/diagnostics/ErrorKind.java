package org.minic.compiler.diagnostics;

/**
 * Defines the semantic errors the front end can detect.
 * Each kind maps to a message template in the {@code compiler_messages} bundle,
 * which keeps tests independent of the exact wording.
 */
public enum ErrorKind {
    /** A variable was declared twice in the same scope. */
    MULTIPLE_DEFINITION("semantic.multipleDefinition"),
    /** A function was declared twice with different signatures, or defined twice. */
    MULTIPLE_DEFINITION_FN("semantic.multipleDefinitionFn"),
    /** An identifier was used without a visible declaration. */
    UNDECLARED_VARIABLE("semantic.undeclaredVariable"),
    /** An operand does not match the type expected by its operator. */
    INCOMPATIBLE_OPERANDS("semantic.incompatibleOperands"),
    /** An assigned or initializing value does not match the target type. */
    INCOMPATIBLE_ASSIGNMENT("semantic.incompatibleOperands"),
    /** A condition is not boolean. */
    INCOMPATIBLE_TEST("semantic.incompatibleOperands"),
    /** A function was forward declared and never received a body. */
    DECLARED_BUT_NEVER_DEFINED("semantic.declaredButNeverDefined"),
    /** A call passes the wrong number of arguments. */
    WRONG_PARAM_COUNT("semantic.wrongParamCount"),
    /** A call argument does not match its parameter type. */
    INCOMPATIBLE_PARAM("semantic.incompatibleParam"),
    /** An array index is not an integer. */
    INCOMPATIBLE_INDEX("semantic.incompatibleIndex"),
    /** The index operator was applied to something that is not an array. */
    NON_ARRAY_INDEX("semantic.nonArrayIndex");

    private final String messageKey;

    ErrorKind(String messageKey) {
        this.messageKey = messageKey;
    }

    /**
     * @return The key of this kind's message template.
     */
    public String messageKey() {
        return messageKey;
    }
}
