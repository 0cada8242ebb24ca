package org.minic.compiler.types;

/**
 * The closed set of static types known to the front end.
 */
public enum Type {
    /** A signed integer value. */
    INT("int", "integer"),
    /** A floating point value. */
    FLOAT("float", "float"),
    /** A boolean value. */
    BOOL("bool", "boolean"),
    /** The type of statements, which produce no value. */
    VOID("void", "void"),
    /** The error type. Once a node is ANY, no further type diagnostics are derived from it. */
    ANY("any", "a value");

    private final String targetName;
    private final String printableName;

    Type(String targetName, String printableName) {
        this.targetName = targetName;
        this.printableName = printableName;
    }

    /**
     * Returns the spelling of this type in generated code.
     * @return The target-code name, e.g. {@code int}.
     */
    public String targetName() {
        return targetName;
    }

    /**
     * Returns the name of this type as used in diagnostic messages.
     * @return The human-readable name, e.g. {@code integer}.
     */
    public String printableName() {
        return printableName;
    }
}
