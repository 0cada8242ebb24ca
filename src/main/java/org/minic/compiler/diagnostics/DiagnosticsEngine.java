package org.minic.compiler.diagnostics;

import org.minic.compiler.internal.i18n.Messages;
import org.minic.compiler.types.Operator;
import org.minic.compiler.types.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Collects the semantic errors found while the tree is built.
 * <p>
 * Nodes report through the typed methods below instead of printing, so that the
 * message wording lives in one place and tests can assert on the collected list.
 * Every diagnostic is stamped with the line that is current at the moment of reporting.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final SourceLine sourceLine;

    /**
     * Constructs an engine that reads line numbers from the given counter.
     * @param sourceLine The current-line counter advanced by the scanner.
     */
    public DiagnosticsEngine(SourceLine sourceLine) {
        this.sourceLine = Objects.requireNonNull(sourceLine, "sourceLine");
    }

    /**
     * Constructs an engine with its own line counter, fixed at line 1.
     */
    public DiagnosticsEngine() {
        this(new SourceLine());
    }

    public void reportMultipleDefinition(String name) {
        report(ErrorKind.MULTIPLE_DEFINITION, name);
    }

    public void reportMultipleFunctionDefinition(String name) {
        report(ErrorKind.MULTIPLE_DEFINITION_FN, name);
    }

    public void reportUndeclaredVariable(String name) {
        report(ErrorKind.UNDECLARED_VARIABLE, name);
    }

    /**
     * Reports an operand whose type does not fit its operator.
     * @param op The operator whose operand was rejected.
     * @param expected The operand type the operator expected.
     * @param actual The type that was supplied.
     */
    public void reportIncompatibleOperands(Operator op, Type expected, Type actual) {
        report(ErrorKind.INCOMPATIBLE_OPERANDS, op.printableName(), expected.printableName(), actual.printableName());
    }

    /**
     * Reports a value that cannot be stored in a target of another type.
     * Worded as an {@link Operator#ASSIGN} operand mismatch.
     * @param expected The target type.
     * @param actual The value type.
     */
    public void reportIncompatibleAssignment(Type expected, Type actual) {
        report(ErrorKind.INCOMPATIBLE_ASSIGNMENT,
                Operator.ASSIGN.printableName(), expected.printableName(), actual.printableName());
    }

    /**
     * Reports a non-boolean condition.
     * Worded as an {@link Operator#TEST} operand mismatch against {@link Type#BOOL}.
     * @param actual The condition's type.
     */
    public void reportIncompatibleTest(Type actual) {
        report(ErrorKind.INCOMPATIBLE_TEST,
                Operator.TEST.printableName(), Type.BOOL.printableName(), actual.printableName());
    }

    public void reportDeclaredButNeverDefined(String name) {
        report(ErrorKind.DECLARED_BUT_NEVER_DEFINED, name);
    }

    /**
     * @param name The called function.
     * @param expected The declared parameter count.
     * @param actual The number of arguments in the call.
     */
    public void reportWrongParamCount(String name, int expected, int actual) {
        report(ErrorKind.WRONG_PARAM_COUNT, name, String.valueOf(expected), String.valueOf(actual));
    }

    public void reportIncompatibleParam(String name, Type expected, Type actual) {
        report(ErrorKind.INCOMPATIBLE_PARAM, name, expected.printableName(), actual.printableName());
    }

    public void reportIncompatibleIndex(Type expected, Type actual) {
        report(ErrorKind.INCOMPATIBLE_INDEX, expected.printableName(), actual.printableName());
    }

    public void reportNonArrayIndex() {
        report(ErrorKind.NON_ARRAY_INDEX);
    }

    private void report(ErrorKind kind, Object... args) {
        Diagnostic diagnostic = new Diagnostic(kind, Messages.describe(kind, args), sourceLine.current());
        diagnostics.add(diagnostic);
        CompilerLogger.diagnostic(diagnostic);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one diagnostic exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * @param kind The kind to count.
     * @return The number of diagnostics of the given kind.
     */
    public long count(ErrorKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).count();
    }

    /**
     * Returns an unmodifiable view of all collected diagnostics, in reporting order.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as output lines, one per error.
     *
     * @return The diagnostics joined with newlines.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
