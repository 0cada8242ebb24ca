package org.minic.compiler.api;

import org.minic.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a translation unit with semantic errors is asked for its target code.
 * <p>
 * It is part of the public API; node construction itself never throws it.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message);
        this.diagnostics = List.of();
    }

    /**
     * Constructs a compilation exception whose message lists the given diagnostics, one per line.
     * @param diagnostics The errors that prevent code generation.
     */
    public CompilationException(List<Diagnostic> diagnostics) {
        super(diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n")));
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics this exception was created from; empty for a plain message.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
