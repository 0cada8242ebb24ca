package org.minic.compiler.frontend.semantics;

import org.minic.compiler.config.CompilerSettings;
import org.minic.compiler.diagnostics.DiagnosticsEngine;
import org.minic.compiler.diagnostics.SourceLine;

import java.util.Objects;

/**
 * Everything a node needs to validate itself while it is constructed.
 * One context is shared by all nodes of a single compilation.
 *
 * @param scope The symbol store for declarations and lookups.
 * @param diagnostics The sink for detected errors.
 * @param sourceLine The current-line counter that stamps diagnostics.
 * @param settings The validation settings.
 */
public record AnalysisContext(
        SymbolScope scope,
        DiagnosticsEngine diagnostics,
        SourceLine sourceLine,
        CompilerSettings settings
) {
    public AnalysisContext {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(diagnostics, "diagnostics");
        Objects.requireNonNull(sourceLine, "sourceLine");
        Objects.requireNonNull(settings, "settings");
    }

    /**
     * Creates a fresh context for one compilation: an empty {@link SymbolTable}, a line
     * counter at line 1 and a diagnostics engine reading from it.
     *
     * @param settings The validation settings.
     * @return The new context.
     */
    public static AnalysisContext create(CompilerSettings settings) {
        SourceLine line = new SourceLine();
        return new AnalysisContext(new SymbolTable(), new DiagnosticsEngine(line), line, settings);
    }

    /**
     * @return A fresh context with default settings.
     */
    public static AnalysisContext create() {
        return create(CompilerSettings.defaults());
    }
}
