package org.minic.compiler.frontend.parser.ast;

import org.minic.compiler.config.CompilerSettings;
import org.minic.compiler.diagnostics.DiagnosticsEngine;
import org.minic.compiler.diagnostics.SourceLine;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.frontend.semantics.Symbol;
import org.minic.compiler.frontend.semantics.SymbolScope;
import org.minic.compiler.types.Type;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

/**
 * A variable only reads the scope; it never declares anything.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class VariableLookupTest {

    @Mock
    private SymbolScope scope;

    private AnalysisContext contextWith(SymbolScope symbols) {
        SourceLine line = new SourceLine();
        return new AnalysisContext(symbols, new DiagnosticsEngine(line), line, CompilerSettings.defaults());
    }

    @Test
    void resolvesThroughTheScope() {
        when(scope.lookup("n")).thenReturn(Optional.of(new Symbol("n", Type.INT)));

        Variable v = new Variable(contextWith(scope), "n");

        assertThat(v.type()).isEqualTo(Type.INT);
        verify(scope).lookup("n");
        verifyNoMoreInteractions(scope);
    }

    @Test
    void missingSymbolIsReported() {
        when(scope.lookup("n")).thenReturn(Optional.empty());
        AnalysisContext ctx = contextWith(scope);

        Variable v = new Variable(ctx, "n");

        assertThat(v.hasError()).isTrue();
        assertThat(ctx.diagnostics().summary()).isEqualTo("[Line 1] semantic error: undeclared variable n");
    }
}
