package org.minic.compiler.frontend.parser.features.memory;

import org.minic.compiler.diagnostics.Diagnostic;
import org.minic.compiler.diagnostics.ErrorKind;
import org.minic.compiler.frontend.parser.ast.Constant;
import org.minic.compiler.frontend.parser.ast.Lvalue;
import org.minic.compiler.frontend.parser.ast.Variable;
import org.minic.compiler.frontend.parser.features.assign.Assignment;
import org.minic.compiler.frontend.parser.features.decl.ArrayDecl;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Type;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class MemoryAccessTest {

    private AnalysisContext ctx;

    @BeforeEach
    void setUp() {
        ctx = AnalysisContext.create();
        new ArrayDecl(ctx, Type.INT, "arr", "10");
        new ArrayDecl(ctx, Type.FLOAT, "samples", "4");
        ctx.scope().declare("i", Type.INT);
        ctx.scope().declare("scalar", Type.INT);
    }

    @Test
    void indexingYieldsTheElementType() {
        ArrayIndex ints = new ArrayIndex(ctx, "arr", new Variable(ctx, "i"));
        ArrayIndex floats = new ArrayIndex(ctx, "samples", new Constant(Type.INT, "0"));

        assertThat(ints.type()).isEqualTo(Type.INT);
        assertThat(ints.render()).isEqualTo("arr[i]");
        assertThat(floats.type()).isEqualTo(Type.FLOAT);
        assertThat(ctx.diagnostics().hasErrors()).isFalse();
    }

    @Test
    void nonIntegerIndexIsReportedOnce() {
        ArrayIndex access = new ArrayIndex(ctx, "arr", new Constant(Type.BOOL, "true"));

        assertThat(access.hasError()).isTrue();
        assertThat(access.type()).isEqualTo(Type.ANY);
        assertThat(ctx.diagnostics().getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(ErrorKind.INCOMPATIBLE_INDEX);
            assertThat(d.message()).isEqualTo("index operator expects integer but received boolean");
        });
    }

    @Test
    void indexingAScalarIsReportedOnce() {
        ArrayIndex access = new ArrayIndex(ctx, "scalar", new Constant(Type.INT, "0"));

        assertThat(access.hasError()).isTrue();
        assertThat(ctx.diagnostics().getDiagnostics()).singleElement()
                .extracting(Diagnostic::kind)
                .isEqualTo(ErrorKind.NON_ARRAY_INDEX);
    }

    @Test
    void undeclaredArray() {
        new ArrayIndex(ctx, "nothing", new Constant(Type.INT, "0"));

        assertThat(ctx.diagnostics().count(ErrorKind.UNDECLARED_VARIABLE)).isEqualTo(1);
        assertThat(ctx.diagnostics().getDiagnostics()).hasSize(1);
    }

    @Test
    void failedIndexIsNotReportedAgain() {
        ArrayIndex access = new ArrayIndex(ctx, "arr", new Variable(ctx, "j"));

        assertThat(access.hasError()).isTrue();
        assertThat(ctx.diagnostics().getDiagnostics()).hasSize(1);
        assertThat(ctx.diagnostics().count(ErrorKind.UNDECLARED_VARIABLE)).isEqualTo(1);
    }

    @Test
    void elementIsAssignable() {
        Assignment a = new Assignment(ctx, new ArrayIndex(ctx, "samples", new Variable(ctx, "i")),
                new Constant(Type.INT, "5"));

        assertThat(a.hasError()).isFalse();
        assertThat(a.render()).isEqualTo("samples[i] = [float]5;");
    }

    @Test
    void addressAndDereference() {
        Lvalue x = new Variable(ctx, "i");
        Address address = new Address(x);
        Reference deref = new Reference(x);
        Address ofElement = new Address(new ArrayIndex(ctx, "arr", new Constant(Type.INT, "2")));

        assertThat(address.render()).isEqualTo("&i");
        assertThat(address.type()).isEqualTo(Type.INT);
        assertThat(deref.render()).isEqualTo("*i");
        assertThat(ofElement.render()).isEqualTo("&arr[2]");
        assertThat(new Reference(deref).render()).isEqualTo("**i");
    }

    @Test
    void addressOfFailedOperandCarriesTheError() {
        Address address = new Address(new Variable(ctx, "ghost"));

        assertThat(address.hasError()).isTrue();
        assertThat(address.type()).isEqualTo(Type.ANY);
        assertThat(ctx.diagnostics().getDiagnostics()).hasSize(1);
    }
}
