package org.minic.compiler.frontend.parser.features.fun;

import org.minic.compiler.config.CompilerSettings;
import org.minic.compiler.config.ParamCheckPolicy;
import org.minic.compiler.diagnostics.CompilerLogger;
import org.minic.compiler.diagnostics.Diagnostic;
import org.minic.compiler.diagnostics.ErrorKind;
import org.minic.compiler.frontend.parser.ast.Constant;
import org.minic.compiler.frontend.parser.ast.Variable;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Type;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class FunCallTest {

    private static AnalysisContext contextWith(ParamCheckPolicy policy) {
        AnalysisContext ctx = AnalysisContext.create(new CompilerSettings(policy, CompilerLogger.Verbosity.INFO));
        ctx.scope().declareFunction("max", List.of(Type.INT, Type.INT), Type.INT);
        ctx.scope().declareFunction("scale", List.of(Type.FLOAT), Type.FLOAT);
        return ctx;
    }

    private static Constant integer(String text) {
        return new Constant(Type.INT, text);
    }

    private static Constant bool(String text) {
        return new Constant(Type.BOOL, text);
    }

    @Test
    void wellTypedCall() {
        AnalysisContext ctx = contextWith(ParamCheckPolicy.ALL);
        FunCall call = new FunCall(ctx, "max", new ExpressionList().add(integer("1")).add(integer("2")));

        assertThat(call.type()).isEqualTo(Type.INT);
        assertThat(call.hasError()).isFalse();
        assertThat(call.render()).isEqualTo("max(1, 2)");
        assertThat(ctx.diagnostics().hasErrors()).isFalse();
    }

    @Test
    void integerArgumentIsWidened() {
        AnalysisContext ctx = contextWith(ParamCheckPolicy.ALL);
        FunCall call = new FunCall(ctx, "scale", new ExpressionList().add(integer("3")));

        assertThat(call.hasError()).isFalse();
        assertThat(call.render()).isEqualTo("scale([float]3)");
    }

    @Test
    void noArguments() {
        AnalysisContext ctx = contextWith(ParamCheckPolicy.ALL);
        ctx.scope().declareFunction("tick", List.of(), Type.VOID);

        FunCall call = new FunCall(ctx, "tick", new ExpressionList());

        assertThat(call.render(1)).isEqualTo("    tick()");
        assertThat(call.type()).isEqualTo(Type.VOID);
    }

    @Test
    void wrongArgumentCount() {
        AnalysisContext ctx = contextWith(ParamCheckPolicy.ALL);
        FunCall call = new FunCall(ctx, "max", new ExpressionList().add(integer("1")));

        assertThat(call.type()).isEqualTo(Type.ANY);
        assertThat(call.hasError()).isTrue();
        assertThat(ctx.diagnostics().getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(ErrorKind.WRONG_PARAM_COUNT);
            assertThat(d.message()).isEqualTo("function max expects 2 parameters but received 1");
        });
    }

    @Test
    void everyMismatchedArgumentIsReported() {
        AnalysisContext ctx = contextWith(ParamCheckPolicy.ALL);
        FunCall call = new FunCall(ctx, "max", new ExpressionList().add(bool("true")).add(bool("false")));

        assertThat(call.hasError()).isTrue();
        assertThat(call.type()).isEqualTo(Type.INT);
        assertThat(ctx.diagnostics().getDiagnostics())
                .extracting(Diagnostic::message)
                .containsExactly(
                        "parameter max expected integer but received boolean",
                        "parameter max expected integer but received boolean");
    }

    @Test
    void firstPolicyStopsAtTheFirstMismatch() {
        AnalysisContext ctx = contextWith(ParamCheckPolicy.FIRST);
        new FunCall(ctx, "max", new ExpressionList().add(bool("true")).add(bool("false")));

        assertThat(ctx.diagnostics().count(ErrorKind.INCOMPATIBLE_PARAM)).isEqualTo(1);
    }

    @Test
    void unknownFunctionIsReportedAsUndeclared() {
        AnalysisContext ctx = contextWith(ParamCheckPolicy.ALL);
        FunCall call = new FunCall(ctx, "nope", new ExpressionList());

        assertThat(call.type()).isEqualTo(Type.ANY);
        assertThat(ctx.diagnostics().getDiagnostics()).singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("undeclared variable nope");
    }

    @Test
    void failedArgumentIsNotReportedAgain() {
        AnalysisContext ctx = contextWith(ParamCheckPolicy.ALL);
        FunCall call = new FunCall(ctx, "max",
                new ExpressionList().add(new Variable(ctx, "ghost")).add(integer("2")));

        assertThat(call.hasError()).isTrue();
        assertThat(call.type()).isEqualTo(Type.INT);
        assertThat(ctx.diagnostics().getDiagnostics()).hasSize(1);
    }

    @Test
    void failedArgumentDoesNotHideWrongArgumentCount() {
        AnalysisContext ctx = contextWith(ParamCheckPolicy.ALL);
        FunCall call = new FunCall(ctx, "max",
                new ExpressionList().add(new Variable(ctx, "ghost")).add(integer("1")).add(integer("2")));

        assertThat(call.type()).isEqualTo(Type.ANY);
        assertThat(ctx.diagnostics().getDiagnostics())
                .extracting(Diagnostic::kind)
                .containsExactly(ErrorKind.UNDECLARED_VARIABLE, ErrorKind.WRONG_PARAM_COUNT);
    }

    @Test
    void failedArgumentDoesNotHideOtherMismatches() {
        AnalysisContext ctx = contextWith(ParamCheckPolicy.ALL);
        FunCall call = new FunCall(ctx, "max",
                new ExpressionList().add(new Variable(ctx, "ghost")).add(bool("true")));

        assertThat(call.hasError()).isTrue();
        assertThat(ctx.diagnostics().getDiagnostics())
                .extracting(Diagnostic::message)
                .containsExactly(
                        "undeclared variable ghost",
                        "parameter max expected integer but received boolean");
    }

    @Test
    void expressionList() {
        AnalysisContext ctx = contextWith(ParamCheckPolicy.ALL);
        ctx.scope().declare("x", Type.INT);
        ExpressionList args = new ExpressionList().add(integer("1")).add(new Variable(ctx, "x"));

        assertThat(args.size()).isEqualTo(2);
        assertThat(args.render()).isEqualTo("1, x");
        assertThat(args.get(1).type()).isEqualTo(Type.INT);
    }
}
