package org.minic.compiler.frontend.builder;

import org.minic.compiler.api.TranslationUnit;
import org.minic.compiler.diagnostics.CompilerLogger;
import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.parser.features.control.Block;
import org.minic.compiler.frontend.parser.features.fun.Fun;
import org.minic.compiler.frontend.parser.features.fun.ParamList;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Type;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The glue between the parser's reductions and the AST.
 * <p>
 * The parser builds expression nodes itself and hands finished statements to
 * {@link #add(AstNode)}. The builder keeps track of which block or function body is
 * open, keeps the symbol scope nesting in step with it, and at the end reports the
 * functions that were declared but never defined.
 * <p>
 * Not thread-safe; one builder serves one compilation.
 */
public class ProgramBuilder {

    /**
     * An open block or function body.
     */
    private record Frame(Block block, Fun function) {
        void add(AstNode statement) {
            if (function != null) {
                function.inject(statement);
            } else {
                block.add(statement);
            }
        }
    }

    private final AnalysisContext context;
    private final List<AstNode> topLevel = new ArrayList<>();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final Map<String, Fun> forwardDeclarations = new LinkedHashMap<>();
    private boolean finished;

    /**
     * @param context The analysis context shared with every node of this compilation.
     */
    public ProgramBuilder(AnalysisContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * @return The context nodes of this compilation must be constructed with.
     */
    public AnalysisContext context() {
        return context;
    }

    /**
     * Moves the diagnostic line counter to the next source line.
     */
    public void newLine() {
        context.sourceLine().advance();
    }

    /**
     * Appends a finished statement to the innermost open block, or to the top level.
     * @param statement The statement.
     * @return The statement, for chaining in parser actions.
     */
    public <T extends AstNode> T add(T statement) {
        ensureOpen();
        Objects.requireNonNull(statement, "statement");
        if (frames.isEmpty()) {
            topLevel.add(statement);
        } else {
            frames.peek().add(statement);
        }
        return statement;
    }

    /**
     * Opens a nested block and its symbol scope. The block is not added anywhere; the
     * caller places it, typically as the branch of a conditional or the body of a loop.
     * @return The new, empty block.
     */
    public Block openBlock() {
        ensureOpen();
        Block block = new Block();
        context.scope().enterScope();
        frames.push(new Frame(block, null));
        return block;
    }

    /**
     * Closes the innermost block opened with {@link #openBlock()}.
     * @return The completed block.
     * @throws IllegalStateException if the innermost open frame is not a plain block.
     */
    public Block closeBlock() {
        Frame frame = frames.peek();
        if (frame == null || frame.function() != null) {
            throw new IllegalStateException("No open block to close");
        }
        frames.pop();
        context.scope().leaveScope();
        return frame.block();
    }

    /**
     * Starts a function definition at the top level. The parameters are declared in a new
     * scope, and statements added until {@link #endFunction()} form the body.
     *
     * @param returnType The return type.
     * @param name The function name.
     * @param params The formal parameters.
     * @return The function node, already added to the top level.
     * @throws IllegalStateException if another block or function is still open.
     */
    public Fun beginFunction(Type returnType, String name, ParamList params) {
        ensureTopLevel();
        Fun function = new Fun(context, returnType, name);
        function.bind(params, new Block());
        topLevel.add(function);
        context.scope().enterScope();
        params.declareInto(context);
        frames.push(new Frame(null, function));
        CompilerLogger.debug("Entered function " + name);
        return function;
    }

    /**
     * Ends the function started by {@link #beginFunction(Type, String, ParamList)}.
     * @return The completed function.
     * @throws IllegalStateException if the innermost open frame is not a function body.
     */
    public Fun endFunction() {
        Frame frame = frames.peek();
        if (frame == null || frame.function() == null) {
            throw new IllegalStateException("No open function to end");
        }
        frames.pop();
        context.scope().leaveScope();
        CompilerLogger.debug("Left function " + frame.function().name());
        return frame.function();
    }

    /**
     * Adds a forward declaration, i.e. a function header without a body.
     *
     * @param returnType The return type.
     * @param name The function name.
     * @param params The formal parameters.
     * @return The declaration node, already added to the top level.
     */
    public Fun declareFunction(Type returnType, String name, ParamList params) {
        ensureTopLevel();
        Fun declaration = new Fun(context, returnType, name);
        declaration.bind(params, null);
        topLevel.add(declaration);
        forwardDeclarations.putIfAbsent(name, declaration);
        return declaration;
    }

    /**
     * Completes the build. Every forward-declared function that never received a body is
     * reported once as DECLARED_BUT_NEVER_DEFINED.
     *
     * @return The translation unit.
     * @throws IllegalStateException if a block or function is still open, or the build
     *         was already finished.
     */
    public TranslationUnit finish() {
        ensureOpen();
        if (!frames.isEmpty()) {
            throw new IllegalStateException(frames.size() + " block(s) still open");
        }
        finished = true;
        for (String name : forwardDeclarations.keySet()) {
            if (!context.scope().isDefined(name)) {
                context.diagnostics().reportDeclaredButNeverDefined(name);
            }
        }
        TranslationUnit unit = new TranslationUnit(topLevel, context.diagnostics().getDiagnostics());
        CompilerLogger.info("Built " + topLevel.size() + " top-level node(s) with "
                + unit.diagnostics().size() + " semantic error(s)");
        return unit;
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("Build already finished");
        }
    }

    private void ensureTopLevel() {
        ensureOpen();
        if (!frames.isEmpty()) {
            throw new IllegalStateException("Functions can only be declared at the top level");
        }
    }
}
