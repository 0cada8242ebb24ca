package org.minic.compiler.api;

import org.minic.compiler.diagnostics.Diagnostic;
import org.minic.compiler.frontend.parser.ast.AstNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The result of one build: the top-level nodes in source order and every diagnostic
 * reported while they were built.
 *
 * @param nodes The top-level nodes.
 * @param diagnostics The semantic errors, in reporting order.
 */
public record TranslationUnit(List<AstNode> nodes, List<Diagnostic> diagnostics) {

    public TranslationUnit {
        nodes = List.copyOf(nodes);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if any semantic error was reported.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Renders every top-level node, separated by newlines. A unit with errors still renders.
     * @return The target code.
     */
    public String render() {
        return nodes.stream()
                .map(node -> node.render(0))
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining("\n"));
    }

    /**
     * Renders the unit only if it is free of errors.
     * @return The target code.
     * @throws CompilationException if any semantic error was reported.
     */
    public String renderChecked() throws CompilationException {
        if (hasErrors()) {
            throw new CompilationException(diagnostics);
        }
        return render();
    }
}
