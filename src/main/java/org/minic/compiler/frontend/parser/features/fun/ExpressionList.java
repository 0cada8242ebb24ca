package org.minic.compiler.frontend.parser.features.fun;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.types.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A comma-separated list of expressions, used for call arguments.
 */
public final class ExpressionList implements AstNode, Iterable<AstNode> {

    private final List<AstNode> expressions = new ArrayList<>();

    public ExpressionList add(AstNode expression) {
        expressions.add(Objects.requireNonNull(expression, "expression"));
        return this;
    }

    public int size() {
        return expressions.size();
    }

    public AstNode get(int index) {
        return expressions.get(index);
    }

    @Override
    public Iterator<AstNode> iterator() {
        return getChildren().iterator();
    }

    @Override
    public Type type() {
        return Type.VOID;
    }

    @Override
    public boolean hasError() {
        return expressions.stream().anyMatch(AstNode::hasError);
    }

    @Override
    public String render(int depth) {
        return expressions.stream()
                .map(expression -> expression.render(0))
                .collect(Collectors.joining(", "));
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(expressions);
    }
}
