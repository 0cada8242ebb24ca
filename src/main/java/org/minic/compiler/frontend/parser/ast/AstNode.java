package org.minic.compiler.frontend.parser.ast;

import org.minic.compiler.types.Type;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * Nodes validate themselves when they are constructed. After construction a node
 * only answers questions: its static type, whether it carries an unrecovered error,
 * and its rendering in target code. Rendering never changes the node.
 */
public interface AstNode {

    /**
     * @return The static type of this node; {@link Type#VOID} for statements and
     *         {@link Type#ANY} for nodes whose type could not be determined.
     */
    Type type();

    /**
     * @return {@code true} if this node or one of its children failed validation.
     */
    default boolean hasError() {
        return false;
    }

    /**
     * Renders this node as target code.
     *
     * @param depth The nesting depth; each level indents by {@link RenderSupport#INDENT_UNIT}.
     * @return The rendered text, without a trailing newline.
     */
    String render(int depth);

    /**
     * @return {@code true} if the rendering of this node is already enclosed in parentheses.
     */
    default boolean bracketsItself() {
        return false;
    }

    /**
     * @return The rendering at depth 0.
     */
    default String render() {
        return render(0);
    }

    /**
     * Returns a list of the direct child nodes, in rendering order.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
