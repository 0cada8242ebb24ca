package org.minic.compiler.frontend.parser.ast;

import org.minic.compiler.types.Type;

/**
 * Text conventions shared by all node renderers.
 */
public final class RenderSupport {

    /** One level of indentation. */
    public static final String INDENT_UNIT = "    ";

    private RenderSupport() {}

    /**
     * @param depth The nesting depth, never negative.
     * @return The indentation prefix for that depth.
     */
    public static String indent(int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("Negative render depth: " + depth);
        }
        return INDENT_UNIT.repeat(depth);
    }

    /**
     * @param target The type converted to.
     * @param operandText The rendered operand.
     * @return The operand with an explicit cast prefix, e.g. {@code [float]x}.
     */
    public static String cast(Type target, String operandText) {
        return "[" + target.targetName() + "]" + operandText;
    }

    /**
     * Removes a single trailing statement terminator, so that a statement can be used
     * inside a loop header.
     * @param text The rendered statement.
     * @return The text without a trailing {@code ;}.
     */
    public static String withoutTerminator(String text) {
        String trimmed = text.strip();
        return trimmed.endsWith(";") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    /**
     * Appends a nested body on its own lines. Bodies that render to nothing add nothing.
     * @param out The buffer holding the enclosing construct.
     * @param body The nested node.
     * @param depth The depth of the body's lines.
     */
    public static void appendBody(StringBuilder out, AstNode body, int depth) {
        String text = body.render(depth);
        if (!text.isEmpty()) {
            out.append('\n').append(text);
        }
    }
}
