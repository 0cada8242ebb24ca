package org.minic.compiler.frontend.parser.ast;

import org.minic.compiler.types.Literal;
import org.minic.compiler.types.Type;

import java.util.Objects;

/**
 * A literal value. Literals are well-typed by construction and never fail.
 *
 * @param type The literal's type.
 * @param text The lexeme, rendered verbatim.
 */
public record Constant(Type type, String text) implements AstNode {

    public Constant {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    /**
     * @param literal A scanner literal.
     */
    public Constant(Literal literal) {
        this(literal.type(), literal.text());
    }

    @Override
    public String render(int depth) {
        return RenderSupport.indent(depth) + text;
    }
}
