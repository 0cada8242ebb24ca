package org.minic.compiler.frontend.parser.ast;

import org.minic.compiler.types.Type;

/**
 * The empty statement. Renders to nothing, so blocks skip it.
 */
public record Nop() implements AstNode {

    @Override
    public Type type() {
        return Type.VOID;
    }

    @Override
    public String render(int depth) {
        return "";
    }
}
