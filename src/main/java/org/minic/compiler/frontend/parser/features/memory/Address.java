package org.minic.compiler.frontend.parser.features.memory;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.parser.ast.Lvalue;
import org.minic.compiler.frontend.parser.ast.RenderSupport;
import org.minic.compiler.types.Type;

import java.util.List;
import java.util.Objects;

/**
 * Takes the address of a storage location, rendered as {@code &lvalue}.
 * Keeps the location's type and reports nothing of its own.
 *
 * @param lvalue The addressed location.
 */
public record Address(Lvalue lvalue) implements AstNode {

    public Address {
        Objects.requireNonNull(lvalue, "lvalue");
    }

    @Override
    public Type type() {
        return lvalue.type();
    }

    @Override
    public boolean hasError() {
        return lvalue.hasError();
    }

    @Override
    public String render(int depth) {
        return RenderSupport.indent(depth) + "&" + lvalue.render(0);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(lvalue);
    }
}
