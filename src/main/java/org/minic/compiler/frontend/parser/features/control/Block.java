package org.minic.compiler.frontend.parser.features.control;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.types.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordered sequence of statements, each rendered on its own line at the block's depth.
 * A failing line marks the block as failed but does not stop rendering.
 */
public final class Block implements AstNode {

    private final List<AstNode> lines = new ArrayList<>();

    /**
     * @param line The statement to append.
     * @return This block.
     */
    public Block add(AstNode line) {
        lines.add(Objects.requireNonNull(line, "line"));
        return this;
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    @Override
    public Type type() {
        return Type.VOID;
    }

    @Override
    public boolean hasError() {
        return lines.stream().anyMatch(AstNode::hasError);
    }

    @Override
    public String render(int depth) {
        return lines.stream()
                .map(line -> line.render(depth))
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining("\n"));
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(lines);
    }
}
