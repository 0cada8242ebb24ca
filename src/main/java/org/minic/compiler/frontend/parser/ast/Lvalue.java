package org.minic.compiler.frontend.parser.ast;

/**
 * Marks nodes that denote an assignable storage location: a variable or an array element.
 */
public interface Lvalue extends AstNode {
}
