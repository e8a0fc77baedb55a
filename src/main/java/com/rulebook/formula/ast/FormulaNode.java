package com.rulebook.formula.ast;

/**
 * Node of a parsed formula.
 * <p>
 * The hierarchy is closed: every backend implements {@link FormulaVisitor},
 * so adding a node kind fails compilation until each backend handles it.
 * Nodes are immutable and form a tree.
 */
public sealed interface FormulaNode
        permits LiteralBool, LiteralInt, LiteralString, FieldRef, UnaryOp, BinaryOp, Concat, FuncCall {

    <R> R accept(FormulaVisitor<R> visitor);
}
