package com.rulebook.formula.ast;

/**
 * Visitor over {@link FormulaNode}, one method per node kind.
 *
 * @param <R> Result type
 */
public interface FormulaVisitor<R> {

    R visitBool(LiteralBool node);

    R visitInt(LiteralInt node);

    R visitString(LiteralString node);

    R visitFieldRef(FieldRef node);

    R visitUnary(UnaryOp node);

    R visitBinary(BinaryOp node);

    R visitConcat(Concat node);

    R visitFuncCall(FuncCall node);
}
