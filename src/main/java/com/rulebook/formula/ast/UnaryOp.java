package com.rulebook.formula.ast;

import java.util.Objects;

/**
 * Prefix operator: {@link Operator#NOT} or {@link Operator#NEGATE}.
 */
public record UnaryOp(Operator op, FormulaNode operand) implements FormulaNode {

    public UnaryOp {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(operand, "operand");
        if (!op.isUnary()) {
            throw new IllegalArgumentException("Not a unary operator: " + op);
        }
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
