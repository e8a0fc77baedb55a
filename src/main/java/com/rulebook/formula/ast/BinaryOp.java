package com.rulebook.formula.ast;

import java.util.Objects;

public record BinaryOp(Operator op, FormulaNode left, FormulaNode right) implements FormulaNode {

    public BinaryOp {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (op.isUnary()) {
            throw new IllegalArgumentException("Not a binary operator: " + op);
        }
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
