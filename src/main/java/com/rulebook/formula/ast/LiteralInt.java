package com.rulebook.formula.ast;

public record LiteralInt(long value) implements FormulaNode {

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitInt(this);
    }
}
