package com.rulebook.formula.ast;

public record LiteralBool(boolean value) implements FormulaNode {

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitBool(this);
    }
}
