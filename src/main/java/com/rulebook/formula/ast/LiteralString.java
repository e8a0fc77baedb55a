package com.rulebook.formula.ast;

import java.util.Objects;

public record LiteralString(String value) implements FormulaNode {

    public LiteralString {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitString(this);
    }
}
