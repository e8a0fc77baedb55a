package com.rulebook.formula.ast;

import java.util.Objects;

/**
 * Reference to another field of the same entity, written {@code {{Name}}}.
 */
public record FieldRef(String name) implements FormulaNode {

    public FieldRef {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitFieldRef(this);
    }
}
