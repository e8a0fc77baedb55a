package com.rulebook.formula.ast;

import java.util.List;

/**
 * Flattened {@code &} chain: {@code a & b & c} is one node with three parts.
 */
public record Concat(List<FormulaNode> parts) implements FormulaNode {

    public Concat {
        parts = List.copyOf(parts);
        if (parts.size() < 2) {
            throw new IllegalArgumentException("Concat needs at least 2 parts, got " + parts.size());
        }
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitConcat(this);
    }
}
