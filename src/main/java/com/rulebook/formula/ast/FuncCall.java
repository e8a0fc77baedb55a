package com.rulebook.formula.ast;

import java.util.List;
import java.util.Objects;

/**
 * Function call. The name is stored upper-case.
 */
public record FuncCall(String name, List<FormulaNode> args) implements FormulaNode {

    public FuncCall {
        Objects.requireNonNull(name, "name");
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitFuncCall(this);
    }
}
