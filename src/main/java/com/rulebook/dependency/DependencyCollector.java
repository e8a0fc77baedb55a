package com.rulebook.dependency;

import com.rulebook.formula.ast.BinaryOp;
import com.rulebook.formula.ast.Concat;
import com.rulebook.formula.ast.FieldRef;
import com.rulebook.formula.ast.FormulaNode;
import com.rulebook.formula.ast.FormulaVisitor;
import com.rulebook.formula.ast.FuncCall;
import com.rulebook.formula.ast.LiteralBool;
import com.rulebook.formula.ast.LiteralInt;
import com.rulebook.formula.ast.LiteralString;
import com.rulebook.formula.ast.UnaryOp;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Collects the field names a formula reads.
 */
public final class DependencyCollector implements FormulaVisitor<Void> {

    private final SortedSet<String> fields = new TreeSet<>();

    private DependencyCollector() {
    }

    /**
     * Every field referenced anywhere in the tree, sorted by name.
     */
    public static SortedSet<String> fieldDependencies(FormulaNode node) {
        DependencyCollector collector = new DependencyCollector();
        node.accept(collector);
        return Collections.unmodifiableSortedSet(collector.fields);
    }

    @Override
    public Void visitBool(LiteralBool node) {
        return null;
    }

    @Override
    public Void visitInt(LiteralInt node) {
        return null;
    }

    @Override
    public Void visitString(LiteralString node) {
        return null;
    }

    @Override
    public Void visitFieldRef(FieldRef node) {
        fields.add(node.name());
        return null;
    }

    @Override
    public Void visitUnary(UnaryOp node) {
        return node.operand().accept(this);
    }

    @Override
    public Void visitBinary(BinaryOp node) {
        node.left().accept(this);
        return node.right().accept(this);
    }

    @Override
    public Void visitConcat(Concat node) {
        node.parts().forEach(part -> part.accept(this));
        return null;
    }

    @Override
    public Void visitFuncCall(FuncCall node) {
        node.args().forEach(arg -> arg.accept(this));
        return null;
    }
}
