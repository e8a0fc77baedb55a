package com.rulebook.formula;

import com.rulebook.formula.ast.FormulaNode;

import java.util.List;

/**
 * Facade for turning formula text into a {@link FormulaNode} tree.
 * <p>
 * Parsing is pure and idempotent: the same text always yields an equal tree.
 */
public final class Formulas {

    private Formulas() {
    }

    /**
     * Tokenize formula text.
     *
     * @param formula Formula text, optionally starting with {@code =}
     * @return Tokens terminated by EOF
     */
    public static List<Token> tokenize(String formula) {
        return new FormulaTokenizer(formula).tokenize();
    }

    /**
     * Parse formula text.
     *
     * @param formula Formula text, optionally starting with {@code =}
     * @return Parsed tree
     */
    public static FormulaNode parse(String formula) {
        List<Token> tokens = tokenize(formula);
        return new FormulaParser(formula, tokens).parse();
    }
}
