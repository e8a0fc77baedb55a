package com.rulebook.formula;

import com.rulebook.exception.ParseException;
import com.rulebook.formula.ast.BinaryOp;
import com.rulebook.formula.ast.Concat;
import com.rulebook.formula.ast.FieldRef;
import com.rulebook.formula.ast.FormulaNode;
import com.rulebook.formula.ast.FuncCall;
import com.rulebook.formula.ast.LiteralBool;
import com.rulebook.formula.ast.LiteralInt;
import com.rulebook.formula.ast.LiteralString;
import com.rulebook.formula.ast.Operator;
import com.rulebook.formula.ast.UnaryOp;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parser for formulas.
 * Converts tokens into a {@link FormulaNode} tree using recursive descent parsing.
 * Purely syntactic: referenced fields and function names are not checked here.
 * <p>
 * Grammar (lowest to highest precedence):
 * <pre>
 * expression     := or
 * or             := and ('OR' and)*
 * and            := not ('AND' not)*
 * not            := 'NOT' not | comparison
 * comparison     := additive (('=' | '&lt;&gt;' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=') additive)*
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := concat (('*' | '/') concat)*
 * concat         := unary ('&amp;' unary)*
 * unary          := '-' unary | primary
 * primary        := literal | field | '(' expression ')' | 'IF' '(' e ',' e ',' e ')' | name '(' args ')'
 * </pre>
 * {@code NOT}, {@code AND} and {@code OR} followed by {@code (} in operand position
 * are function calls, so both {@code NOT x} and {@code NOT(x)} are accepted.
 */
public final class FormulaParser {

    private static final Map<TokenType, Operator> COMPARISONS = Map.of(
            TokenType.EQ, Operator.EQ,
            TokenType.NE, Operator.NE,
            TokenType.LT, Operator.LT,
            TokenType.LTE, Operator.LTE,
            TokenType.GT, Operator.GT,
            TokenType.GTE, Operator.GTE
    );

    private final String input;
    private final List<Token> tokens;
    private int index;

    public FormulaParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into a formula tree.
     *
     * @return Root node
     * @throws ParseException if the tokens do not form a single well-formed expression
     */
    public FormulaNode parse() {
        FormulaNode result = parseExpression();
        expect(TokenType.EOF, "end of input");
        return result;
    }

    private FormulaNode parseExpression() {
        return parseOr();
    }

    private FormulaNode parseOr() {
        FormulaNode left = parseAnd();
        while (match(TokenType.OR)) {
            left = new BinaryOp(Operator.OR, left, parseAnd());
        }
        return left;
    }

    private FormulaNode parseAnd() {
        FormulaNode left = parseNot();
        while (match(TokenType.AND)) {
            left = new BinaryOp(Operator.AND, left, parseNot());
        }
        return left;
    }

    private FormulaNode parseNot() {
        if (check(TokenType.NOT) && peekNext().type() != TokenType.LPAREN) {
            advance();
            return new UnaryOp(Operator.NOT, parseNot());
        }
        return parseComparison();
    }

    private FormulaNode parseComparison() {
        FormulaNode left = parseAdditive();
        while (COMPARISONS.containsKey(peek().type())) {
            Operator op = COMPARISONS.get(advance().type());
            left = new BinaryOp(op, left, parseAdditive());
        }
        return left;
    }

    private FormulaNode parseAdditive() {
        FormulaNode left = parseMultiplicative();
        while (true) {
            if (match(TokenType.PLUS)) {
                left = new BinaryOp(Operator.ADD, left, parseMultiplicative());
            } else if (match(TokenType.MINUS)) {
                left = new BinaryOp(Operator.SUBTRACT, left, parseMultiplicative());
            } else {
                return left;
            }
        }
    }

    private FormulaNode parseMultiplicative() {
        FormulaNode left = parseConcat();
        while (true) {
            if (match(TokenType.STAR)) {
                left = new BinaryOp(Operator.MULTIPLY, left, parseConcat());
            } else if (match(TokenType.SLASH)) {
                left = new BinaryOp(Operator.DIVIDE, left, parseConcat());
            } else {
                return left;
            }
        }
    }

    private FormulaNode parseConcat() {
        FormulaNode first = parseUnary();
        if (!check(TokenType.AMPERSAND)) {
            return first;
        }
        List<FormulaNode> parts = new ArrayList<>();
        parts.add(first);
        while (match(TokenType.AMPERSAND)) {
            parts.add(parseUnary());
        }
        return new Concat(parts);
    }

    // negation binds to a single operand, like a signed literal
    private FormulaNode parseUnary() {
        if (match(TokenType.MINUS)) {
            return new UnaryOp(Operator.NEGATE, parseUnary());
        }
        return parsePrimary();
    }

    private FormulaNode parsePrimary() {
        Token token = peek();

        switch (token.type()) {
            case INTEGER -> {
                advance();
                return new LiteralInt((Long) token.literal());
            }
            case STRING -> {
                advance();
                return new LiteralString((String) token.literal());
            }
            case BOOLEAN -> {
                advance();
                // TRUE() and FALSE() are the spreadsheet spelling of the bare keywords
                if (match(TokenType.LPAREN)) {
                    expect(TokenType.RPAREN, "')'");
                }
                return new LiteralBool((Boolean) token.literal());
            }
            case FIELD_REF, IDENT -> {
                advance();
                return new FieldRef(token.text());
            }
            case LPAREN -> {
                advance();
                FormulaNode expr = parseExpression();
                expect(TokenType.RPAREN, "')'");
                return expr;
            }
            case IF -> {
                advance();
                List<FormulaNode> args = parseArguments();
                if (args.size() != 3) {
                    throw ParseException.arityMismatch("IF", 3, args.size(), input, token.position());
                }
                return new FuncCall("IF", args);
            }
            case AND, OR, NOT -> {
                if (peekNext().type() == TokenType.LPAREN) {
                    advance();
                    return new FuncCall(token.type().name(), parseArguments());
                }
                throw unexpected("expression");
            }
            case FUNCTION_NAME -> {
                advance();
                return new FuncCall((String) token.literal(), parseArguments());
            }
            default -> throw unexpected("expression");
        }
    }

    private List<FormulaNode> parseArguments() {
        expect(TokenType.LPAREN, "'('");
        List<FormulaNode> args = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            args.add(parseExpression());
            while (match(TokenType.COMMA)) {
                args.add(parseExpression());
            }
        }
        expect(TokenType.RPAREN, "')'");
        return args;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(TokenType type, String description) {
        if (!check(type)) {
            throw unexpected(description);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekNext() {
        return index + 1 < tokens.size() ? tokens.get(index + 1) : tokens.get(tokens.size() - 1);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ParseException unexpected(String expected) {
        Token found = peek();
        String description = found.type() == TokenType.EOF ? "end of input" : "'" + found.text() + "'";
        return ParseException.unexpectedToken(expected, description, input, found.position());
    }
}
