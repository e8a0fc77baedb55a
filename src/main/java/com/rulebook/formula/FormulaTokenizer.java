package com.rulebook.formula;

import com.rulebook.exception.LexException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.rulebook.formula.FormulaConfig.*;

/**
 * Tokenizer for formulas.
 * Converts formula text into a sequence of tokens in a single left-to-right pass.
 * <p>
 * String escapes: {@code \'} becomes {@code '}, {@code \\} becomes {@code \};
 * any other backslash sequence is kept literally, backslash included.
 */
public final class FormulaTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public FormulaTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, terminated by an EOF token
     * @throws LexException if the text contains an unterminated string or a stray character
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        skipFormulaMarker();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", null, start));
                }
                case Operators.RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", null, start));
                }
                case Operators.COMMA -> {
                    advance();
                    tokens.add(new Token(TokenType.COMMA, ",", null, start));
                }
                case Operators.AMPERSAND -> {
                    advance();
                    tokens.add(new Token(TokenType.AMPERSAND, "&", null, start));
                }
                case Operators.EQUALS -> {
                    advance();
                    tokens.add(new Token(TokenType.EQ, "=", null, start));
                }
                case Operators.LESS -> {
                    advance();
                    if (match(Operators.GREATER)) {
                        tokens.add(new Token(TokenType.NE, "<>", null, start));
                    } else if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.LTE, "<=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.LT, "<", null, start));
                    }
                }
                case Operators.GREATER -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.GTE, ">=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.GT, ">", null, start));
                    }
                }
                case Operators.PLUS -> {
                    advance();
                    tokens.add(new Token(TokenType.PLUS, "+", null, start));
                }
                case Operators.MINUS -> {
                    if (isSignedLiteral(tokens)) {
                        tokens.add(readInteger());
                    } else {
                        advance();
                        tokens.add(new Token(TokenType.MINUS, "-", null, start));
                    }
                }
                case Operators.STAR -> {
                    advance();
                    tokens.add(new Token(TokenType.STAR, "*", null, start));
                }
                case Operators.SLASH -> {
                    advance();
                    tokens.add(new Token(TokenType.SLASH, "/", null, start));
                }
                case Operators.LEFT_BRACE -> tokens.add(readFieldReference());
                case Operators.QUOTE_DOUBLE, Operators.QUOTE_SINGLE -> tokens.add(readString());
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifierOrKeyword());
                    } else if (Character.isDigit(c)) {
                        tokens.add(readInteger());
                    } else {
                        throw LexException.unexpectedCharacter("Unexpected character '" + c + "'", input, start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private void skipFormulaMarker() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
        if (!isAtEnd() && peek() == FORMULA_MARKER) {
            advance();
        }
    }

    private boolean isSignedLiteral(List<Token> tokens) {
        if (pos + 1 >= length || !Character.isDigit(input.charAt(pos + 1))) {
            return false;
        }
        return tokens.isEmpty() || !tokens.get(tokens.size() - 1).endsOperand();
    }

    private Token readFieldReference() {
        int start = pos;
        advance();
        if (!match(Operators.LEFT_BRACE)) {
            throw LexException.unexpectedCharacter("Expected '{{' to open a field reference", input, start);
        }
        int nameStart = pos;
        while (!isAtEnd() && peek() != Operators.RIGHT_BRACE) {
            advance();
        }
        String name = input.substring(nameStart, pos).trim();
        if (!match(Operators.RIGHT_BRACE) || !match(Operators.RIGHT_BRACE)) {
            throw LexException.unexpectedCharacter("Expected '}}' to close a field reference", input, start);
        }
        if (name.isEmpty()) {
            throw LexException.unexpectedCharacter("Empty field reference", input, start);
        }
        return new Token(TokenType.FIELD_REF, name, name, start);
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;

        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        String upper = text.toUpperCase(Locale.ROOT);

        TokenType keywordType = KEYWORDS.get(upper);
        if (keywordType != null) {
            Object literal = null;
            if (keywordType == TokenType.BOOLEAN) {
                literal = BOOLEAN_VALUES.get(upper);
            }
            return new Token(keywordType, text, literal, start);
        }

        if (nextNonWhitespace() == Operators.LEFT_PAREN) {
            return new Token(TokenType.FUNCTION_NAME, text, upper, start);
        }
        return new Token(TokenType.IDENT, text, text, start);
    }

    private Token readInteger() {
        int start = pos;

        if (peek() == Operators.MINUS) {
            advance();
        }
        while (!isAtEnd() && Character.isDigit(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        try {
            return new Token(TokenType.INTEGER, text, Long.parseLong(text), start);
        } catch (NumberFormatException e) {
            throw LexException.unexpectedCharacter("Integer out of range '" + text + "'", input, start);
        }
    }

    private Token readString() {
        int start = pos;
        char quote = advance();
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();

            if (c == Operators.BACKSLASH && !isAtEnd()) {
                char escaped = advance();
                if (escaped == Operators.QUOTE_SINGLE || escaped == Operators.BACKSLASH) {
                    sb.append(escaped);
                } else {
                    sb.append(c).append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw LexException.unterminatedString(input, start);
        }

        advance(); // closing quote
        String value = sb.toString();
        return new Token(TokenType.STRING, input.substring(start, pos), value, start);
    }

    private char nextNonWhitespace() {
        int i = pos;
        while (i < length && Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        return i < length ? input.charAt(i) : '\0';
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == Operators.UNDERSCORE;
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == Operators.UNDERSCORE;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
