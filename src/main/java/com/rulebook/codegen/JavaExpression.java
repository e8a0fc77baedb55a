package com.rulebook.codegen;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Expression tree of the generated Java code.
 * <p>
 * Generated source is rendered from this tree rather than assembled from strings,
 * so literal text is always escaped in one place.
 */
public sealed interface JavaExpression {

    /**
     * Java source text of this expression.
     */
    String render();

    /**
     * Verbatim source such as {@code Boolean.TRUE} or {@code Long.valueOf(3L)}.
     */
    record Literal(String source) implements JavaExpression {
        @Override
        public String render() {
            return source;
        }
    }

    record StringLiteral(String value) implements JavaExpression {
        @Override
        public String render() {
            return quote(value);
        }
    }

    /**
     * Parameter reference.
     */
    record Name(String identifier) implements JavaExpression {
        @Override
        public String render() {
            return identifier;
        }
    }

    /**
     * Static method call, e.g. {@code FormulaRuntime.eq(a, b)}.
     */
    record Call(String owner, String method, List<JavaExpression> args) implements JavaExpression {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public String render() {
            return owner + "." + method + "(" + args.stream()
                    .map(JavaExpression::render)
                    .collect(Collectors.joining(", ")) + ")";
        }
    }

    /**
     * {@code cond ? then : otherwise} over Object branches, so a null branch is never unboxed.
     */
    record Conditional(JavaExpression condition, JavaExpression then, JavaExpression otherwise)
            implements JavaExpression {
        @Override
        public String render() {
            return "(" + condition.render() + " ? (Object) " + then.render()
                    + " : (Object) " + otherwise.render() + ")";
        }
    }

    /**
     * Short-circuit {@code &&} or {@code ||} over primitive boolean operands.
     */
    record Logical(String operator, List<JavaExpression> operands) implements JavaExpression {
        public Logical {
            if (!operator.equals("&&") && !operator.equals("||")) {
                throw new IllegalArgumentException("Invalid logical operator: " + operator);
            }
            operands = List.copyOf(operands);
        }

        @Override
        public String render() {
            return "(" + operands.stream()
                    .map(JavaExpression::render)
                    .collect(Collectors.joining(" " + operator + " ")) + ")";
        }
    }

    /**
     * Box a primitive boolean expression.
     */
    record Boxed(JavaExpression primitive) implements JavaExpression {
        @Override
        public String render() {
            return "Boolean.valueOf(" + primitive.render() + ")";
        }
    }

    /**
     * Java string literal with quotes. Non-ASCII characters become unicode escapes.
     */
    static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20 || c > 0x7e) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
