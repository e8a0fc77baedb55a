package com.rulebook.codegen;

import com.rulebook.exception.CodeGenerationException;
import com.rulebook.formula.BuiltinFunction;
import com.rulebook.formula.ast.BinaryOp;
import com.rulebook.formula.ast.Concat;
import com.rulebook.formula.ast.FieldRef;
import com.rulebook.formula.ast.FormulaNode;
import com.rulebook.formula.ast.FormulaVisitor;
import com.rulebook.formula.ast.FuncCall;
import com.rulebook.formula.ast.LiteralBool;
import com.rulebook.formula.ast.LiteralInt;
import com.rulebook.formula.ast.LiteralString;
import com.rulebook.formula.ast.Operator;
import com.rulebook.formula.ast.UnaryOp;
import com.rulebook.runtime.FormulaRuntime;
import com.rulebook.schema.Identifiers;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates a formula tree into a static Java method over {@link FormulaRuntime}.
 * <p>
 * The method takes one {@code Object} parameter per dependency, in sorted dependency
 * order, and returns a {@link Boolean}, {@link Long}, {@link String} or {@code null}.
 * The output depends only on its inputs, so repeated generation is byte-identical.
 */
public class JavaCodeGenerator {

    static final String RUNTIME = FormulaRuntime.class.getSimpleName();

    private static final String INDENT = "    ";

    /**
     * Generate the method for one calculated field.
     *
     * @param entityName      Owning entity
     * @param fieldName       Calculated field
     * @param ast             Parsed formula
     * @param dependencyOrder Sorted names of the fields the formula reads
     * @throws CodeGenerationException if the formula reads a field outside {@code dependencyOrder}
     *                                 or calls a function with no Java translation
     */
    public GeneratedFunction generate(String entityName, String fieldName, FormulaNode ast,
                                      List<String> dependencyOrder) {
        return generate(entityName, fieldName, ast, dependencyOrder, null);
    }

    /**
     * Same as {@link #generate(String, String, FormulaNode, List)}, quoting
     * {@code formulaText} in the method's Javadoc.
     */
    public GeneratedFunction generate(String entityName, String fieldName, FormulaNode ast,
                                      List<String> dependencyOrder, String formulaText) {
        return generate(entityName, fieldName, ast, dependencyOrder, formulaText, methodName(fieldName));
    }

    /**
     * Generate under an explicit method name, used when two field names share one identifier.
     */
    public GeneratedFunction generate(String entityName, String fieldName, FormulaNode ast,
                                      List<String> dependencyOrder, String formulaText, String methodName) {
        Map<String, String> parameters = parameterNames(dependencyOrder);
        JavaExpression expression = ast.accept(new Translation(fieldName, parameters));

        StringBuilder sb = new StringBuilder();
        sb.append(INDENT).append("/**\n");
        sb.append(INDENT).append(" * ").append(javadocText(fieldName));
        if (formulaText != null) {
            sb.append(": ").append(javadocText(formulaText));
        }
        sb.append('\n');
        sb.append(INDENT).append(" */\n");
        sb.append(INDENT).append("public static Object ").append(methodName).append('(');
        List<String> declared = new ArrayList<>();
        for (String parameter : parameters.values()) {
            declared.add("Object " + parameter);
        }
        sb.append(String.join(", ", declared)).append(") {\n");
        sb.append(INDENT).append(INDENT).append("return ").append(expression.render()).append(";\n");
        sb.append(INDENT).append("}\n");

        return new GeneratedFunction(entityName, fieldName, methodName, dependencyOrder,
                List.copyOf(parameters.values()), expression, sb.toString());
    }

    /**
     * {@code calc<Field>} in PascalCase.
     */
    public static String methodName(String fieldName) {
        return "calc" + Identifiers.toPascalCase(fieldName);
    }

    /**
     * Java parameter per dependency, made unique when two names convert to the same identifier.
     */
    static Map<String, String> parameterNames(List<String> dependencyOrder) {
        Map<String, String> parameters = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (String dependency : dependencyOrder) {
            String base = Identifiers.toJavaParameter(dependency);
            String name = base;
            for (int i = 2; !used.add(name); i++) {
                name = base + i;
            }
            parameters.put(dependency, name);
        }
        return parameters;
    }

    /**
     * Text safe inside a Javadoc comment: no comment terminator, no unicode escapes, single line,
     * ASCII only so the generated file compiles under any source encoding.
     */
    static String javadocText(String text) {
        String escaped = text.replace("\\", "\\\\")
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("*/", "*&#47;")
                .replace("\r", " ")
                .replace("\n", " ");
        StringBuilder sb = new StringBuilder(escaped.length());
        escaped.codePoints().forEach(cp -> {
            if (cp < 0x20 || cp > 0x7e) {
                sb.append("&#").append(cp).append(';');
            } else {
                sb.appendCodePoint(cp);
            }
        });
        return sb.toString();
    }

    private static final class Translation implements FormulaVisitor<JavaExpression> {

        private final String fieldName;
        private final Map<String, String> parameters;

        Translation(String fieldName, Map<String, String> parameters) {
            this.fieldName = fieldName;
            this.parameters = parameters;
        }

        @Override
        public JavaExpression visitBool(LiteralBool node) {
            return new JavaExpression.Literal(node.value() ? "Boolean.TRUE" : "Boolean.FALSE");
        }

        @Override
        public JavaExpression visitInt(LiteralInt node) {
            return new JavaExpression.Literal("Long.valueOf(" + node.value() + "L)");
        }

        @Override
        public JavaExpression visitString(LiteralString node) {
            return new JavaExpression.StringLiteral(node.value());
        }

        @Override
        public JavaExpression visitFieldRef(FieldRef node) {
            String parameter = parameters.get(node.name());
            if (parameter == null) {
                throw new CodeGenerationException("Field " + fieldName + " reads " + node.name()
                        + " which is not among its dependencies " + parameters.keySet());
            }
            return new JavaExpression.Name(parameter);
        }

        @Override
        public JavaExpression visitUnary(UnaryOp node) {
            JavaExpression operand = node.operand().accept(this);
            return switch (node.op()) {
                case NOT -> runtime("not", operand);
                case NEGATE -> runtime("negate", operand);
                default -> throw new CodeGenerationException("Invalid unary operator: " + node.op());
            };
        }

        @Override
        public JavaExpression visitBinary(BinaryOp node) {
            JavaExpression left = node.left().accept(this);
            JavaExpression right = node.right().accept(this);
            Operator op = node.op();
            return switch (op) {
                case AND -> logical("&&", List.of(left, right));
                case OR -> logical("||", List.of(left, right));
                case EQ -> runtime("eq", left, right);
                case NE -> runtime("ne", left, right);
                case LT -> runtime("lt", left, right);
                case LTE -> runtime("lte", left, right);
                case GT -> runtime("gt", left, right);
                case GTE -> runtime("gte", left, right);
                case ADD -> runtime("add", left, right);
                case SUBTRACT -> runtime("subtract", left, right);
                case MULTIPLY -> runtime("multiply", left, right);
                case DIVIDE -> runtime("divide", left, right);
                default -> throw new CodeGenerationException("Invalid binary operator: " + op);
            };
        }

        @Override
        public JavaExpression visitConcat(Concat node) {
            return new JavaExpression.Call(RUNTIME, "concat", translate(node.parts()));
        }

        @Override
        public JavaExpression visitFuncCall(FuncCall node) {
            BuiltinFunction function = BuiltinFunction.lookup(node.name())
                    .orElseThrow(() -> new CodeGenerationException("Field " + fieldName
                            + " calls unknown function " + node.name()));
            if (!function.accepts(node.args().size())) {
                throw new CodeGenerationException(function + " takes " + function.arityDescription()
                        + " arguments, got " + node.args().size());
            }
            List<JavaExpression> args = translate(node.args());

            return switch (function) {
                case AND -> args.isEmpty() ? new JavaExpression.Literal("Boolean.TRUE") : logical("&&", args);
                case OR -> args.isEmpty() ? new JavaExpression.Literal("Boolean.FALSE") : logical("||", args);
                case NOT -> runtime("not", args.get(0));
                case IF -> new JavaExpression.Conditional(runtime("isTrue", args.get(0)), args.get(1), args.get(2));
                case CONCATENATE -> new JavaExpression.Call(RUNTIME, "concat", args);
                case LOWER -> runtime("lower", args.get(0));
                case UPPER -> runtime("upper", args.get(0));
                case TRIM -> runtime("trim", args.get(0));
                case LEN -> runtime("len", args.get(0));
                case FIND -> new JavaExpression.Call(RUNTIME, "find", args);
                case ISBLANK -> runtime("isBlank", args.get(0));
            };
        }

        private List<JavaExpression> translate(List<FormulaNode> nodes) {
            List<JavaExpression> translated = new ArrayList<>();
            for (FormulaNode node : nodes) {
                translated.add(node.accept(this));
            }
            return translated;
        }

        private static JavaExpression logical(String operator, List<JavaExpression> operands) {
            List<JavaExpression> tests = new ArrayList<>();
            for (JavaExpression operand : operands) {
                tests.add(runtime("isTrue", operand));
            }
            return new JavaExpression.Boxed(new JavaExpression.Logical(operator, tests));
        }

        private static JavaExpression runtime(String method, JavaExpression... args) {
            return new JavaExpression.Call(RUNTIME, method, List.of(args));
        }
    }
}
