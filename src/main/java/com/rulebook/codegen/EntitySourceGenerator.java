package com.rulebook.codegen;

import com.rulebook.core.FieldResult;
import com.rulebook.dependency.LevelAssignment;
import com.rulebook.exception.EvaluationException;
import com.rulebook.runtime.FormulaRuntime;
import com.rulebook.schema.DataType;
import com.rulebook.schema.EntitySchema;
import com.rulebook.schema.Field;
import com.rulebook.schema.Identifiers;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assembles the generated methods of one entity into a compilable class.
 * <p>
 * The class holds one {@code calc<Field>} method per calculated field, grouped by level,
 * and a {@code computeAll} method that fills in every calculated field of a record map.
 * A field whose generation failed gets a method that throws, and computes to {@code null}.
 */
public class EntitySourceGenerator {

    private static final String INDENT = "    ";

    private final String packageName;
    private final boolean blankStringsAsNull;

    public EntitySourceGenerator(String packageName, boolean blankStringsAsNull) {
        this.packageName = packageName;
        this.blankStringsAsNull = blankStringsAsNull;
    }

    /**
     * {@code <Entity>Calculations}.
     */
    public static String className(String entityName) {
        return Identifiers.toPascalCase(entityName) + "Calculations";
    }

    public String qualifiedClassName(String entityName) {
        return packageName.isEmpty() ? className(entityName) : packageName + "." + className(entityName);
    }

    /**
     * Unique method name per calculated field, in level order.
     */
    public static Map<String, String> methodNames(LevelAssignment levels) {
        Map<String, String> names = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (String field : levels.calcOrder()) {
            String base = JavaCodeGenerator.methodName(field);
            String name = base;
            for (int i = 2; !used.add(name); i++) {
                name = base + i;
            }
            names.put(field, name);
        }
        return names;
    }

    /**
     * Render the class source.
     *
     * @param entity    Entity schema
     * @param levels    Level assignment of the entity
     * @param functions Generation outcome per calculated field
     */
    public String generate(EntitySchema entity, LevelAssignment levels,
                           Map<String, FieldResult<GeneratedFunction>> functions) {
        Map<String, String> methodNames = methodNames(levels);
        StringBuilder sb = new StringBuilder();

        if (!packageName.isEmpty()) {
            sb.append("package ").append(packageName).append(";\n\n");
        }
        sb.append("import ").append(EvaluationException.class.getName()).append(";\n");
        sb.append("import ").append(FormulaRuntime.class.getName()).append(";\n\n");
        sb.append("import java.util.LinkedHashMap;\n");
        sb.append("import java.util.List;\n");
        sb.append("import java.util.Map;\n");
        sb.append("import java.util.function.Supplier;\n\n");

        sb.append("/**\n");
        sb.append(" * Calculated fields of ").append(JavaCodeGenerator.javadocText(entity.name())).append(".\n");
        sb.append(" */\n");
        sb.append("public final class ").append(className(entity.name())).append(" {\n\n");

        sb.append(INDENT).append("private static final List<String> STRING_FIELDS = List.of(")
                .append(String.join(", ", stringFields(entity, levels))).append(");\n\n");

        sb.append(INDENT).append("private ").append(className(entity.name())).append("() {\n");
        sb.append(INDENT).append("}\n");

        for (int i = 0; i < levels.levels().size(); i++) {
            sb.append('\n').append(INDENT).append("// Level ").append(i + 1).append('\n');
            for (Field field : levels.levels().get(i)) {
                sb.append('\n');
                FieldResult<GeneratedFunction> function = functions.get(field.name());
                if (function != null && function.isSuccess()) {
                    sb.append(function.orElseThrow().source());
                } else {
                    sb.append(failedMethod(field, methodNames.get(field.name()), function));
                }
            }
        }

        sb.append('\n');
        appendComputeAll(sb, levels, functions, methodNames);
        sb.append('\n');
        appendAttempt(sb);
        sb.append("}\n");
        return sb.toString();
    }

    private List<String> stringFields(EntitySchema entity, LevelAssignment levels) {
        List<String> names = new ArrayList<>();
        if (!blankStringsAsNull) {
            return names;
        }
        for (String field : levels.calcOrder()) {
            if (entity.field(field).map(f -> f.datatype() == DataType.STRING).orElse(false)) {
                names.add(JavaExpression.quote(field));
            }
        }
        return names;
    }

    private static String failedMethod(Field field, String methodName, FieldResult<GeneratedFunction> function) {
        String reason = function == null
                ? "not generated"
                : function.getError().map(Object::toString).orElse("not generated");
        return INDENT + "/**\n"
                + INDENT + " * " + JavaCodeGenerator.javadocText(field.name()) + ": generation failed\n"
                + INDENT + " */\n"
                + INDENT + "public static Object " + methodName + "() {\n"
                + INDENT + INDENT + "throw new UnsupportedOperationException("
                + JavaExpression.quote(reason) + ");\n"
                + INDENT + "}\n";
    }

    private static void appendComputeAll(StringBuilder sb, LevelAssignment levels,
                                         Map<String, FieldResult<GeneratedFunction>> functions,
                                         Map<String, String> methodNames) {
        String body = INDENT + INDENT;
        sb.append(INDENT).append("/**\n");
        sb.append(INDENT).append(" * Copy of {@code record} with every calculated field filled in.\n");
        sb.append(INDENT).append(" */\n");
        sb.append(INDENT).append("public static Map<String, Object> computeAll(Map<String, Object> record) {\n");
        sb.append(body).append("Map<String, Object> result = new LinkedHashMap<>(record);\n");

        for (int i = 0; i < levels.levels().size(); i++) {
            sb.append('\n').append(body).append("// Level ").append(i + 1).append('\n');
            for (Field field : levels.levels().get(i)) {
                String key = JavaExpression.quote(field.name());
                FieldResult<GeneratedFunction> function = functions.get(field.name());
                if (function == null || !function.isSuccess()) {
                    sb.append(body).append("result.put(").append(key).append(", null);\n");
                    continue;
                }
                List<String> args = new ArrayList<>();
                for (String dependency : function.orElseThrow().dependencies()) {
                    args.add("result.get(" + JavaExpression.quote(dependency) + ")");
                }
                sb.append(body).append("result.put(").append(key).append(", attempt(() -> ")
                        .append(methodNames.get(field.name())).append('(')
                        .append(String.join(", ", args)).append(")));\n");
            }
        }

        sb.append('\n');
        sb.append(body).append("for (String field : STRING_FIELDS) {\n");
        sb.append(body).append(INDENT).append("if (\"\".equals(result.get(field))) {\n");
        sb.append(body).append(INDENT).append(INDENT).append("result.put(field, null);\n");
        sb.append(body).append(INDENT).append("}\n");
        sb.append(body).append("}\n");
        sb.append(body).append("return result;\n");
        sb.append(INDENT).append("}\n");
    }

    private static void appendAttempt(StringBuilder sb) {
        String body = INDENT + INDENT;
        sb.append(INDENT).append("private static Object attempt(Supplier<Object> calculation) {\n");
        sb.append(body).append("try {\n");
        sb.append(body).append(INDENT).append("return calculation.get();\n");
        sb.append(body).append("} catch (EvaluationException e) {\n");
        sb.append(body).append(INDENT).append("return null;\n");
        sb.append(body).append("}\n");
        sb.append(INDENT).append("}\n");
    }
}
