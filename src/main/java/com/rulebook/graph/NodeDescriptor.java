package com.rulebook.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rulebook.schema.Identifiers;

import java.util.List;

/**
 * Payload of one provenance graph node. Only the properties of its kind are set.
 *
 * @param kind       Node kind
 * @param value      Literal value of a {@code const} node
 * @param type       Literal datatype of a {@code const} node: boolean, integer or string
 * @param field      Field name of a {@code field_ref} or {@code result} node
 * @param fieldSnake snake_case form of {@code field}
 * @param name       Operator symbol or function name of an {@code op} or {@code fn} node
 * @param args       Operand node ids of an {@code op} or {@code fn} node
 * @param in         Expression root id of the {@code result} node
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeDescriptor(
        @JsonProperty("kind") NodeKind kind,
        @JsonProperty("value") Object value,
        @JsonProperty("type") String type,
        @JsonProperty("field") String field,
        @JsonProperty("field_snake") String fieldSnake,
        @JsonProperty("name") String name,
        @JsonProperty("args") List<String> args,
        @JsonProperty("in") List<String> in
) {
    public NodeDescriptor {
        args = args == null ? null : List.copyOf(args);
        in = in == null ? null : List.copyOf(in);
    }

    public static NodeDescriptor constant(Object value, String type) {
        return new NodeDescriptor(NodeKind.CONST, value, type, null, null, null, null, null);
    }

    public static NodeDescriptor fieldRef(String field) {
        return new NodeDescriptor(NodeKind.FIELD_REF, null, null, field, Identifiers.toSnakeCase(field),
                null, null, null);
    }

    public static NodeDescriptor operator(String name, List<String> args) {
        return new NodeDescriptor(NodeKind.OP, null, null, null, null, name, args, null);
    }

    public static NodeDescriptor function(String name, List<String> args) {
        return new NodeDescriptor(NodeKind.FN, null, null, null, null, name, args, null);
    }

    public static NodeDescriptor result(String field, String root) {
        return new NodeDescriptor(NodeKind.RESULT, null, null, field, Identifiers.toSnakeCase(field),
                null, null, List.of(root));
    }
}
