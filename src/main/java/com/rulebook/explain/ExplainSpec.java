package com.rulebook.explain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.rulebook.graph.NodeDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Explanation document of a whole rulebook: field metadata, evaluation order and
 * one expression template per calculated field.
 */
@JsonPropertyOrder({"schema_version", "rulebook", "semantics", "entities"})
public record ExplainSpec(
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("rulebook") RulebookInfo rulebook,
        @JsonProperty("semantics") Semantics semantics,
        @JsonProperty("entities") Map<String, EntityExplanation> entities
) {
    public static final String SCHEMA_VERSION = "erb.explain_spec.v1";

    public record RulebookInfo(
            @JsonProperty("name") String name,
            @JsonProperty("rulebook_hash") String rulebookHash
    ) {
    }

    /**
     * Evaluation rules the templates assume.
     */
    public record Semantics(
            @JsonProperty("profile") String profile,
            @JsonProperty("version") String version,
            @JsonProperty("null_handling") String nullHandling,
            @JsonProperty("boolean_coercion") String booleanCoercion
    ) {
        public static final Semantics DEFAULT = new Semantics("excel", "v1", "three_valued_logic", "strict");
    }

    @JsonPropertyOrder({"id_field", "id_field_snake", "fields", "calc_order", "dep_edges", "expr_templates"})
    public record EntityExplanation(
            @JsonProperty("id_field") String idField,
            @JsonProperty("id_field_snake") String idFieldSnake,
            @JsonProperty("fields") Map<String, FieldInfo> fields,
            @JsonProperty("calc_order") List<String> calcOrder,
            @JsonProperty("dep_edges") List<List<String>> depEdges,
            @JsonProperty("expr_templates") Map<String, ExpressionTemplate> exprTemplates
    ) {
    }

    public record FieldInfo(
            @JsonProperty("datatype") String datatype,
            @JsonProperty("nullable") boolean nullable,
            @JsonProperty("type") String type
    ) {
    }

    /**
     * Provenance graph of one formula. A template that failed to build has
     * {@code template_hash} {@value #ERROR_HASH}, an error message and no nodes.
     */
    @JsonPropertyOrder({"formula_source", "template_hash", "error", "root_node", "nodes", "edges"})
    public record ExpressionTemplate(
            @JsonProperty("formula_source") String formulaSource,
            @JsonProperty("template_hash") String templateHash,
            @JsonProperty("error") @JsonInclude(JsonInclude.Include.NON_NULL) String error,
            @JsonProperty("root_node") String rootNode,
            @JsonProperty("nodes") Map<String, NodeDescriptor> nodes,
            @JsonProperty("edges") List<List<String>> edges
    ) {
        public static final String ERROR_HASH = "error";
    }
}
