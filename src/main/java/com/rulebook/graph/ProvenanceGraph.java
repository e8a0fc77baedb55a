package com.rulebook.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How one calculated field is derived from its inputs.
 * <p>
 * Expression nodes live in {@link #arena()} in post-order; the node at index {@code i}
 * has id {@code n_<prefix>_<i + 1>}. The result node {@code n_result_<Field>} wraps the root.
 *
 * @param field        Calculated field
 * @param formula      Formula text the graph was built from
 * @param rootNode     Id of the result node
 * @param nodes        Node payloads by id, arena order then the result node
 * @param edges        {@code [source, target]} pairs, operand to consumer
 * @param arena        Expression nodes by position
 * @param templateHash Canonical structure hash
 */
@JsonPropertyOrder({"schema_version", "root_node", "nodes", "edges", "template_hash"})
public record ProvenanceGraph(
        @JsonIgnore String field,
        @JsonIgnore String formula,
        @JsonProperty("root_node") String rootNode,
        @JsonProperty("nodes") Map<String, NodeDescriptor> nodes,
        @JsonProperty("edges") List<List<String>> edges,
        @JsonIgnore List<NodeDescriptor> arena,
        @JsonProperty("template_hash") String templateHash
) {
    public static final String SCHEMA_VERSION = "erb.provenance_graph.v1";

    public ProvenanceGraph {
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        edges = edges.stream().map(List::copyOf).toList();
        arena = List.copyOf(arena);
    }

    @JsonProperty("schema_version")
    public String schemaVersion() {
        return SCHEMA_VERSION;
    }

    public NodeDescriptor node(String id) {
        return nodes.get(id);
    }

    /**
     * The expression root, the node the result node reads.
     */
    @JsonIgnore
    public String expressionRoot() {
        return nodes.get(rootNode).in().get(0);
    }
}
