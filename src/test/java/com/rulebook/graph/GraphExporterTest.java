package com.rulebook.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulebook.formula.Formulas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GraphExporter and TemplateHasher.
 */
class GraphExporterTest {

    private GraphExporter exporter;

    @BeforeEach
    void setUp() {
        exporter = new GraphExporter();
    }

    private ProvenanceGraph export(String formula, String field) {
        return exporter.export(Formulas.parse(formula), field, formula);
    }

    @Test
    @DisplayName("Should number nodes in post-order with kind prefixes")
    void shouldNumberNodes() {
        ProvenanceGraph graph = export("={{A}} - {{B}}", "Diff");

        assertEquals(List.of("n_ref_1", "n_ref_2", "n_op_3", "n_result_Diff"), List.copyOf(graph.nodes().keySet()));
        assertEquals("n_result_Diff", graph.rootNode());
        assertEquals("n_op_3", graph.expressionRoot());
        assertEquals(3, graph.arena().size());

        NodeDescriptor op = graph.node("n_op_3");
        assertEquals(NodeKind.OP, op.kind());
        assertEquals("-", op.name());
        assertEquals(List.of("n_ref_1", "n_ref_2"), op.args());

        NodeDescriptor result = graph.node("n_result_Diff");
        assertEquals("diff", result.fieldSnake());
        assertEquals(List.of("n_op_3"), result.in());

        assertEquals(List.of(
                List.of("n_ref_1", "n_op_3"),
                List.of("n_ref_2", "n_op_3"),
                List.of("n_op_3", "n_result_Diff")), graph.edges());
    }

    @Test
    @DisplayName("Should describe every node kind")
    void shouldDescribeNodeKinds() {
        ProvenanceGraph graph = export("=IF(NOT {{HasSyntax}}, 'no' & {{Name}}, 7)", "Answer");

        assertEquals(NodeDescriptor.fieldRef("HasSyntax"), graph.node("n_ref_1"));
        assertEquals(NodeDescriptor.function("NOT", List.of("n_ref_1")), graph.node("n_fn_2"));
        assertEquals(NodeDescriptor.constant("no", "string"), graph.node("n_const_3"));
        assertEquals(NodeDescriptor.operator("CONCAT", List.of("n_const_3", "n_ref_4")), graph.node("n_op_5"));
        assertEquals(NodeDescriptor.constant(7L, "integer"), graph.node("n_const_6"));
        assertEquals(NodeDescriptor.function("IF", List.of("n_fn_2", "n_op_5", "n_const_6")), graph.node("n_fn_7"));
        assertEquals("has_syntax", graph.node("n_ref_1").fieldSnake());
    }

    @Test
    @DisplayName("Should produce the same hash on repeated export")
    void shouldHashStably() {
        String formula = "=IF({{DistanceFromConcept}} = 1, \"IsMirrorOf\", \"IsDescriptionOf\")";

        assertEquals(export(formula, "Relationship").templateHash(), export(formula, "Relationship").templateHash());
    }

    @Test
    @DisplayName("Should match the canonical sorted-key JSON hash")
    void shouldMatchCanonicalHash() {
        ProvenanceGraph graph = export("={{A}} - {{B}}", "Diff");

        assertEquals("sha256:e50fb07d7732f9b0", graph.templateHash());
    }

    @Test
    @DisplayName("Should change the hash when operands swap")
    void shouldChangeHashOnStructureChange() {
        assertNotEquals(export("{{A}} - {{B}}", "Diff").templateHash(), export("{{B}} - {{A}}", "Diff").templateHash());

        ProvenanceGraph left = export("{{A}} - {{B}}", "Diff");
        ProvenanceGraph right = export("{{B}} - {{A}}", "Diff");
        String sameFormula = "same";
        assertNotEquals(TemplateHasher.templateHash(left.nodes(), left.edges(), sameFormula),
                TemplateHasher.templateHash(right.nodes(), right.edges(), sameFormula));
    }

    @Test
    @DisplayName("Should ignore node and edge order when hashing")
    void shouldIgnoreOrderWhenHashing() {
        ProvenanceGraph graph = export("{{A}} & {{B}} & 'c'", "Joined");

        Map<String, NodeDescriptor> reversed = new LinkedHashMap<>();
        List<String> ids = List.copyOf(graph.nodes().keySet());
        for (int i = ids.size() - 1; i >= 0; i--) {
            reversed.put(ids.get(i), graph.nodes().get(ids.get(i)));
        }
        List<List<String>> edges = new ArrayList<>(graph.edges());
        Collections.reverse(edges);

        assertEquals(graph.templateHash(), TemplateHasher.templateHash(reversed, edges, graph.formula()));
    }

    @Test
    @DisplayName("Should escape non-ASCII text like sorted-key JSON")
    void shouldEscapeNonAscii() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("z", null);
        a.put("y", "é");
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("Name", "X");
        document.put("b", List.of(1, 2));
        document.put("a", a);

        assertEquals("{\"Name\": \"X\", \"a\": {\"y\": \"\\u00e9\", \"z\": null}, \"b\": [1, 2]}",
                TemplateHasher.canonicalJson(document));
        assertEquals("sha256:e46c95c1ea8c5c3da85916292ca5628f", TemplateHasher.documentHash(document));
    }

    @Test
    @DisplayName("Should serialize the graph with snake_case keys")
    void shouldSerializeGraph() throws Exception {
        ProvenanceGraph graph = export("TRUE()", "Flag");

        JsonNode json = new ObjectMapper().readTree(new ObjectMapper().writeValueAsString(graph));

        assertEquals(ProvenanceGraph.SCHEMA_VERSION, json.get("schema_version").asText());
        assertEquals("n_result_Flag", json.get("root_node").asText());
        assertEquals(graph.templateHash(), json.get("template_hash").asText());
        JsonNode constant = json.get("nodes").get("n_const_1");
        assertEquals("const", constant.get("kind").asText());
        assertTrue(constant.get("value").asBoolean());
        assertEquals("boolean", constant.get("type").asText());
        assertFalse(constant.has("args"));
        assertEquals("flag", json.get("nodes").get("n_result_Flag").get("field_snake").asText());
        assertFalse(json.has("arena"));
    }
}
