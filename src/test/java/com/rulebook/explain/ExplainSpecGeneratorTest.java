package com.rulebook.explain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulebook.compiler.CompilationResult;
import com.rulebook.compiler.RulebookCompiler;
import com.rulebook.graph.NodeDescriptor;
import com.rulebook.graph.NodeKind;
import com.rulebook.schema.RulebookLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExplainSpecGenerator.
 */
class ExplainSpecGeneratorTest {

    private static final ExplainSpecGenerator generator = new ExplainSpecGenerator();

    private static ExplainSpec spec;

    @BeforeAll
    static void generate() {
        CompilationResult result = new RulebookCompiler()
                .compile(RulebookLoader.load("classpath:rulebooks/language-candidates.json"));
        spec = generator.generate(result);
    }

    @Test
    @DisplayName("Should describe the rulebook and its semantics")
    void shouldDescribeRulebook() {
        assertEquals(ExplainSpec.SCHEMA_VERSION, spec.schemaVersion());
        assertEquals("Language Candidates", spec.rulebook().name());
        assertTrue(spec.rulebook().rulebookHash().matches("sha256:[0-9a-f]{32}"));
        assertEquals(ExplainSpec.Semantics.DEFAULT, spec.semantics());
    }

    @Test
    @DisplayName("Should skip entities without calculated fields")
    void shouldSkipRawOnlyEntities() {
        assertEquals(List.of("LanguageCandidates", "Loops"), List.copyOf(spec.entities().keySet()));
    }

    @Test
    @DisplayName("Should describe fields and evaluation order")
    void shouldDescribeEntity() {
        ExplainSpec.EntityExplanation entity = spec.entities().get("LanguageCandidates");

        assertEquals("Name", entity.idField());
        assertEquals("name", entity.idFieldSnake());
        assertEquals(11, entity.fields().size());
        assertEquals(new ExplainSpec.FieldInfo("string", false, "raw"), entity.fields().get("Name"));
        assertEquals(new ExplainSpec.FieldInfo("boolean", true, "calculated"), entity.fields().get("HasGrammar"));
        assertEquals("FamilyFeudMismatch", entity.calcOrder().get(entity.calcOrder().size() - 1));
        assertTrue(entity.depEdges().contains(List.of("HasGrammar", "TopFamilyFeudAnswer")));
        assertEquals(6, entity.exprTemplates().size());
    }

    @Test
    @DisplayName("Should attach a provenance template per calculated field")
    void shouldAttachTemplates() {
        ExplainSpec.ExpressionTemplate template = spec.entities().get("LanguageCandidates")
                .exprTemplates().get("HasGrammar");

        assertEquals("={{HasSyntax}} = TRUE()", template.formulaSource());
        assertTrue(template.templateHash().matches("sha256:[0-9a-f]{16}"));
        assertNull(template.error());
        assertEquals("n_result_HasGrammar", template.rootNode());

        NodeDescriptor result = template.nodes().get("n_result_HasGrammar");
        assertEquals(NodeKind.RESULT, result.kind());
        assertEquals("has_grammar", result.fieldSnake());
        assertTrue(template.edges().contains(List.of("n_ref_1", "n_op_3")));
    }

    @Test
    @DisplayName("Should give different formula structures different template hashes")
    void shouldHashByStructure() {
        ExplainSpec.EntityExplanation entity = spec.entities().get("LanguageCandidates");
        String question = entity.exprTemplates().get("Question").templateHash();
        String relationship = entity.exprTemplates().get("RelationshipToConcept").templateHash();

        assertNotEquals(question, relationship);
    }

    @Test
    @DisplayName("Should emit an error template for a formula that does not parse")
    void shouldEmitErrorTemplate() {
        ExplainSpec.ExpressionTemplate broken = spec.entities().get("Loops").exprTemplates().get("Broken");

        assertEquals(ExplainSpec.ExpressionTemplate.ERROR_HASH, broken.templateHash());
        assertNotNull(broken.error());
        assertNull(broken.rootNode());
        assertTrue(broken.nodes().isEmpty());
        assertTrue(broken.edges().isEmpty());

        assertEquals("Seed", spec.entities().get("Loops").idField());
        assertEquals(List.of("Broken", "Start", "A", "B"), spec.entities().get("Loops").calcOrder());
    }

    @Test
    @DisplayName("Should serialize with snake_case keys")
    void shouldSerializeJson(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("explain.json");
        generator.write(spec, file);

        JsonNode root = new ObjectMapper().readTree(Files.readString(file));
        assertEquals("erb.explain_spec.v1", root.get("schema_version").asText());
        assertEquals("three_valued_logic", root.at("/semantics/null_handling").asText());

        JsonNode candidates = root.at("/entities/LanguageCandidates");
        assertEquals("name", candidates.get("id_field_snake").asText());
        assertTrue(candidates.get("calc_order").isArray());
        assertEquals("field_ref", candidates.at("/expr_templates/HasGrammar/nodes/n_ref_1/kind").asText());
        assertEquals("HasSyntax", candidates.at("/expr_templates/HasGrammar/nodes/n_ref_1/field").asText());
        assertFalse(candidates.at("/expr_templates/HasGrammar").has("error"));
        assertEquals("error", root.at("/entities/Loops/expr_templates/Broken/template_hash").asText());
    }
}
