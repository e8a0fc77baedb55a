package com.rulebook.compiler;

import com.rulebook.core.CompileError;
import com.rulebook.core.CompileStage;
import com.rulebook.dependency.DependencyCycle;
import com.rulebook.evaluation.EvaluatedRecord;
import com.rulebook.evaluation.FieldRecord;
import com.rulebook.evaluation.Value;
import com.rulebook.schema.Rulebook;
import com.rulebook.schema.RulebookLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RulebookCompiler.
 */
class RulebookCompilerTest {

    private static Rulebook rulebook;
    private static RulebookCompiler compiler;
    private static CompilationResult result;

    @BeforeAll
    static void compile() {
        rulebook = RulebookLoader.load("classpath:rulebooks/language-candidates.json");
        compiler = new RulebookCompiler(CompilerSettings.defaults().withParallelism(3));
        result = compiler.compile(rulebook);
    }

    // ==================== Compilation ====================

    @Test
    @DisplayName("Should compile every entity in document order")
    void shouldCompileEveryEntity() {
        assertEquals(List.of("LanguageCandidates", "Loops", "Lookups"), List.copyOf(result.entities().keySet()));
        assertEquals("com.rulebook.generated.LanguageCandidatesCalculations",
                result.entity("LanguageCandidates").orElseThrow().className());
        assertTrue(result.entity("Lookups").orElseThrow().fields().isEmpty());
    }

    @Test
    @DisplayName("Should order calculated fields by level")
    void shouldOrderByLevel() {
        CompiledEntity candidates = result.entity("LanguageCandidates").orElseThrow();

        assertEquals(List.of("HasGrammar", "MentionsLanguage", "Question", "RelationshipToConcept",
                "TopFamilyFeudAnswer", "FamilyFeudMismatch"), candidates.levels().calcOrder());
        assertEquals(2, candidates.field("TopFamilyFeudAnswer").orElseThrow().level());
        assertEquals(3, candidates.field("FamilyFeudMismatch").orElseThrow().level());
        assertEquals(List.of("ChosenLanguageCandidate", "Name", "TopFamilyFeudAnswer"),
                candidates.field("FamilyFeudMismatch").orElseThrow().dependencies());
    }

    @Test
    @DisplayName("Should report a parse failure without stopping other fields")
    void shouldReportParseFailure() {
        List<CompileError> errors = result.errors();

        assertEquals(1, errors.size());
        assertEquals("Broken", errors.get(0).field());
        assertEquals(CompileStage.PARSE, errors.get(0).stage());
        assertFalse(result.isSuccess());

        CompiledEntity loops = result.entity("Loops").orElseThrow();
        assertTrue(loops.field("Start").orElseThrow().isSuccess());
        assertTrue(loops.source().contains("public static Object calcStart(Object seed)"));
        assertTrue(loops.source().contains("throw new UnsupportedOperationException"));
    }

    @Test
    @DisplayName("Should place circular fields in a final level and report the cycle")
    void shouldReportCycle() {
        List<DependencyCycle> cycles = result.cycles();

        assertEquals(1, cycles.size());
        assertEquals(new DependencyCycle("Loops", List.of("A", "B")), cycles.get(0));

        CompiledEntity loops = result.entity("Loops").orElseThrow();
        assertEquals(List.of("Broken", "Start", "A", "B"), loops.levels().calcOrder());
        assertTrue(loops.field("A").orElseThrow().function().isSuccess());
    }

    @Test
    @DisplayName("Should generate the same sources regardless of parallelism")
    void shouldBeDeterministic() {
        CompilationResult sequential = new RulebookCompiler(CompilerSettings.defaults().withParallelism(1))
                .compile(rulebook);

        for (String entity : rulebook.entityNames()) {
            CompiledEntity expected = sequential.entity(entity).orElseThrow();
            CompiledEntity actual = result.entity(entity).orElseThrow();
            assertEquals(expected.source(), actual.source(), entity);
            assertEquals(expected.levels().calcOrder(), actual.levels().calcOrder(), entity);
        }
    }

    @Test
    @DisplayName("Should generate into the configured package")
    void shouldUseConfiguredPackage() {
        RulebookCompiler custom = new RulebookCompiler(new CompilerSettings(1, "org.example.calc", true));
        CompiledEntity loops = custom.compile(rulebook).entity("Loops").orElseThrow();

        assertEquals("org.example.calc.LoopsCalculations", loops.className());
        assertTrue(loops.source().startsWith("package org.example.calc;"));
    }

    // ==================== Evaluation ====================

    @Test
    @DisplayName("Should evaluate a language candidate")
    void shouldEvaluateCandidate() {
        EvaluatedRecord evaluated = compiler.evaluate(result.entity("LanguageCandidates").orElseThrow(),
                candidate("Lojban", true, true, 1L, false));

        assertEquals(Value.of(true), evaluated.get("HasGrammar"));
        assertEquals(Value.of(true), evaluated.get("TopFamilyFeudAnswer"));
        assertEquals(Value.of("Lojban is a language but was not chosen"), evaluated.get("FamilyFeudMismatch"));
        assertEquals(Value.of("Is Lojban a language?"), evaluated.get("Question"));
        assertEquals(Value.of("IsMirrorOf"), evaluated.get("RelationshipToConcept"));
        assertEquals(Value.of(false), evaluated.get("MentionsLanguage"));
        assertTrue(evaluated.failures().isEmpty());
    }

    @Test
    @DisplayName("Should turn blank string results into null")
    void shouldNullBlankStrings() {
        EvaluatedRecord evaluated = compiler.evaluate(result.entity("LanguageCandidates").orElseThrow(),
                candidate("Klingon language", true, true, 2L, true));

        assertEquals(Value.NULL, evaluated.get("FamilyFeudMismatch"));
        assertEquals(Value.of("IsDescriptionOf"), evaluated.get("RelationshipToConcept"));
        assertEquals(Value.of(true), evaluated.get("MentionsLanguage"));
    }

    @Test
    @DisplayName("Should read missing raw values as null")
    void shouldHandleMissingValues() {
        EvaluatedRecord evaluated = compiler.evaluate(result.entity("LanguageCandidates").orElseThrow(),
                FieldRecord.empty());

        assertEquals(Value.of(false), evaluated.get("HasGrammar"));
        assertEquals(Value.of(false), evaluated.get("TopFamilyFeudAnswer"));
        assertEquals(Value.NULL, evaluated.get("FamilyFeudMismatch"));
        assertEquals(Value.of("Is  a language?"), evaluated.get("Question"));
        assertEquals(Value.of("IsDescriptionOf"), evaluated.get("RelationshipToConcept"));
    }

    @Test
    @DisplayName("Should evaluate circular fields in order and null out failed fields")
    void shouldEvaluateLoops() {
        EvaluatedRecord evaluated = compiler.evaluate(result.entity("Loops").orElseThrow(),
                FieldRecord.of(Map.of("Seed", 5L)));

        assertEquals(Value.of(6L), evaluated.get("Start"));
        assertEquals(Value.of(6L), evaluated.get("A"));
        assertEquals(Value.of(5L), evaluated.get("B"));
        assertEquals(Value.NULL, evaluated.get("Broken"));
        assertEquals(1, evaluated.failures().size());
        assertEquals("Broken", evaluated.failures().get(0).field());
    }

    private static FieldRecord candidate(String name, Boolean hasSyntax, Boolean isParsed,
                                         Long distance, Boolean chosen) {
        Map<String, Object> values = new HashMap<>();
        values.put("Name", name);
        values.put("HasSyntax", hasSyntax);
        values.put("IsParsed", isParsed);
        values.put("DistanceFromConcept", distance);
        values.put("ChosenLanguageCandidate", chosen);
        return FieldRecord.of(values);
    }
}
