package com.rulebook.evaluation;

import com.rulebook.exception.EvaluationException;
import com.rulebook.formula.Formulas;
import com.rulebook.formula.ast.FuncCall;
import com.rulebook.formula.ast.LiteralInt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReferenceEvaluator.
 */
class ReferenceEvaluatorTest {

    private ReferenceEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new ReferenceEvaluator();
    }

    private Value eval(String formula, Object... keyValues) {
        Map<String, Object> values = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return evaluator.evaluate(Formulas.parse(formula), FieldRecord.of(values));
    }

    // =====================================================================
    // Scenarios
    // =====================================================================

    @Test
    @DisplayName("Should compare a boolean field against TRUE() by identity")
    void shouldCompareBooleanIdentity() {
        assertEquals(Value.TRUE, eval("{{HasSyntax}} = TRUE()", "HasSyntax", true));
        assertEquals(Value.FALSE, eval("{{HasSyntax}} = TRUE()", "HasSyntax", null));
        assertEquals(Value.FALSE, eval("{{HasSyntax}} = TRUE()", "HasSyntax", false));
    }

    @Test
    @DisplayName("Should concatenate with null as empty string")
    void shouldConcatenateWithNull() {
        String formula = "\"Is \" & {{Name}} & \" a language?\"";

        assertEquals(Value.of("Is Lojban a language?"), eval(formula, "Name", "Lojban"));
        assertEquals(Value.of("Is  a language?"), eval(formula, "Name", null));
    }

    @Test
    @DisplayName("Should choose the IF branch by the condition")
    void shouldEvaluateIf() {
        String formula = "IF({{Distance}} = 1, \"IsMirrorOf\", \"IsDescriptionOf\")";

        assertEquals(Value.of("IsMirrorOf"), eval(formula, "Distance", 1));
        assertEquals(Value.of("IsDescriptionOf"), eval(formula, "Distance", 2));
        assertEquals(Value.of("IsDescriptionOf"), eval(formula, "Distance", null));
    }

    @Test
    @DisplayName("Should treat NOT of null as true")
    void shouldNegateNullToTrue() {
        assertEquals(Value.TRUE, eval("AND({{X}}, NOT({{Y}}))", "X", true, "Y", null));
        assertEquals(Value.FALSE, eval("AND({{X}}, NOT({{Y}}))", "X", true, "Y", true));
        assertEquals(Value.TRUE, eval("NOT {{Y}}", "Y", null));
    }

    // =====================================================================
    // Null laws
    // =====================================================================

    @Test
    @DisplayName("Should not let null satisfy a positive predicate")
    void shouldApplyNullLaws() {
        assertEquals(Value.of("x"), eval("{{N}} & 'x'", "N", null));
        assertEquals(Value.of("b"), eval("IF({{N}}, 'a', 'b')", "N", null));
        assertNotEquals(Value.TRUE, eval("AND(TRUE(), {{N}})", "N", null));
        assertEquals(Value.FALSE, eval("OR({{N}}, FALSE)", "N", null));
    }

    @Test
    @DisplayName("Should not treat non-boolean values as true")
    void shouldNotCoerceTruthiness() {
        assertEquals(Value.of("b"), eval("IF({{N}}, 'a', 'b')", "N", 1));
        assertEquals(Value.of("b"), eval("IF({{N}}, 'a', 'b')", "N", "yes"));
        assertEquals(Value.FALSE, eval("{{N}} AND TRUE", "N", 1));
    }

    @ParameterizedTest
    @CsvSource({
            "{{A}} = {{B}},  true",
            "{{A}} <> {{B}}, false",
            "{{A}} < 1,      false",
            "{{A}} <= 1,     false",
            "{{A}} > 1,      false",
            "{{A}} >= 1,     false",
            "1 > {{A}},      false",
            "{{A}} = 0,      false"
    })
    @DisplayName("Should compare null operands without raising")
    void shouldCompareNulls(String formula, boolean expected) {
        assertEquals(Value.of(expected), eval(formula, "A", null, "B", null));
    }

    @ParameterizedTest
    @CsvSource({
            "{{A}} + {{B}},  7",
            "{{A}} - {{B}},  3",
            "{{A}} * {{B}},  10",
            "{{A}} / {{B}},  2",
            "{{A}} / 0,      5",
            "{{A}} / {{N}},  5",
            "{{A}} + {{N}},  5",
            "{{N}} * {{B}},  0",
            "-{{A}},         -5",
            "-7 / 2,         -3"
    })
    @DisplayName("Should apply integer arithmetic with null substitution")
    void shouldApplyArithmetic(String formula, long expected) {
        assertEquals(Value.of(expected), eval(formula, "A", 5, "B", 2, "N", null));
    }

    @Test
    @DisplayName("Should render canonical text when concatenating")
    void shouldConcatenateCanonicalText() {
        assertEquals(Value.of("true-42-"), eval("{{B}} & '-' & {{I}} & '-' & {{N}}", "B", true, "I", 42, "N", null));
        assertEquals(Value.of("ab"), eval("CONCATENATE('a', {{N}}, 'b')", "N", null));
    }

    @Test
    @DisplayName("Should negate a field before concatenating it")
    void shouldNegateBeforeConcatenating() {
        assertEquals(Value.of("-5x"), eval("-{{A}} & 'x'", "A", 5));
        assertEquals(Value.of("-5x"), eval("-5 & 'x'"));
    }

    @Test
    @DisplayName("Should order strings and integers")
    void shouldOrderValues() {
        assertEquals(Value.TRUE, eval("{{A}} < {{B}}", "A", "apple", "B", "banana"));
        assertEquals(Value.TRUE, eval("{{A}} >= {{B}}", "A", 3, "B", 3));
    }

    @Test
    @DisplayName("Should use strict equality across types")
    void shouldUseStrictEquality() {
        assertEquals(Value.FALSE, eval("{{A}} = '1'", "A", 1));
        assertEquals(Value.FALSE, eval("{{A}} = ''", "A", null));
        assertEquals(Value.TRUE, eval("{{A}} <> 'x'", "A", null));
    }

    // =====================================================================
    // Functions
    // =====================================================================

    @Test
    @DisplayName("Should evaluate string functions")
    void shouldEvaluateStringFunctions() {
        assertEquals(Value.of("lojban"), eval("LOWER({{A}})", "A", "LoJban"));
        assertEquals(Value.of("LOJBAN"), eval("UPPER({{A}})", "A", "LoJban"));
        assertEquals(Value.of("x y"), eval("TRIM({{A}})", "A", "  x y "));
        assertEquals(Value.of(6), eval("LEN({{A}})", "A", "Lojban"));
        assertEquals(Value.of(0), eval("LEN({{A}})", "A", null));
    }

    @Test
    @DisplayName("Should change case independently of the default locale")
    void shouldIgnoreDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(Value.of("TITLE"), eval("UPPER({{A}})", "A", "title"));
            assertEquals(Value.of("title"), eval("LOWER({{A}})", "A", "TITLE"));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    @DisplayName("Should find substrings with 1-based positions")
    void shouldFind() {
        assertEquals(Value.of(3), eval("FIND('jb', {{A}})", "A", "lojban"));
        assertEquals(Value.of(0), eval("FIND('z', {{A}})", "A", "lojban"));
        assertEquals(Value.of(2), eval("FIND('a', {{A}}, 2)", "A", "banana"));
        assertEquals(Value.of(4), eval("FIND('a', {{A}}, 3)", "A", "banana"));
        assertEquals(Value.of(1), eval("FIND('', {{A}})", "A", "x"));
        assertEquals(Value.of(0), eval("FIND('a', {{A}})", "A", null));
        assertEquals(Value.of(0), eval("FIND('a', {{A}}, 99)", "A", "banana"));
    }

    @Test
    @DisplayName("Should detect blanks")
    void shouldDetectBlank() {
        assertEquals(Value.TRUE, eval("ISBLANK({{A}})", "A", null));
        assertEquals(Value.TRUE, eval("ISBLANK({{A}})", "A", ""));
        assertEquals(Value.FALSE, eval("ISBLANK({{A}})", "A", " "));
    }

    @Test
    @DisplayName("Should evaluate empty AND and OR")
    void shouldEvaluateEmptyLogicalCalls() {
        assertEquals(Value.TRUE, eval("AND()"));
        assertEquals(Value.FALSE, eval("OR()"));
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @Test
    @DisplayName("Should fail on ordering a string against an integer")
    void shouldFailOnTypeMismatch() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> eval("{{A}} < 1", "A", "x"));
        assertEquals(EvaluationException.Reason.TYPE_MISMATCH, e.getReason());
    }

    @Test
    @DisplayName("Should fail on arithmetic over a boolean")
    void shouldFailOnBooleanArithmetic() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> eval("{{A}} + 1", "A", true));
        assertEquals(EvaluationException.Reason.TYPE_MISMATCH, e.getReason());
    }

    @Test
    @DisplayName("Should fail on an unknown function")
    void shouldFailOnUnknownFunction() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> eval("NOSUCH(1)"));
        assertEquals(EvaluationException.Reason.UNKNOWN_FUNCTION, e.getReason());
    }

    @Test
    @DisplayName("Should fail on a wrong function arity")
    void shouldFailOnArity() {
        EvaluationException e = assertThrows(EvaluationException.class,
                () -> evaluator.evaluate(new FuncCall("LOWER", List.of(new LiteralInt(1), new LiteralInt(2))),
                        FieldRecord.empty()));
        assertEquals(EvaluationException.Reason.ARITY_MISMATCH, e.getReason());
    }

    @Test
    @DisplayName("Should reject fractional input values")
    void shouldRejectFractionalValues() {
        assertThrows(EvaluationException.class, () -> FieldRecord.of(Map.of("A", 1.5)));
    }

    @Test
    @DisplayName("Should return the same value on repeated evaluation")
    void shouldBeDeterministic() {
        String formula = "IF({{A}} > 2, UPPER({{B}}) & {{A}}, 'small')";
        Value first = eval(formula, "A", 3, "B", "x");

        for (int i = 0; i < 10; i++) {
            assertEquals(first, eval(formula, "A", 3, "B", "x"));
        }
        assertEquals(Value.of("X3"), first);
    }
}
