package com.rulebook.evaluation;

import com.rulebook.core.CompileError;
import com.rulebook.core.CompileStage;
import com.rulebook.core.FieldResult;
import com.rulebook.dependency.LevelAssignment;
import com.rulebook.formula.ast.FormulaNode;
import com.rulebook.schema.DataType;
import com.rulebook.schema.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates all calculated fields of a record, level by level.
 * <p>
 * A field that fails to parse or evaluate reads as Null for the fields after it.
 * Once all levels are done, string fields that computed to the empty string
 * become Null when {@code blankStringsAsNull} is set.
 */
public class RecordEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RecordEvaluator.class);

    private final ReferenceEvaluator evaluator;
    private final boolean blankStringsAsNull;

    public RecordEvaluator(ReferenceEvaluator evaluator, boolean blankStringsAsNull) {
        this.evaluator = evaluator;
        this.blankStringsAsNull = blankStringsAsNull;
    }

    /**
     * @param levels  Evaluation order
     * @param formulas Parse outcome per calculated field
     * @param input   Raw field values; never modified
     */
    public EvaluatedRecord evaluate(LevelAssignment levels,
                                    Map<String, FieldResult<FormulaNode>> formulas,
                                    FieldRecord input) {
        FieldRecord current = input;
        Map<String, FieldResult<Value>> results = new LinkedHashMap<>();

        for (List<Field> level : levels.levels()) {
            for (Field field : level) {
                FieldResult<FormulaNode> formula = formulas.get(field.name());
                if (formula == null) {
                    formula = FieldResult.failure(new CompileError(field.name(), CompileStage.PARSE,
                            "Formula was not compiled"));
                }
                FieldRecord snapshot = current;
                FieldResult<Value> result = formula.then(node -> evaluator.evaluate(node, snapshot));
                result.getError().ifPresent(error -> log.debug("Field evaluation failed: {}", error));

                results.put(field.name(), result);
                current = current.with(field.name(), result.getValue().orElse(Value.NULL));
            }
        }

        if (blankStringsAsNull) {
            for (List<Field> level : levels.levels()) {
                for (Field field : level) {
                    if (field.datatype() == DataType.STRING && current.get(field.name()).equals(Value.of(""))) {
                        current = current.with(field.name(), Value.NULL);
                    }
                }
            }
        }

        return new EvaluatedRecord(current, results);
    }
}
