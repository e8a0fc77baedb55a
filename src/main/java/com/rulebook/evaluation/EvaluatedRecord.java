package com.rulebook.evaluation;

import com.rulebook.core.CompileError;
import com.rulebook.core.FieldResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of evaluating every calculated field of one record.
 *
 * @param record  Input values plus every calculated value; failed fields are Null
 * @param results Per calculated field outcome, in evaluation order
 */
public record EvaluatedRecord(FieldRecord record, Map<String, FieldResult<Value>> results) {

    public EvaluatedRecord {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public Value get(String field) {
        return record.get(field);
    }

    public List<CompileError> failures() {
        return results.values().stream()
                .flatMap(r -> r.getError().stream())
                .toList();
    }
}
