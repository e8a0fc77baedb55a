package com.rulebook.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a provenance graph node, with the id prefix its nodes get.
 */
public enum NodeKind {
    CONST("const", "const"),
    FIELD_REF("field_ref", "ref"),
    OP("op", "op"),
    FN("fn", "fn"),
    RESULT("result", "result");

    private final String label;
    private final String idPrefix;

    NodeKind(String label, String idPrefix) {
        this.label = label;
        this.idPrefix = idPrefix;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String idPrefix() {
        return idPrefix;
    }
}
