package com.rulebook.formula;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Functions every backend must support, with their accepted arities.
 */
public enum BuiltinFunction {
    AND(0, Integer.MAX_VALUE),
    OR(0, Integer.MAX_VALUE),
    NOT(1, 1),
    IF(3, 3),
    CONCATENATE(0, Integer.MAX_VALUE),
    LOWER(1, 1),
    UPPER(1, 1),
    TRIM(1, 1),
    LEN(1, 1),
    FIND(2, 3),
    ISBLANK(1, 1);

    private static final Map<String, BuiltinFunction> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Enum::name, Function.identity()));

    private final int minArity;
    private final int maxArity;

    BuiltinFunction(int minArity, int maxArity) {
        this.minArity = minArity;
        this.maxArity = maxArity;
    }

    /**
     * Look up a function by its (upper-case) name.
     */
    public static Optional<BuiltinFunction> lookup(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public boolean accepts(int arity) {
        return arity >= minArity && arity <= maxArity;
    }

    /**
     * Human-readable arity, e.g. "1", "2..3" or "any".
     */
    public String arityDescription() {
        if (maxArity == Integer.MAX_VALUE) {
            return "any";
        }
        return minArity == maxArity ? String.valueOf(minArity) : minArity + ".." + maxArity;
    }
}
