package com.rulebook.runtime;

import com.rulebook.exception.EvaluationException;

import java.util.Locale;
import java.util.Objects;

/**
 * Helpers called by generated calculation classes.
 * <p>
 * Values are plain Java objects: {@link Boolean}, {@link Long}, {@link String} or {@code null}.
 * Every helper follows the same rules as the reference evaluator.
 */
public final class FormulaRuntime {

    private FormulaRuntime() {
    }

    /**
     * Only {@code Boolean.TRUE} is true.
     */
    public static boolean isTrue(Object value) {
        return Boolean.TRUE.equals(value);
    }

    public static Boolean not(Object value) {
        return !isTrue(value);
    }

    public static Boolean eq(Object left, Object right) {
        return Objects.equals(normalize(left), normalize(right));
    }

    public static Boolean ne(Object left, Object right) {
        return !eq(left, right);
    }

    public static Boolean lt(Object left, Object right) {
        return left != null && right != null && compare(left, right, "<") < 0;
    }

    public static Boolean lte(Object left, Object right) {
        return left != null && right != null && compare(left, right, "<=") <= 0;
    }

    public static Boolean gt(Object left, Object right) {
        return left != null && right != null && compare(left, right, ">") > 0;
    }

    public static Boolean gte(Object left, Object right) {
        return left != null && right != null && compare(left, right, ">=") >= 0;
    }

    public static Long add(Object left, Object right) {
        return toLong(left, "+") + toLong(right, "+");
    }

    public static Long subtract(Object left, Object right) {
        return toLong(left, "-") - toLong(right, "-");
    }

    public static Long multiply(Object left, Object right) {
        return toLong(left, "*") * toLong(right, "*");
    }

    /**
     * Integer division; a null or zero divisor is read as 1.
     */
    public static Long divide(Object left, Object right) {
        long divisor = toLong(right, "/");
        return toLong(left, "/") / (divisor == 0 ? 1 : divisor);
    }

    public static Long negate(Object value) {
        return -toLong(value, "-");
    }

    public static String concat(Object... parts) {
        StringBuilder sb = new StringBuilder();
        for (Object part : parts) {
            sb.append(text(part));
        }
        return sb.toString();
    }

    /**
     * Canonical text: {@code true}/{@code false}, decimal integers, empty for null.
     */
    public static String text(Object value) {
        Object normalized = normalize(value);
        return normalized == null ? "" : normalized.toString();
    }

    public static String lower(Object value) {
        return text(value).toLowerCase(Locale.ROOT);
    }

    public static String upper(Object value) {
        return text(value).toUpperCase(Locale.ROOT);
    }

    public static String trim(Object value) {
        return text(value).trim();
    }

    public static Long len(Object value) {
        return (long) text(value).length();
    }

    public static Long find(Object needle, Object haystack) {
        return find(needle, haystack, null);
    }

    /**
     * 1-based position of {@code needle} in {@code haystack} from {@code start}, or 0.
     */
    public static Long find(Object needle, Object haystack, Object start) {
        String text = text(haystack);
        long from = start == null ? 1 : toLong(start, "FIND");
        int index = (int) Math.max(0, Math.min(from - 1, text.length()));
        return (long) (text.indexOf(text(needle), index) + 1);
    }

    public static Boolean isBlank(Object value) {
        return value == null || "".equals(value);
    }

    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value == null || value instanceof Long || value instanceof Boolean || value instanceof String) {
            return value;
        }
        throw EvaluationException.typeMismatch("Unsupported value type " + value.getClass().getSimpleName()
                + ": " + value);
    }

    private static long toLong(Object value, String operator) {
        Object normalized = normalize(value);
        if (normalized == null) {
            return 0;
        }
        if (normalized instanceof Long l) {
            return l;
        }
        throw EvaluationException.typeMismatch(operator + " requires integers, got " + describe(normalized));
    }

    private static int compare(Object left, Object right, String operator) {
        Object l = normalize(left);
        Object r = normalize(right);
        if (l instanceof Long a && r instanceof Long b) {
            return Long.compare(a, b);
        }
        if (l instanceof String a && r instanceof String b) {
            return a.compareTo(b);
        }
        throw EvaluationException.typeMismatch("Cannot compare " + describe(l) + " " + operator + " " + describe(r));
    }

    private static String describe(Object value) {
        return value.getClass().getSimpleName().toLowerCase(Locale.ROOT) + " " + value;
    }
}
