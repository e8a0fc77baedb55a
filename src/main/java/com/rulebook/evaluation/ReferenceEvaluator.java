package com.rulebook.evaluation;

import com.rulebook.exception.EvaluationException;
import com.rulebook.formula.BuiltinFunction;
import com.rulebook.formula.ast.BinaryOp;
import com.rulebook.formula.ast.Concat;
import com.rulebook.formula.ast.FieldRef;
import com.rulebook.formula.ast.FormulaNode;
import com.rulebook.formula.ast.FormulaVisitor;
import com.rulebook.formula.ast.FuncCall;
import com.rulebook.formula.ast.LiteralBool;
import com.rulebook.formula.ast.LiteralInt;
import com.rulebook.formula.ast.LiteralString;
import com.rulebook.formula.ast.Operator;
import com.rulebook.formula.ast.UnaryOp;

import java.util.List;
import java.util.Locale;

/**
 * Ground-truth evaluator for formula trees.
 * <p>
 * Semantics (every other backend must match):
 * <ul>
 *   <li>Conditions, {@code AND}, {@code OR} and {@code NOT} test identity: only boolean
 *       {@code true} is true, so {@code NOT(Null)} is {@code true}</li>
 *   <li>{@code =} is strict value equality, {@code Null = Null} is {@code true};
 *       {@code <>} is its negation</li>
 *   <li>Ordering with a Null operand is {@code false}</li>
 *   <li>Arithmetic reads Null as 0; a Null or zero divisor is read as 1</li>
 *   <li>Concatenation reads Null as the empty string</li>
 * </ul>
 */
public class ReferenceEvaluator {

    /**
     * Evaluate a formula against a record.
     *
     * @param formula Parsed formula
     * @param record  Field values; never modified
     * @return Computed value
     * @throws EvaluationException on a type mismatch, an unknown function or a wrong arity
     */
    public Value evaluate(FormulaNode formula, FieldRecord record) {
        return formula.accept(new Evaluation(record));
    }

    /**
     * Visitor bound to one record.
     */
    private static final class Evaluation implements FormulaVisitor<Value> {

        private final FieldRecord record;

        Evaluation(FieldRecord record) {
            this.record = record;
        }

        @Override
        public Value visitBool(LiteralBool node) {
            return Value.of(node.value());
        }

        @Override
        public Value visitInt(LiteralInt node) {
            return Value.of(node.value());
        }

        @Override
        public Value visitString(LiteralString node) {
            return Value.of(node.value());
        }

        @Override
        public Value visitFieldRef(FieldRef node) {
            return record.get(node.name());
        }

        @Override
        public Value visitUnary(UnaryOp node) {
            Value operand = node.operand().accept(this);
            if (node.op() == Operator.NOT) {
                return Value.of(!operand.isTrue());
            }
            return Value.of(-toInteger(operand, node.op()));
        }

        @Override
        public Value visitBinary(BinaryOp node) {
            Operator op = node.op();
            if (op == Operator.AND) {
                return Value.of(node.left().accept(this).isTrue() && node.right().accept(this).isTrue());
            }
            if (op == Operator.OR) {
                return Value.of(node.left().accept(this).isTrue() || node.right().accept(this).isTrue());
            }

            Value left = node.left().accept(this);
            Value right = node.right().accept(this);

            return switch (op) {
                case EQ -> Value.of(left.equals(right));
                case NE -> Value.of(!left.equals(right));
                case LT -> Value.of(compare(left, right, op) < 0);
                case LTE -> Value.of(compare(left, right, op) <= 0);
                case GT -> Value.of(compare(left, right, op) > 0);
                case GTE -> Value.of(compare(left, right, op) >= 0);
                case ADD -> Value.of(toInteger(left, op) + toInteger(right, op));
                case SUBTRACT -> Value.of(toInteger(left, op) - toInteger(right, op));
                case MULTIPLY -> Value.of(toInteger(left, op) * toInteger(right, op));
                case DIVIDE -> Value.of(toInteger(left, op) / divisor(right));
                default -> throw new IllegalStateException("Invalid binary operator: " + op);
            };
        }

        @Override
        public Value visitConcat(Concat node) {
            return Value.of(join(node.parts()));
        }

        @Override
        public Value visitFuncCall(FuncCall node) {
            BuiltinFunction function = BuiltinFunction.lookup(node.name())
                    .orElseThrow(() -> new EvaluationException(EvaluationException.Reason.UNKNOWN_FUNCTION,
                            "Unknown function " + node.name()));
            List<FormulaNode> args = node.args();
            if (!function.accepts(args.size())) {
                throw new EvaluationException(EvaluationException.Reason.ARITY_MISMATCH,
                        function + " takes " + function.arityDescription() + " arguments, got " + args.size());
            }

            return switch (function) {
                case AND -> Value.of(args.stream().allMatch(arg -> arg.accept(this).isTrue()));
                case OR -> Value.of(args.stream().anyMatch(arg -> arg.accept(this).isTrue()));
                case NOT -> Value.of(!args.get(0).accept(this).isTrue());
                case IF -> args.get(0).accept(this).isTrue()
                        ? args.get(1).accept(this)
                        : args.get(2).accept(this);
                case CONCATENATE -> Value.of(join(args));
                case LOWER -> Value.of(text(args.get(0)).toLowerCase(Locale.ROOT));
                case UPPER -> Value.of(text(args.get(0)).toUpperCase(Locale.ROOT));
                case TRIM -> Value.of(text(args.get(0)).trim());
                case LEN -> Value.of(text(args.get(0)).length());
                case FIND -> find(args);
                case ISBLANK -> {
                    Value value = args.get(0).accept(this);
                    yield Value.of(value.isNull() || value.equals(Value.of("")));
                }
            };
        }

        private Value find(List<FormulaNode> args) {
            String needle = text(args.get(0));
            String haystack = text(args.get(1));
            long start = 1;
            if (args.size() == 3) {
                Value startValue = args.get(2).accept(this);
                start = startValue.isNull() ? 1 : toInteger(startValue, "FIND");
            }
            int from = (int) Math.max(0, Math.min(start - 1, haystack.length()));
            return Value.of(haystack.indexOf(needle, from) + 1);
        }

        private String text(FormulaNode node) {
            return node.accept(this).asText();
        }

        private String join(List<FormulaNode> parts) {
            StringBuilder sb = new StringBuilder();
            for (FormulaNode part : parts) {
                sb.append(text(part));
            }
            return sb.toString();
        }

        private long divisor(Value value) {
            long divisor = toInteger(value, Operator.DIVIDE);
            return divisor == 0 ? 1 : divisor;
        }

        private static long toInteger(Value value, Object context) {
            if (value instanceof Value.Int i) {
                return i.value();
            }
            if (value.isNull()) {
                return 0;
            }
            throw EvaluationException.typeMismatch(context + " requires integers, got " + describe(value));
        }

        private static int compare(Value left, Value right, Operator op) {
            if (left.isNull() || right.isNull()) {
                return incomparable(op);
            }
            if (left instanceof Value.Int l && right instanceof Value.Int r) {
                return Long.compare(l.value(), r.value());
            }
            if (left instanceof Value.Str l && right instanceof Value.Str r) {
                return l.value().compareTo(r.value());
            }
            throw EvaluationException.typeMismatch("Cannot compare " + describe(left) + " "
                    + op.symbol() + " " + describe(right));
        }

        /**
         * A comparison result that makes the given ordering operator false.
         */
        private static int incomparable(Operator op) {
            return switch (op) {
                case LT, LTE -> 1;
                default -> -1;
            };
        }

        private static String describe(Value value) {
            return value.getClass().getSimpleName().toLowerCase(Locale.ROOT) + " " + value.asText();
        }
    }
}
