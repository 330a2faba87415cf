package io.cifxform.core.rules;

import io.cifxform.core.error.RuleEvaluationException;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Arithmetic over numeric field values, as written on the right-hand side of a
 * {@code CALCULATE} rule.
 */
public sealed interface Expression {

    /**
     * Evaluates the expression.
     *
     * @param fields returns the numeric value of a referenced field; throws
     *               {@link RuleEvaluationException} when the field is missing or not a number
     * @throws RuleEvaluationException on division by zero, or when {@code fields} does
     */
    double evaluate(ToDoubleFunction<String> fields);

    /** Data names the expression reads, in order of first appearance. */
    default Set<String> references() {
        Set<String> names = new LinkedHashSet<>();
        collect(this, names);
        return names;
    }

    private static void collect(Expression expression, Set<String> names) {
        if (expression instanceof FieldRef ref) {
            names.add(ref.name());
        } else if (expression instanceof Negate negate) {
            collect(negate.operand(), names);
        } else if (expression instanceof Binary binary) {
            collect(binary.left(), names);
            collect(binary.right(), names);
        }
    }

    /** A numeric literal. */
    record Number(double value) implements Expression {
        @Override
        public double evaluate(ToDoubleFunction<String> fields) {
            return value;
        }
    }

    /** The value of another field. */
    record FieldRef(String name) implements Expression {
        public FieldRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public double evaluate(ToDoubleFunction<String> fields) {
            return fields.applyAsDouble(name);
        }
    }

    /** Unary minus. */
    record Negate(Expression operand) implements Expression {
        public Negate {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public double evaluate(ToDoubleFunction<String> fields) {
            return -operand.evaluate(fields);
        }
    }

    /** One of {@code + - * /}. */
    record Binary(char operator, Expression left, Expression right) implements Expression {
        public Binary {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
            if ("+-*/".indexOf(operator) < 0) {
                throw new IllegalArgumentException("Unsupported operator: " + operator);
            }
        }

        @Override
        public double evaluate(ToDoubleFunction<String> fields) {
            double l = left.evaluate(fields);
            double r = right.evaluate(fields);
            return switch (operator) {
                case '+' -> l + r;
                case '-' -> l - r;
                case '*' -> l * r;
                default -> {
                    if (r == 0.0) {
                        throw new RuleEvaluationException("Division by zero", null);
                    }
                    yield l / r;
                }
            };
        }
    }
}
