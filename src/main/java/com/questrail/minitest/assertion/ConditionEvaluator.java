package com.questrail.minitest.assertion;

import com.questrail.minitest.api.TestFailure;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * ConditionEvaluator
 * -----------------------------------------------------------------------------
 * Shared mechanism behind every assertion: evaluates a predicate over one or
 * two operands and turns a {@code false} result into a {@link TestFailure}.
 *
 * <p>Failure messages have the form</p>
 * <pre>
 *   Condition assertEqual not met. Values were (3, 4).
 * </pre>
 * <p>where the value dump is present only when {@code verbose} is set. Without
 * it the message ends after {@code "not met. "}, trailing space included.</p>
 *
 * <p>The predicate is invoked exactly once. If it throws, the exception
 * propagates unmodified and is never converted into a {@code TestFailure}.</p>
 */
public final class ConditionEvaluator
{
    private ConditionEvaluator() {}

    public static <T> void evaluate(String conditionName,
                                    Predicate<? super T> predicate,
                                    T operand,
                                    boolean verbose) {
        if (!predicate.test(operand)) {
            throw failure(conditionName, verbose, operand);
        }
    }

    public static <T> void evaluate(String conditionName,
                                    BiPredicate<? super T, ? super T> predicate,
                                    T lhs,
                                    T rhs,
                                    boolean verbose) {
        if (!predicate.test(lhs, rhs)) {
            throw failure(conditionName, verbose, lhs, rhs);
        }
    }

    static TestFailure failure(String conditionName, boolean verbose, Object... operands) {
        StringBuilder message = new StringBuilder()
            .append("Condition ").append(conditionName).append(" not met. ");

        List<String> values = new ArrayList<>();
        if (verbose) {
            for (Object operand : operands) {
                values.add(stringify(operand));
            }
            message.append("Values were (").append(String.join(", ", values)).append(").");
        }
        return new TestFailure(message.toString(), conditionName, values);
    }

    static String stringify(Object operand) {
        if (operand != null && operand.getClass().isArray()) {
            // deepToString handles primitive arrays when wrapped in an Object[]
            String wrapped = Arrays.deepToString(new Object[] { operand });
            return wrapped.substring(1, wrapped.length() - 1);
        }
        return String.valueOf(operand);
    }
}
