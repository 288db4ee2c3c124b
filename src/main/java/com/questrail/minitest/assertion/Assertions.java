package com.questrail.minitest.assertion;

import com.questrail.minitest.api.TestAction;

import java.util.Objects;

/**
 * Assertions
 * -----------------------------------------------------------------------------
 * The assertion primitives available to test actions.
 *
 * <p>Every assertion is a named condition evaluated by
 * {@link ConditionEvaluator}. On mismatch it throws
 * {@link com.questrail.minitest.api.TestFailure} whose message names the
 * assertion and, when verbose, dumps the operands in argument order:</p>
 * <pre>
 *   assertEqual(3, 4)  →  Condition assertEqual not met. Values were (3, 4).
 * </pre>
 *
 * <p>All value assertions are verbose unless called with
 * {@code verbose = false}. Equality compares arrays by content, matching
 * the way they are dumped.</p>
 *
 * <h2>Ordering</h2>
 * <p>{@code assertLt}, {@code assertLte}, {@code assertGt} and {@code assertGte}
 * compare via {@link Comparable#compareTo}. A {@code null} operand or an
 * incomparable pair is a defect in the test, not a failed condition, so the
 * resulting exception propagates as-is.</p>
 */
public final class Assertions
{
    private Assertions() {}

    // ---------------------------------------------------------------------
    // Equality
    // ---------------------------------------------------------------------

    public static <T> void assertEqual(T actual, T expected) {
        assertEqual(actual, expected, true);
    }

    public static <T> void assertEqual(T actual, T expected, boolean verbose) {
        ConditionEvaluator.evaluate("assertEqual", Objects::deepEquals, actual, expected, verbose);
    }

    public static <T> void assertNotEqual(T actual, T expected) {
        assertNotEqual(actual, expected, true);
    }

    public static <T> void assertNotEqual(T actual, T expected, boolean verbose) {
        ConditionEvaluator.evaluate("assertNotEqual",
            (T a, T b) -> !Objects.deepEquals(a, b), actual, expected, verbose);
    }

    // ---------------------------------------------------------------------
    // Boolean
    // ---------------------------------------------------------------------

    public static void assertTrue(boolean value) {
        assertTrue(value, true);
    }

    public static void assertTrue(boolean value, boolean verbose) {
        ConditionEvaluator.evaluate("assertTrue", (Boolean cond) -> cond, value, verbose);
    }

    public static void assertFalse(boolean value) {
        assertFalse(value, true);
    }

    public static void assertFalse(boolean value, boolean verbose) {
        ConditionEvaluator.evaluate("assertFalse", (Boolean cond) -> !cond, value, verbose);
    }

    // ---------------------------------------------------------------------
    // Ordering
    // ---------------------------------------------------------------------

    public static <T extends Comparable<? super T>> void assertLt(T lhs, T rhs) {
        assertLt(lhs, rhs, true);
    }

    public static <T extends Comparable<? super T>> void assertLt(T lhs, T rhs, boolean verbose) {
        ConditionEvaluator.evaluate("assertLt", (T a, T b) -> a.compareTo(b) < 0, lhs, rhs, verbose);
    }

    public static <T extends Comparable<? super T>> void assertLte(T lhs, T rhs) {
        assertLte(lhs, rhs, true);
    }

    public static <T extends Comparable<? super T>> void assertLte(T lhs, T rhs, boolean verbose) {
        ConditionEvaluator.evaluate("assertLte", (T a, T b) -> a.compareTo(b) <= 0, lhs, rhs, verbose);
    }

    public static <T extends Comparable<? super T>> void assertGt(T lhs, T rhs) {
        assertGt(lhs, rhs, true);
    }

    public static <T extends Comparable<? super T>> void assertGt(T lhs, T rhs, boolean verbose) {
        ConditionEvaluator.evaluate("assertGt", (T a, T b) -> a.compareTo(b) > 0, lhs, rhs, verbose);
    }

    public static <T extends Comparable<? super T>> void assertGte(T lhs, T rhs) {
        assertGte(lhs, rhs, true);
    }

    public static <T extends Comparable<? super T>> void assertGte(T lhs, T rhs, boolean verbose) {
        ConditionEvaluator.evaluate("assertGte", (T a, T b) -> a.compareTo(b) >= 0, lhs, rhs, verbose);
    }

    // ---------------------------------------------------------------------
    // Exceptions
    // ---------------------------------------------------------------------

    /**
     * Passes if {@code action} throws an instance of {@code kind}.
     */
    public static void assertThrows(Class<? extends Throwable> kind, TestAction action) {
        expectThrown(action, ThrowableKinds.of(kind));
    }

    /**
     * Passes if {@code action} throws an instance of any of {@code kinds}.
     *
     * <p>Kinds are checked in the order given and the first match wins. If the
     * action completes normally, or throws something matching none of the
     * kinds, the assertion fails with {@code "Condition assertThrows not met. "}
     * and no value dump. A non-matching throwable is swallowed; it is not
     * rethrown.</p>
     */
    @SafeVarargs
    public static void assertThrows(TestAction action, Class<? extends Throwable>... kinds) {
        expectThrown(action, ThrowableKinds.of(kinds));
    }

    private static void expectThrown(TestAction action, ThrowableKinds kinds) {
        Objects.requireNonNull(action, "action");
        ConditionEvaluator.evaluate("assertThrows", kinds::raisedBy, action, false);
    }
}
