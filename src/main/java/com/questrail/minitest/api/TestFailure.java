package com.questrail.minitest.api;

import java.util.List;
import java.util.Objects;

/**
 * Raised when an assertion condition is not met.
 *
 * <p>A {@code TestFailure} is the only exception a test case absorbs: the
 * case reports it as a failed line and the run continues from there. Every
 * other throwable escapes the case.</p>
 *
 * <p>{@link #values()} holds the stringified operands in invocation order
 * when the failing assertion was verbose, and is empty otherwise.</p>
 */
public final class TestFailure extends RuntimeException
{
    private final String conditionName;
    private final List<String> values;

    public TestFailure(String message, String conditionName, List<String> values) {
        super(message);
        this.conditionName = Objects.requireNonNull(conditionName, "conditionName");
        this.values = List.copyOf(values);
    }

    public String conditionName() {
        return conditionName;
    }

    public List<String> values() {
        return values;
    }
}
