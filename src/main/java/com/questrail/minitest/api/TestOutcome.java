package com.questrail.minitest.api;

import java.util.Objects;

/**
 * Result of running a single test case to completion.
 *
 * <p>Defects are not outcomes: a test whose action raised anything other than
 * {@link TestFailure} produces no {@code TestOutcome}.</p>
 */
public record TestOutcome(
    String testName,
    Status status,
    String message
) {
    public enum Status {
        PASSED,
        FAILED
    }

    public TestOutcome {
        Objects.requireNonNull(testName, "testName");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(message, "message");
    }

    public static TestOutcome passed(String testName) {
        return new TestOutcome(testName, Status.PASSED, "");
    }

    public static TestOutcome failed(String testName, String message) {
        return new TestOutcome(testName, Status.FAILED, message);
    }

    public boolean isPassed() {
        return status == Status.PASSED;
    }

    /**
     * The line written to the run's output stream for this outcome.
     */
    public String reportLine() {
        return isPassed()
            ? "Test " + testName + " passed."
            : "Test " + testName + " failed: " + message;
    }
}
