package com.questrail.minitest.api;

/**
 * Carries a checked exception thrown by a test action out of the test case.
 *
 * <p>Unchecked exceptions and errors escape a test case unmodified; only
 * checked ones are wrapped here so the run can abort without declaring
 * {@code throws Exception} all the way up.</p>
 */
public final class TestDefectException extends RuntimeException
{
    private final String testName;

    public TestDefectException(String testName, Throwable cause) {
        super("Test " + testName + " raised an unexpected " + cause.getClass().getName(), cause);
        this.testName = testName;
    }

    public String testName() {
        return testName;
    }
}
