package com.questrail.minitest.observability;

import com.questrail.minitest.api.TestOutcome;

/**
 * Receives lifecycle callbacks from a {@link com.questrail.minitest.core.TestRegistry} run.
 * Implementations can provide logging, metrics, or result collection.
 *
 * <p>Callbacks arrive on the thread executing the run, in execution order.</p>
 */
public interface TestRunListener {
    /**
     * Called before the first test case runs.
     * @param testCount number of registered test cases
     */
    void onRunStarted(int testCount);

    /**
     * Called after a test case passed or failed an assertion.
     * @param outcome the outcome, already written to the run output
     */
    void onTestFinished(TestOutcome outcome);

    /**
     * Called when a test case raised something other than an assertion
     * failure. The run is aborted and {@link #onRunFinished} is not called.
     */
    void onTestDefect(String testName, Throwable defect);

    /**
     * Called when the run ends without a defect.
     * @param success {@code true} if every executed test case passed
     */
    void onRunFinished(boolean success);
}
