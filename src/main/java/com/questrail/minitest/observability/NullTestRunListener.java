package com.questrail.minitest.observability;

import com.questrail.minitest.api.TestOutcome;

/**
 * No-op implementation of TestRunListener.
 */
public final class NullTestRunListener implements TestRunListener {
    public static final NullTestRunListener INSTANCE = new NullTestRunListener();

    private NullTestRunListener() {}

    @Override
    public void onRunStarted(int testCount) {}

    @Override
    public void onTestFinished(TestOutcome outcome) {}

    @Override
    public void onTestDefect(String testName, Throwable defect) {}

    @Override
    public void onRunFinished(boolean success) {}
}
