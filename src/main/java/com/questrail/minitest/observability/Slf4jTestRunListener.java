package com.questrail.minitest.observability;

import com.questrail.minitest.api.TestOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TestRunListener that emits run progress via SLF4J.
 */
public final class Slf4jTestRunListener implements TestRunListener {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTestRunListener.class);

    @Override
    public void onRunStarted(int testCount) {
        log.debug("Test run started: {} test(s) registered", testCount);
    }

    @Override
    public void onTestFinished(TestOutcome outcome) {
        if (outcome.isPassed()) {
            log.debug("Test {} passed", outcome.testName());
        } else {
            log.warn("Test {} failed: {}", outcome.testName(), outcome.message());
        }
    }

    @Override
    public void onTestDefect(String testName, Throwable defect) {
        log.error("Test {} aborted the run", testName, defect);
    }

    @Override
    public void onRunFinished(boolean success) {
        log.debug("Test run finished: {}", success ? "SUCCESS" : "FAILURE");
    }
}
