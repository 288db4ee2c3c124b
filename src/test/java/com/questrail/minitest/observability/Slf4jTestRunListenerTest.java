package com.questrail.minitest.observability;

import com.questrail.minitest.api.TestOutcome;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class Slf4jTestRunListenerTest
{
    @Test
    void logsEveryCallbackWithoutThrowing() {
        Slf4jTestRunListener listener = new Slf4jTestRunListener();

        assertDoesNotThrow(() -> {
            listener.onRunStarted(2);
            listener.onTestFinished(TestOutcome.passed("a"));
            listener.onTestFinished(TestOutcome.failed("b", "Condition assertTrue not met. "));
            listener.onTestDefect("c", new IllegalStateException("boom"));
            listener.onRunFinished(false);
        });
    }
}
