package com.questrail.minitest.core;

import com.questrail.minitest.api.TestAction;
import com.questrail.minitest.api.TestDefectException;
import com.questrail.minitest.api.TestFailure;
import com.questrail.minitest.api.TestOutcome;

import java.io.PrintStream;
import java.util.Objects;

/**
 * TestCase
 * -----------------------------------------------------------------------------
 * An immutable, named test action.
 *
 * <h2>Failure vs defect</h2>
 * {@link #run(PrintStream)} distinguishes two ways an action can go wrong:
 * <ul>
 *   <li>It throws {@link TestFailure}: an assertion was not met. The failure
 *       is reported as a {@code failed} line and returned as a
 *       {@link TestOutcome}; it never escapes {@code run}.</li>
 *   <li>It throws anything else: the test code or the system under test is
 *       broken. Nothing is printed and the throwable escapes {@code run}.
 *       Unchecked exceptions and errors escape unmodified; checked exceptions
 *       escape wrapped in {@link TestDefectException}.</li>
 * </ul>
 */
public final class TestCase
{
    private final String name;
    private final TestAction action;

    public TestCase(String name, TestAction action) {
        this.name = Objects.requireNonNull(name, "name");
        this.action = Objects.requireNonNull(action, "action");
    }

    public String name() {
        return name;
    }

    /**
     * Runs the action once and writes one result line to {@code out}.
     *
     * @throws TestDefectException if the action threw a checked exception
     */
    public TestOutcome run(PrintStream out) {
        TestOutcome outcome;
        try {
            action.run();
            outcome = TestOutcome.passed(name);
        } catch (TestFailure failure) {
            outcome = TestOutcome.failed(name, String.valueOf(failure.getMessage()));
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new TestDefectException(name, e);
        }
        out.println(outcome.reportLine());
        return outcome;
    }

    @Override
    public String toString() {
        return "TestCase(" + name + ")";
    }
}
