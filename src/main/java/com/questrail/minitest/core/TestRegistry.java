package com.questrail.minitest.core;

import com.questrail.minitest.api.TestDefectException;
import com.questrail.minitest.api.TestOutcome;
import com.questrail.minitest.config.TestRunConfig;
import com.questrail.minitest.observability.Slf4jTestRunListener;
import com.questrail.minitest.observability.TestRunListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * TestRegistry
 * -----------------------------------------------------------------------------
 * Ordered collection of {@link TestCase}s and the logic to run them in
 * sequence.
 *
 * <h2>Ordering</h2>
 * Execution order is registration order. The registry never reorders or
 * deduplicates: registering two cases with the same name yields two
 * independently run entries. Running does not mutate the registry, so
 * repeated runs produce the same ordered output.
 *
 * <h2>Stopping</h2>
 * A run stops at the first failed case unless
 * {@link TestRunConfig#stopOnFirstFailure()} is cleared. A defect (anything
 * other than an assertion failure) always aborts the run: the throwable
 * escapes {@link #runTests()} and no line is written for that case.
 *
 * <h2>Lifecycle</h2>
 * Registries are ordinary objects and can be created and passed around
 * explicitly. {@link #defaultRegistry()} provides the single process-wide
 * instance used by {@link MiniTest}; it is created on first use and never
 * torn down.
 *
 * <h2>Threading</h2>
 * Not thread-safe. Registration and execution are expected to happen on one
 * thread; concurrent callers must synchronize externally around
 * {@link #addTest} and {@link #runTests}.
 */
public final class TestRegistry
{
    private static final Logger log = LoggerFactory.getLogger(TestRegistry.class);

    private final List<TestCase> tests = new ArrayList<>();
    private final TestRunConfig config;

    public TestRegistry() {
        this(TestRunConfig.defaults());
    }

    public TestRegistry(TestRunConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public static TestRegistry defaultRegistry() {
        return DefaultHolder.INSTANCE;
    }

    public void addTest(TestCase test) {
        Objects.requireNonNull(test, "test");
        tests.add(test);
        log.debug("Registered test {} at position {}", test.name(), tests.size());
    }

    /**
     * Runs the registered test cases in registration order.
     *
     * @return {@code true} if every executed case passed
     */
    public boolean runTests() {
        TestRunListener listener = config.listener();
        List<TestCase> snapshot = List.copyOf(tests);
        listener.onRunStarted(snapshot.size());

        int passed = 0;
        int failed = 0;
        for (TestCase test : snapshot) {
            TestOutcome outcome = runOne(test, listener);
            listener.onTestFinished(outcome);

            if (outcome.isPassed()) {
                passed++;
                continue;
            }
            failed++;
            if (config.stopOnFirstFailure()) {
                log.info("Stopping after failed test {}", test.name());
                break;
            }
        }

        boolean success = failed == 0;
        log.info("Test run complete: {} passed, {} failed, {} not run",
            passed, failed, snapshot.size() - passed - failed);
        listener.onRunFinished(success);
        return success;
    }

    private TestOutcome runOne(TestCase test, TestRunListener listener) {
        try {
            return test.run(config.out());
        } catch (RuntimeException | Error e) {
            Throwable defect = e instanceof TestDefectException ? e.getCause() : e;
            listener.onTestDefect(test.name(), defect);
            throw e;
        }
    }

    /**
     * Returns a read-only view of the registered cases in registration order.
     */
    public List<TestCase> tests() {
        return Collections.unmodifiableList(tests);
    }

    public int size() {
        return tests.size();
    }

    private static final class DefaultHolder {
        static final TestRegistry INSTANCE = new TestRegistry(
            TestRunConfig.builder()
                .withListener(new Slf4jTestRunListener())
                .build());
    }
}
