package com.questrail.minitest.core;

import com.questrail.minitest.assertion.Assertions;
import com.questrail.minitest.config.TestRunConfig;
import com.questrail.minitest.observability.RecordingTestRunListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TestRegistryTest
{
    private ByteArrayOutputStream buffer;
    private RecordingTestRunListener listener;
    private List<String> executed;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        listener = new RecordingTestRunListener();
        executed = new ArrayList<>();
    }

    private TestRegistry registry(boolean stopOnFirstFailure) {
        return new TestRegistry(TestRunConfig.builder()
            .withOut(new PrintStream(buffer, true, StandardCharsets.UTF_8))
            .withListener(listener)
            .withStopOnFirstFailure(stopOnFirstFailure)
            .build());
    }

    private List<String> lines() {
        String text = buffer.toString(StandardCharsets.UTF_8);
        return text.isEmpty() ? List.of() : List.of(text.split("\\R"));
    }

    private TestCase recording(String name, boolean pass) {
        return new TestCase(name, () -> {
            executed.add(name);
            Assertions.assertTrue(pass);
        });
    }

    @Test
    void emptyRegistrySucceeds() {
        TestRegistry registry = registry(true);

        assertTrue(registry.runTests());
        assertEquals(List.of(), lines());
        assertEquals(List.of("started:0", "finished:true"), listener.events());
    }

    @Test
    void allPassingRunsInRegistrationOrder() {
        TestRegistry registry = registry(true);
        registry.addTest(recording("c", true));
        registry.addTest(recording("a", true));
        registry.addTest(recording("b", true));

        assertTrue(registry.runTests());
        assertEquals(List.of("c", "a", "b"), executed);
        assertEquals(List.of("Test c passed.", "Test a passed.", "Test b passed."), lines());
    }

    @Test
    void stopsAtFirstFailure() {
        TestRegistry registry = registry(true);
        registry.addTest(recording("first", true));
        registry.addTest(recording("second", false));
        registry.addTest(recording("third", true));

        assertFalse(registry.runTests());

        assertEquals(List.of("first", "second"), executed);
        assertEquals(List.of(
            "Test first passed.",
            "Test second failed: Condition assertTrue not met. Values were (false)."), lines());
        assertEquals(List.of("started:3", "PASSED:first", "FAILED:second", "finished:false"),
            listener.events());
    }

    @Test
    void continuesPastFailureWhenConfigured() {
        TestRegistry registry = registry(false);
        registry.addTest(recording("first", false));
        registry.addTest(recording("second", true));

        assertFalse(registry.runTests());
        assertEquals(List.of("first", "second"), executed);
        assertEquals(2, lines().size());
    }

    @Test
    void duplicateNamesAreKeptAsSeparateEntries() {
        TestRegistry registry = registry(true);
        registry.addTest(recording("same", true));
        registry.addTest(recording("same", true));

        assertEquals(2, registry.size());
        assertTrue(registry.runTests());
        assertEquals(List.of("Test same passed.", "Test same passed."), lines());
    }

    @Test
    void defectAbortsRunWithoutReportLine() {
        TestRegistry registry = registry(false);
        registry.addTest(recording("before", true));
        registry.addTest(new TestCase("broken", () -> {
            throw new ArithmeticException("/ by zero");
        }));
        registry.addTest(recording("after", true));

        ArithmeticException thrown = assertThrows(ArithmeticException.class, registry::runTests);

        assertEquals("/ by zero", thrown.getMessage());
        assertEquals(List.of("before"), executed);
        assertEquals(List.of("Test before passed."), lines());
        assertEquals(List.of("started:3", "PASSED:before", "defect:broken"), listener.events());
        assertSame(thrown, listener.lastDefect());
    }

    @Test
    void defectIsReportedOnceThroughListener() {
        TestRegistry registry = registry(true);
        registry.addTest(new TestCase("broken", () -> {
            throw new IllegalStateException("bad");
        }));

        assertThrows(IllegalStateException.class, registry::runTests);

        long defects = listener.events().stream().filter(e -> e.startsWith("defect:")).count();
        assertEquals(1, defects);
        assertEquals(List.of("started:1", "defect:broken"), listener.events());
    }

    @Test
    void testsAddedDuringRunWaitForNextRun() {
        TestRegistry registry = registry(true);
        registry.addTest(new TestCase("spawner", () -> {
            executed.add("spawner");
            registry.addTest(recording("spawned", true));
        }));

        assertTrue(registry.runTests());

        assertEquals(List.of("spawner"), executed);
        assertEquals(List.of("started:1", "PASSED:spawner", "finished:true"), listener.events());
        assertEquals(2, registry.size());
    }

    @Test
    void checkedDefectIsReportedToListenerUnwrapped() {
        TestRegistry registry = registry(true);
        IOException cause = new IOException("disk");
        registry.addTest(new TestCase("io", () -> {
            throw cause;
        }));

        assertThrows(com.questrail.minitest.api.TestDefectException.class, registry::runTests);
        assertSame(cause, listener.lastDefect());
    }

    @Test
    void repeatedRunsProduceIdenticalOutput() {
        TestRegistry registry = registry(true);
        registry.addTest(recording("one", true));
        registry.addTest(recording("two", false));
        registry.addTest(recording("three", true));

        assertFalse(registry.runTests());
        List<String> firstRun = lines();
        buffer.reset();

        assertFalse(registry.runTests());
        assertEquals(firstRun, lines());
        assertEquals(3, registry.size());
    }

    @Test
    void testsViewIsReadOnly() {
        TestRegistry registry = registry(true);
        registry.addTest(recording("x", true));

        assertThrows(UnsupportedOperationException.class,
            () -> registry.tests().add(recording("y", true)));
        assertEquals("x", registry.tests().get(0).name());
    }

    @Test
    void rejectsNullTest() {
        assertThrows(NullPointerException.class, () -> registry(true).addTest(null));
    }

    @Test
    void defaultRegistryIsASingleInstance() {
        assertSame(TestRegistry.defaultRegistry(), TestRegistry.defaultRegistry());
    }
}
