package com.questrail.minitest.core;

import com.questrail.minitest.api.TestAction;

import java.util.Objects;

/**
 * Registers test cases under a common {@code "group::"} name prefix.
 *
 * <pre>
 *   new TestGroup(registry, "Math")
 *       .add("addition", () -&gt; assertEqual(2 + 2, 4))
 *       .add("ordering", () -&gt; assertLt(1, 2));
 * </pre>
 *
 * registers {@code Math::addition} and {@code Math::ordering}. The group holds
 * no test state of its own; the cases belong to the registry.
 */
public final class TestGroup
{
    static final String SEPARATOR = "::";

    private final TestRegistry registry;
    private final String name;

    public TestGroup(TestRegistry registry, String name) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.name = Objects.requireNonNull(name, "name");
    }

    public TestGroup add(String testName, TestAction action) {
        Objects.requireNonNull(testName, "testName");
        registry.addTest(new TestCase(name + SEPARATOR + testName, action));
        return this;
    }
}
