package com.questrail.minitest.api;

/**
 * TestAction
 * -----------------------------------------------------------------------------
 * The zero-argument body of a test case.
 *
 * <p>An action signals an expected assertion failure by throwing
 * {@link TestFailure}. Anything else it throws is treated as a defect in the
 * test code or in the system under test.</p>
 */
@FunctionalInterface
public interface TestAction
{
    void run() throws Exception;
}
