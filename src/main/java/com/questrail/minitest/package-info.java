/**
 * minitest: an embeddable, in-process unit-test harness.
 * =============================================================================
 *
 * <p>Programs register named test actions, run them in registration order,
 * and get one plain-text line per executed case:</p>
 *
 * <pre>
 *   Test Math::addition passed.
 *   Test Math::ordering failed: Condition assertLt not met. Values were (2, 1).
 * </pre>
 *
 * <h2>Layers</h2>
 * <ul>
 *   <li>{@code api}: the action type, the assertion failure and the outcome record</li>
 *   <li>{@code assertion}: the condition evaluator and the assertion primitives</li>
 *   <li>{@code core}: test cases, the registry, groups and the static façade</li>
 *   <li>{@code config} and {@code observability}: run settings and listeners</li>
 * </ul>
 *
 * <h2>Not provided</h2>
 * <p>Discovery, parallel execution, setup/teardown hooks and structured report
 * formats are out of scope.</p>
 */
package com.questrail.minitest;
