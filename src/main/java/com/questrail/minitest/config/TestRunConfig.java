package com.questrail.minitest.config;

import com.questrail.minitest.observability.NullTestRunListener;
import com.questrail.minitest.observability.TestRunListener;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Settings for a {@link com.questrail.minitest.core.TestRegistry}.
 *
 * <p>{@code out} receives the pass/fail lines. With
 * {@code stopOnFirstFailure} set (the default) a run ends at the first failed
 * test case; otherwise every case runs and the result is the conjunction.</p>
 */
public record TestRunConfig(
    PrintStream out,
    TestRunListener listener,
    boolean stopOnFirstFailure
) {
    public TestRunConfig {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(listener, "listener");
    }

    public static TestRunConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PrintStream out = System.out;
        private TestRunListener listener = NullTestRunListener.INSTANCE;
        private boolean stopOnFirstFailure = true;

        public Builder withOut(PrintStream out) {
            this.out = out;
            return this;
        }

        public Builder withListener(TestRunListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder withStopOnFirstFailure(boolean stopOnFirstFailure) {
            this.stopOnFirstFailure = stopOnFirstFailure;
            return this;
        }

        public TestRunConfig build() {
            return new TestRunConfig(out, listener, stopOnFirstFailure);
        }
    }
}
