package com.questrail.minitest.assertion;

import com.questrail.minitest.api.TestAction;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered list of throwable types an action is expected to raise.
 */
final class ThrowableKinds
{
    private final List<Class<? extends Throwable>> kinds;

    private ThrowableKinds(List<Class<? extends Throwable>> kinds) {
        this.kinds = kinds;
    }

    @SafeVarargs
    static ThrowableKinds of(Class<? extends Throwable>... kinds) {
        Objects.requireNonNull(kinds, "kinds");
        return new ThrowableKinds(List.of(kinds));
    }

    /**
     * Returns the first listed kind that {@code thrown} is an instance of.
     */
    Optional<Class<? extends Throwable>> classify(Throwable thrown) {
        for (Class<? extends Throwable> kind : kinds) {
            if (kind.isInstance(thrown)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Runs {@code action} and reports whether it raised one of the listed kinds.
     */
    boolean raisedBy(TestAction action) {
        try {
            action.run();
        } catch (Throwable thrown) {
            if (thrown instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return classify(thrown).isPresent();
        }
        return false;
    }
}
