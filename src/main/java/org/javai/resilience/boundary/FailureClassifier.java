package org.javai.resilience.boundary;

import org.javai.resilience.FailureKind;

/**
 * Decides whether a caught error is retryable or terminal.
 * Implementations must be deterministic and side effect free.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * Classifies an error into a FailureKind.
     *
     * @param throwable The error that occurred, already unwrapped from completion wrappers
     * @return A classified FailureKind
     */
    FailureKind classify(Throwable throwable);
}
