package org.javai.resilience;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * The original error, if any, is kept as the cause.
 */
public class OutcomeFailedException extends RuntimeException {

    private final Failure failure;
    private final int attempts;

    public OutcomeFailedException(Failure failure, int attempts) {
        super("Outcome failed after " + attempts + " attempt(s): " + failure.message(), failure.exception());
        this.failure = failure;
        this.attempts = attempts;
    }

    public Failure failure() {
        return failure;
    }

    public int attempts() {
        return attempts;
    }
}
