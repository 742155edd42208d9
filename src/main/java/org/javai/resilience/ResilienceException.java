package org.javai.resilience;

/**
 * Base type for the errors this library raises or recognises by type.
 *
 * <p>The code is a stable token (for example {@code ECONNRESET} or {@code VALIDATION})
 * that classifiers and reporters can match without parsing messages.
 */
public abstract class ResilienceException extends RuntimeException {

    private final String code;

    protected ResilienceException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Returns the stable error code, or null if none was given.
     */
    public String code() {
        return code;
    }
}
