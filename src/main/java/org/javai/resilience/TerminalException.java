package org.javai.resilience;

/**
 * A validation or business-rule violation. Never retried.
 *
 * <p>A terminal error may carry a client-safe message. It is the only error text
 * that boundary responses are allowed to show; the regular message stays internal.
 */
public class TerminalException extends ResilienceException {

    private final String clientMessage;

    public TerminalException(String code, String message) {
        this(code, message, null, null);
    }

    public TerminalException(String code, String message, String clientMessage) {
        this(code, message, clientMessage, null);
    }

    public TerminalException(String code, String message, String clientMessage, Throwable cause) {
        super(code, message, cause);
        this.clientMessage = clientMessage;
    }

    /**
     * Returns the message that may be shown to clients, or null if there is none.
     */
    public String clientMessage() {
        return clientMessage;
    }
}
