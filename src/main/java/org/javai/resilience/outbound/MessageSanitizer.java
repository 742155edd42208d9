package org.javai.resilience.outbound;

import org.javai.resilience.TerminalException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides which error text may cross the boundary.
 *
 * <p>Only the client message of a {@link TerminalException} is ever shown, and only when it
 * does not look like SQL, a stack frame, a credential or a connection URL. Everything else
 * becomes {@link #GENERIC_MESSAGE}.
 */
public final class MessageSanitizer {

    public static final String GENERIC_MESSAGE = "An unexpected error occurred. Please try again later.";
    public static final int MAX_LENGTH = 200;

    private static final List<Pattern> INTERNAL_DETAIL = List.of(
            // SQL
            Pattern.compile("\\b(select|insert|update|delete|drop|alter|create|truncate)\\b.*\\b(from|into|table|set|where|values)\\b",
                    Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
            Pattern.compile("\\bsql(state)?\\b", Pattern.CASE_INSENSITIVE),
            // stack frames and exception class names
            Pattern.compile("\\bat\\s+[\\w$.]+\\([^)]*\\)"),
            Pattern.compile("\\b[\\w$]+(\\.[\\w$]+)+(Exception|Error)\\b"),
            // credentials
            Pattern.compile("\\b(password|passwd|pwd|secret|token|api[_-]?key|authorization)\\s*[:=]",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bbearer\\s+\\S+", Pattern.CASE_INSENSITIVE),
            // connection URLs
            Pattern.compile("\\b[a-z][a-z0-9+.-]*:(//|[a-z]+:)\\S+", Pattern.CASE_INSENSITIVE)
    );

    /**
     * Returns the text a client may see for {@code error}.
     */
    public String sanitize(Throwable error) {
        if (error instanceof TerminalException terminal) {
            return scrub(terminal.clientMessage());
        }
        return GENERIC_MESSAGE;
    }

    /**
     * Returns {@code message} cut to {@link #MAX_LENGTH}, or the generic message if it is
     * empty or shows internal detail.
     */
    public String scrub(String message) {
        if (message == null || message.isBlank()) {
            return GENERIC_MESSAGE;
        }
        for (Pattern pattern : INTERNAL_DETAIL) {
            if (pattern.matcher(message).find()) {
                return GENERIC_MESSAGE;
            }
        }
        String trimmed = message.trim();
        return trimmed.length() <= MAX_LENGTH ? trimmed : trimmed.substring(0, MAX_LENGTH);
    }
}
