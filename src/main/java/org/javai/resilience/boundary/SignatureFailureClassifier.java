package org.javai.resilience.boundary;

import org.javai.resilience.FailureCode;
import org.javai.resilience.FailureKind;
import org.javai.resilience.ResilienceException;
import org.javai.resilience.TerminalException;
import org.javai.resilience.TransientException;
import org.javai.resilience.circuit.CircuitOpenException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies errors as retryable when they match a known transient signature.
 *
 * <p>Typed errors are checked first ({@link TerminalException}, {@link CircuitOpenException},
 * {@link TransientException}, JDK network and SQL types). Anything left is matched
 * case-insensitively against the configured signatures, looking at the message and the
 * error code. Unknown errors are terminal: retrying them would only hide bugs.
 */
public class SignatureFailureClassifier implements FailureClassifier {

    public static final List<String> DEFAULT_SIGNATURES = List.of(
            "ECONNRESET",
            "ECONNREFUSED",
            "ETIMEDOUT",
            "ENOTFOUND",
            "CONNECTION_LOST",
            "PROTOCOL_CONNECTION_LOST",
            "connection reset",
            "connection lost",
            "timed out",
            "timeout"
    );

    private final Set<String> signatures;

    public SignatureFailureClassifier() {
        this(DEFAULT_SIGNATURES);
    }

    public SignatureFailureClassifier(List<String> signatures) {
        Objects.requireNonNull(signatures, "signatures must not be null");
        Set<String> normalized = new LinkedHashSet<>();
        for (String signature : signatures) {
            if (signature != null && !signature.isBlank()) {
                normalized.add(signature.trim());
            }
        }
        this.signatures = Set.copyOf(normalized);
    }

    public static SignatureFailureClassifier defaults() {
        return new SignatureFailureClassifier(DEFAULT_SIGNATURES);
    }

    /**
     * Signatures for data-store connections.
     */
    public static SignatureFailureClassifier database() {
        return new SignatureFailureClassifier(extend(DEFAULT_SIGNATURES, "ECONNABORTED"));
    }

    /**
     * Signatures for calls to external services.
     */
    public static SignatureFailureClassifier network() {
        return new SignatureFailureClassifier(extend(DEFAULT_SIGNATURES, "FETCH_ERROR", "NETWORK_ERROR"));
    }

    /**
     * Returns the signatures this classifier treats as transient, sorted.
     */
    public List<String> signatures() {
        return signatures.stream().sorted().toList();
    }

    @Override
    public FailureKind classify(Throwable throwable) {
        Throwable t = unwrap(throwable);

        if (t instanceof TerminalException terminal) {
            return FailureKind.terminalFailure(
                    FailureCode.of("terminal", codeOr(terminal, "rejected")),
                    messageFor("Terminal error", t));
        }

        // A rejection must surface at once; retrying it would just be rejected again
        if (t instanceof CircuitOpenException) {
            return FailureKind.terminalFailure(
                    FailureCode.of("circuit", "open"),
                    messageFor("Circuit open", t));
        }

        if (t instanceof TransientException transientError) {
            return FailureKind.transientFailure(
                    FailureCode.of("transient", codeOr(transientError, "unspecified")),
                    messageFor("Transient error", t));
        }

        // Network
        if (t instanceof SocketTimeoutException) {
            return FailureKind.transientFailure(FailureCode.of("network", "timeout"), messageFor("Socket timeout", t));
        }

        if (t instanceof HttpTimeoutException) {
            return FailureKind.transientFailure(FailureCode.of("network", "http_timeout"), messageFor("HTTP timeout", t));
        }

        if (t instanceof ConnectException) {
            return FailureKind.transientFailure(
                    FailureCode.of("network", "connection_refused"),
                    messageFor("Connection refused", t));
        }

        if (t instanceof UnknownHostException) {
            return FailureKind.terminalFailure(FailureCode.of("network", "unknown_host"), messageFor("Unknown host", t));
        }

        if (t instanceof TimeoutException) {
            return FailureKind.transientFailure(FailureCode.of("operation", "timeout"), messageFor("Operation timeout", t));
        }

        // SQL
        if (t instanceof SQLTransientException || t instanceof SQLRecoverableException) {
            return FailureKind.transientFailure(FailureCode.of("sql", "transient"), messageFor("SQL transient error", t));
        }

        if (t instanceof SQLException sqlEx) {
            String sqlState = sqlEx.getSQLState();
            if (sqlState != null && sqlState.startsWith("08")) {
                return FailureKind.transientFailure(
                        FailureCode.of("sql", "connection"),
                        messageFor("SQL connection error", t));
            }
        }

        String signature = matchingSignature(t);
        if (signature != null) {
            return FailureKind.transientFailure(FailureCode.of("signature", signature), messageFor("Transient error", t));
        }

        return FailureKind.terminalFailure(
                FailureCode.of("unknown", t.getClass().getSimpleName()),
                t.getMessage() != null ? t.getMessage() : t.getClass().getName());
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable must not be null");
        Throwable t = throwable;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private String matchingSignature(Throwable t) {
        String message = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
        String code = errorCodeOf(t);
        for (String signature : signatures) {
            if (signature.equalsIgnoreCase(code) || message.contains(signature.toLowerCase(Locale.ROOT))) {
                return signature;
            }
        }
        return null;
    }

    private static String errorCodeOf(Throwable t) {
        if (t instanceof ResilienceException resilience) {
            return resilience.code();
        }
        if (t instanceof SQLException sqlEx) {
            return sqlEx.getSQLState();
        }
        return null;
    }

    private static String codeOr(ResilienceException e, String fallback) {
        return e.code() == null || e.code().isBlank() ? fallback : e.code();
    }

    private static String messageFor(String prefix, Throwable t) {
        return prefix + ": " + t.getMessage();
    }

    private static List<String> extend(List<String> base, String... extra) {
        Set<String> all = new LinkedHashSet<>(base);
        all.addAll(List.of(extra));
        return List.copyOf(all);
    }
}
