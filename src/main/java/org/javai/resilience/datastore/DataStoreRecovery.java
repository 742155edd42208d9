package org.javai.resilience.datastore;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.resilience.ErrorRecovery;
import org.javai.resilience.RecoveryOptions;
import org.javai.resilience.RecoverySettings;
import org.javai.resilience.boundary.SignatureFailureClassifier;
import org.javai.resilience.retry.RetryListener;
import org.javai.resilience.retry.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Runs data-store queries and transactions with retries, circuit breaking and a query timeout.
 *
 * <p>Every attempt borrows its own connection and returns it once the underlying statement
 * has actually finished, even when the attempt already gave up on it after a timeout.
 * A failed transaction is rolled back before the next attempt begins a fresh one.</p>
 *
 * <p>Statements are logged truncated to 100 characters; parameter values are never
 * logged, only their count.</p>
 */
public final class DataStoreRecovery {

    private static final Logger LOG = LogManager.getLogger(DataStoreRecovery.class);

    public static final String HEALTH_QUERY = "SELECT 1";
    public static final String TRANSACTION_KEY = "db-transaction";
    public static final String HEALTH_KEY = "db-health";
    static final String QUERY_KEY_PREFIX = "db-query-";
    private static final int LOGGED_STATEMENT_LENGTH = 100;

    private final ConnectionPool pool;
    private final ErrorRecovery recovery;
    private final RecoverySettings settings;
    private final SignatureFailureClassifier classifier = SignatureFailureClassifier.database();

    public DataStoreRecovery(ConnectionPool pool, ErrorRecovery recovery) {
        this(pool, recovery, RecoverySettings.database());
    }

    public DataStoreRecovery(ConnectionPool pool, ErrorRecovery recovery, RecoverySettings settings) {
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
        this.recovery = Objects.requireNonNull(recovery, "recovery must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public CompletableFuture<List<Map<String, Object>>> executeQuery(String statement, List<?> params) {
        return executeQuery(statement, params, DataStoreOptions.defaults());
    }

    /**
     * Runs a query, racing each attempt against the query timeout.
     * Without an operation name the breaker is keyed by a hash of the statement.
     */
    public CompletableFuture<List<Map<String, Object>>> executeQuery(String statement, List<?> params,
                                                                     DataStoreOptions options) {
        Objects.requireNonNull(statement, "statement must not be null");
        Objects.requireNonNull(options, "options must not be null");
        // Parameters may hold SQL NULLs
        List<?> args = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
        String key = options.operationName() != null ? options.operationName() : queryKey(statement);
        Duration timeout = options.queryTimeout() != null ? options.queryTimeout() : settings.queryTimeout();

        RetryListener logging = new RetryListener() {
            @Override
            public void onRetry(int attemptNumber, Throwable error) {
                LOG.warn("Database query retry attempt {} [{}] ({} params): {}",
                        attemptNumber, truncate(statement), args.size(), error.getMessage());
            }

            @Override
            public void onFailure(Throwable error, int totalAttempts) {
                LOG.error("Database query failed after {} attempts [{}] ({} params): {}",
                        totalAttempts, truncate(statement), args.size(), error.getMessage(), error);
            }
        };

        return recovery.withFullRecovery(key,
                () -> withConnection(timeout, options.validateConnection(), connection -> connection.query(statement, args)),
                recoveryOptions(key, options, logging));
    }

    public <T> CompletableFuture<T> executeTransaction(TransactionWork<T> work) {
        return executeTransaction(work, DataStoreOptions.defaults());
    }

    /**
     * Runs {@code work} between begin and commit. Any error rolls the transaction back and
     * is raised again, so a retry always starts from a clean transaction.
     */
    public <T> CompletableFuture<T> executeTransaction(TransactionWork<T> work, DataStoreOptions options) {
        Objects.requireNonNull(work, "work must not be null");
        Objects.requireNonNull(options, "options must not be null");
        String key = options.operationName() != null ? options.operationName() : TRANSACTION_KEY;

        RetryListener logging = new RetryListener() {
            @Override
            public void onRetry(int attemptNumber, Throwable error) {
                LOG.warn("Database transaction retry attempt {} [{}]: {}", attemptNumber, key, error.getMessage());
            }

            @Override
            public void onFailure(Throwable error, int totalAttempts) {
                LOG.error("Database transaction failed after {} attempts [{}]: {}",
                        totalAttempts, key, error.getMessage(), error);
            }
        };

        return recovery.withFullRecovery(key,
                () -> withConnection(Duration.ZERO, options.validateConnection(),
                        connection -> inTransaction(connection, work)),
                recoveryOptions(key, options, logging));
    }

    /**
     * Runs the health query with a single retry. Resolves to false instead of failing.
     */
    public CompletableFuture<Boolean> checkHealth() {
        DataStoreOptions options = DataStoreOptions.named(HEALTH_KEY).withMaxRetries(1);
        return executeQuery(HEALTH_QUERY, List.of(), options)
                .handle((rows, error) -> {
                    if (error != null) {
                        LOG.error("Database health check failed: {}", error.getMessage());
                        return false;
                    }
                    return true;
                });
    }

    public DataStoreStats getStats() {
        return new DataStoreStats(recovery.getCircuitBreakerStats(), classifier.signatures(), settings, HEALTH_QUERY);
    }

    /**
     * Resets every circuit breaker.
     */
    public void reset() {
        recovery.resetAllCircuitBreakers();
    }

    static String queryKey(String statement) {
        return QUERY_KEY_PREFIX + Integer.toHexString(Math.abs(statement.hashCode()));
    }

    static String truncate(String statement) {
        if (statement.length() <= LOGGED_STATEMENT_LENGTH) {
            return statement;
        }
        return statement.substring(0, LOGGED_STATEMENT_LENGTH) + "...";
    }

    private <T> RecoveryOptions<T> recoveryOptions(String key, DataStoreOptions options, RetryListener logging) {
        int maxRetries = options.maxRetries() != null ? options.maxRetries() : settings.maxRetries();
        RetryPolicy policy = RetryPolicy.of(key, maxRetries, settings.backoff()).withClassifier(classifier);
        return RecoveryOptions.<T>builder()
                .retryPolicy(policy)
                .circuitBreaker(options.circuitBreaker() != null ? options.circuitBreaker() : settings.toCircuitBreakerConfig())
                .listener(logging.andThen(options.listener()))
                .build();
    }

    /**
     * Borrows a connection, runs {@code statement} on it and returns it when the statement's
     * own stage completes. With a positive timeout, the attempt fails with
     * {@link QueryTimeoutException} once it elapses and a late result is discarded.
     * With {@code validate} the connection must first answer the health query; a
     * connection that fails it is returned unused and the attempt fails with that error.
     */
    private <T> CompletableFuture<T> withConnection(Duration timeout, boolean validate,
                                                    Function<DataStoreConnection, CompletionStage<T>> statement) {
        AtomicBoolean abandoned = new AtomicBoolean();
        CompletableFuture<T> work = pool.acquire().toCompletableFuture().thenCompose(connection -> {
            CompletableFuture<Void> ready = validate
                    ? checkConnection(connection)
                    : CompletableFuture.completedFuture(null);
            return ready
                    .thenCompose(ignored -> {
                        if (abandoned.get()) {
                            return CompletableFuture.<T>failedFuture(new QueryTimeoutException(timeout));
                        }
                        return run(statement, connection);
                    })
                    .whenComplete((ignored, error) -> releaseQuietly(connection));
        });
        return recovery.scheduler().within(work, timeout, () -> {
            abandoned.set(true);
            return new QueryTimeoutException(timeout);
        });
    }

    private static <T> CompletableFuture<T> run(Function<DataStoreConnection, CompletionStage<T>> statement,
                                                DataStoreConnection connection) {
        try {
            return statement.apply(connection).toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static CompletableFuture<Void> checkConnection(DataStoreConnection connection) {
        CompletionStage<List<Map<String, Object>>> check;
        try {
            check = connection.query(HEALTH_QUERY, List.of());
        } catch (RuntimeException e) {
            check = CompletableFuture.failedFuture(e);
        }
        return check.toCompletableFuture()
                .whenComplete((rows, error) -> {
                    if (error != null) {
                        LOG.warn("Borrowed connection failed its health check: {}",
                                SignatureFailureClassifier.unwrap(error).getMessage());
                    }
                })
                .thenApply(rows -> null);
    }

    private <T> CompletableFuture<T> inTransaction(DataStoreConnection connection, TransactionWork<T> work) {
        CompletableFuture<T> body = connection.begin().toCompletableFuture()
                .thenCompose(ignored -> invoke(work, connection))
                .thenCompose(value -> connection.commit().toCompletableFuture().thenApply(ignored -> value));
        return body
                .handle((value, error) -> error == null
                        ? CompletableFuture.completedFuture(value)
                        : this.<T>rollback(connection, SignatureFailureClassifier.unwrap(error)))
                .thenCompose(Function.identity());
    }

    private static <T> CompletableFuture<T> invoke(TransactionWork<T> work, DataStoreConnection connection) {
        try {
            CompletionStage<T> stage = work.apply(connection);
            if (stage == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("transaction work returned no stage"));
            }
            return stage.toCompletableFuture();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> CompletableFuture<T> rollback(DataStoreConnection connection, Throwable error) {
        CompletableFuture<T> failed = new CompletableFuture<>();
        CompletionStage<Void> rollback;
        try {
            rollback = connection.rollback();
        } catch (RuntimeException e) {
            rollback = CompletableFuture.failedFuture(e);
        }
        rollback.whenComplete((ignored, rollbackError) -> {
            if (rollbackError != null) {
                Throwable cause = SignatureFailureClassifier.unwrap(rollbackError);
                LOG.error("Failed to roll back transaction: {}", cause.getMessage(), cause);
                if (cause != error) {
                    error.addSuppressed(cause);
                }
            }
            failed.completeExceptionally(error);
        });
        return failed;
    }

    private void releaseQuietly(DataStoreConnection connection) {
        try {
            pool.release(connection);
        } catch (RuntimeException e) {
            LOG.warn("Failed to release connection: {}", e.toString());
        }
    }
}
