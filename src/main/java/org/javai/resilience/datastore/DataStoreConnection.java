package org.javai.resilience.datastore;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * One borrowed connection. Statements use positional parameters.
 */
public interface DataStoreConnection {

    /**
     * Runs a statement that returns rows, each row keyed by column label.
     */
    CompletionStage<List<Map<String, Object>>> query(String statement, List<?> params);

    /**
     * Runs a statement that changes data and returns the affected row count.
     */
    CompletionStage<Integer> update(String statement, List<?> params);

    CompletionStage<Void> begin();

    CompletionStage<Void> commit();

    CompletionStage<Void> rollback();
}
