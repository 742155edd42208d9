package org.javai.resilience.datastore;

import java.util.concurrent.CompletionStage;

/**
 * Work that runs inside one transaction. It may run again after a rollback,
 * so it must not keep state between runs.
 *
 * @param <T> The type of value produced
 */
@FunctionalInterface
public interface TransactionWork<T> {

    CompletionStage<T> apply(DataStoreConnection transaction) throws Exception;
}
