package org.javai.resilience.datastore;

import java.util.concurrent.CompletionStage;

/**
 * Supplies live data-store connections. Implemented outside this library.
 */
public interface ConnectionPool {

    /**
     * Borrows a connection. The stage fails if none can be obtained.
     */
    CompletionStage<DataStoreConnection> acquire();

    /**
     * Returns a borrowed connection. Called exactly once per successful {@link #acquire()}.
     */
    void release(DataStoreConnection connection);
}
