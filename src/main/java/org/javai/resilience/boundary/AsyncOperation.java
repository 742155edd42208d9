package org.javai.resilience.boundary;

import java.util.concurrent.CompletionStage;

/**
 * A fallible asynchronous unit of work.
 *
 * <p>Throwing from {@link #execute()} is treated exactly like returning a stage
 * that completes exceptionally.
 *
 * @param <T> The type of value produced
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    CompletionStage<T> execute() throws Exception;
}
