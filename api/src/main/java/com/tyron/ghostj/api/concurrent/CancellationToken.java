package com.tyron.ghostj.api.concurrent;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation token handed to completion fetches.
 *
 * Fetchers either poll {@link #isCancelled()} or register a callback with {@link #onCancel(Runnable)}
 * to abort a request in flight.
 */
public interface CancellationToken {

    boolean isCancelled();

    /**
     * Runs {@code callback} once when the token is cancelled, immediately if it already is.
     */
    void onCancel(Runnable callback);

    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException();
        }
    }
}
