package com.tyron.ghostj.api.concurrent;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Source for a {@link CancellationToken}.
 */
public final class CancellationTokenSource {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    private final CancellationToken token = new CancellationToken() {
        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }

        @Override
        public void onCancel(Runnable callback) {
            Objects.requireNonNull(callback, "callback");
            callbacks.add(callback);
            // cancel() may have run between the check and the add
            if (cancelled.get() && callbacks.remove(callback)) {
                callback.run();
            }
        }
    };

    public CancellationToken token() {
        return token;
    }

    /**
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                callback.run();
            }
        }
        return true;
    }

    public static CancellationTokenSource cancelled() {
        CancellationTokenSource s = new CancellationTokenSource();
        s.cancel();
        return s;
    }
}
