package com.blockflow.blockflow_engine.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag shared by a run and whoever may cancel it. Listeners registered after
 * cancellation run immediately.
 */
@Slf4j
public class RunCancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /** @return true if this call cancelled the token, false if it was already cancelled */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener failed: {}", e.getMessage(), e);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }
}
