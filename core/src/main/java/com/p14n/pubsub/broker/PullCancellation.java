package com.p14n.pubsub.broker;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation signal for a waiting pull. Cancelling runs the
 * registered callbacks, which wake the waiter so it can observe the flag.
 */
public class PullCancellation {
    private static final Logger logger = LoggerFactory.getLogger(PullCancellation.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public static PullCancellation none() {
        return new PullCancellation();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (cancelled.getAndSet(true)) {
            return;
        }
        for (var callback : callbacks) {
            run(callback);
        }
    }

    /**
     * Registers a callback to run on cancellation. Runs it straight away when
     * the signal is already cancelled.
     *
     * @param callback The callback to run
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            run(callback);
        }
    }

    private void run(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            logger.atWarn().setCause(e).log("Cancellation callback failed");
        }
    }
}
