package me.go_gradually.voicerelay.application.synthesis.model;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class CancellationSignal {
    private static final Logger log = Logger.getLogger(CancellationSignal.class.getName());

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Callback> callbacks = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Callback callback : callbacks) {
            callback.run();
        }
        callbacks.clear();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Runs the callback on cancel, or immediately when already cancelled. The returned handle unregisters it.
     */
    public Runnable onCancel(Runnable action) {
        Callback callback = new Callback(action);
        callbacks.add(callback);
        if (cancelled.get()) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    private static final class Callback {
        private final Runnable action;
        private final AtomicBoolean done = new AtomicBoolean(false);

        private Callback(Runnable action) {
            this.action = action;
        }

        private void run() {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            try {
                action.run();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "relay.cancel callback failure", e);
            }
        }
    }
}
