package com.casekeep.analysis.client;

import reactor.core.Disposable;

/**
 * Handle on a consumed stream. Cancelling stops reading and silences the listener; it does not
 * stop the run on the server. Once {@link #cancel()} returns no listener callback is running or
 * will start.
 */
public final class PipelineSubscription {

    private final Object gate = new Object();
    private boolean cancelled;
    private volatile Disposable disposable;

    PipelineSubscription() {
    }

    void attach(Disposable disposable) {
        this.disposable = disposable;
        if (isCancelled()) {
            disposable.dispose();
        }
    }

    boolean deliver(Runnable callback) {
        synchronized (gate) {
            if (cancelled) {
                return false;
            }
            callback.run();
            return true;
        }
    }

    public void cancel() {
        synchronized (gate) {
            if (cancelled) {
                return;
            }
            cancelled = true;
        }
        Disposable current = disposable;
        if (current != null) {
            current.dispose();
        }
    }

    public boolean isCancelled() {
        synchronized (gate) {
            return cancelled;
        }
    }

    public boolean isDone() {
        Disposable current = disposable;
        return isCancelled() || (current != null && current.isDisposed());
    }
}
