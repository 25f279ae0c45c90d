package com.cartmate.backend.agent;

import com.cartmate.backend.domain.model.A2aMessage;
import reactor.core.Disposable;

/**
 * Outstanding ack-requiring message owned by the sending agent: the message, the number of
 * resends made after ack timeouts, and the armed timeout.
 *
 * <p>Once {@link #complete()} has run, any timer armed afterwards is disposed immediately,
 * so an acknowledgment that races a hand-off can never leave a live timer behind.
 */
public class PendingDelivery {

    private final A2aMessage message;
    private int retryCount;
    private Disposable timer;
    private boolean completed;

    public PendingDelivery(A2aMessage message) {
        this.message = message;
    }

    public A2aMessage getMessage() {
        return message;
    }

    public synchronized int getRetryCount() {
        return retryCount;
    }

    public synchronized int incrementRetryCount() {
        return ++retryCount;
    }

    public synchronized boolean isCompleted() {
        return completed;
    }

    public synchronized boolean hasActiveTimer() {
        return timer != null && !timer.isDisposed();
    }

    /**
     * Replaces the current timeout. Ignored (and disposed) when already completed.
     */
    public void armTimer(Disposable newTimer) {
        Disposable previous;
        synchronized (this) {
            if (completed) {
                previous = newTimer;
            } else {
                previous = timer;
                timer = newTimer;
            }
        }
        if (previous != null) {
            previous.dispose();
        }
    }

    /**
     * Marks the delivery finished and cancels its timeout.
     */
    public void complete() {
        Disposable current;
        synchronized (this) {
            completed = true;
            current = timer;
            timer = null;
        }
        if (current != null) {
            current.dispose();
        }
    }
}
