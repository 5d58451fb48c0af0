package com.sealedstore.transfer;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for a batch. Checked between items only; the item in
 * flight when {@link #cancel()} is called still runs to completion.
 */
public class TransferHandle {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
