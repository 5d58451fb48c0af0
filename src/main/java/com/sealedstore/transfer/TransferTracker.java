package com.sealedstore.transfer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Live progress of every upload and download, keyed by item id.
 * Illegal stage transitions are rejected; listeners see every accepted one.
 *
 * Finished items stay queryable until {@link #clearFinished()} or until more than
 * {@code retainFinished} items have finished, at which point the oldest are evicted.
 */
@Component
public class TransferTracker {

    private static final Logger log = LoggerFactory.getLogger(TransferTracker.class);

    public static final int DEFAULT_RETAIN_FINISHED = 1000;

    private final ConcurrentHashMap<String, TransferProgress> items = new ConcurrentHashMap<>();
    private final List<TransferListener> listeners = new CopyOnWriteArrayList<>();
    private final ConcurrentLinkedQueue<String> finishedOrder = new ConcurrentLinkedQueue<>();
    private final int retainFinished;

    public TransferTracker() {
        this(DEFAULT_RETAIN_FINISHED);
    }

    TransferTracker(int retainFinished) {
        this.retainFinished = retainFinished;
    }

    public String register(String fileName) {
        String itemId = UUID.randomUUID().toString();
        TransferProgress pending = new TransferProgress(itemId, fileName, TransferStage.PENDING, 0, "Waiting");
        items.put(itemId, pending);
        publish(pending);
        return itemId;
    }

    public TransferProgress advance(String itemId, TransferStage stage, int percent, String message) {
        TransferProgress updated = items.compute(itemId, (id, current) -> {
            if (current == null) {
                throw new IllegalArgumentException("Unknown transfer item: " + id);
            }
            if (!current.stage().canAdvanceTo(stage)) {
                throw new IllegalStateException(
                        "Transfer " + id + " cannot move from " + current.stage() + " to " + stage);
            }
            return new TransferProgress(id, current.fileName(), stage, percent, message);
        });
        log.debug("Transfer {} -> {} ({}%)", itemId, stage, percent);
        publish(updated);
        if (stage.isTerminal()) {
            finishedOrder.add(itemId);
            evictOverflow();
        }
        return updated;
    }

    public Optional<TransferProgress> get(String itemId) {
        return Optional.ofNullable(items.get(itemId));
    }

    public List<TransferProgress> snapshot() {
        return new ArrayList<>(items.values());
    }

    /** Drops COMPLETE, FAILED and CANCELLED items. */
    public void clearFinished() {
        items.values().removeIf(progress -> progress.stage().isTerminal());
        finishedOrder.clear();
    }

    public void addListener(TransferListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TransferListener listener) {
        listeners.remove(listener);
    }

    private void evictOverflow() {
        while (finishedOrder.size() > retainFinished) {
            String oldest = finishedOrder.poll();
            if (oldest == null) {
                return;
            }
            items.remove(oldest);
        }
    }

    private void publish(TransferProgress progress) {
        for (TransferListener listener : listeners) {
            try {
                listener.onProgress(progress);
            } catch (RuntimeException e) {
                // a broken listener must not fail the transfer itself
                log.warn("Transfer listener threw on {}: {}", progress.stage(), e.toString());
            }
        }
    }
}
