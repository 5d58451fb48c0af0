package com.sealedstore.transfer;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-item progress states.
 *
 * Upload:   PENDING → ENCRYPTING → UPLOADING → COMPLETE | FAILED
 * Download: PENDING → DOWNLOADING → DECRYPTING → COMPLETE | FAILED
 * Abandoned items go PENDING → CANCELLED.
 */
public enum TransferStage {
    PENDING,
    ENCRYPTING,
    UPLOADING,
    DOWNLOADING,
    DECRYPTING,
    COMPLETE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == CANCELLED;
    }

    public boolean canAdvanceTo(TransferStage next) {
        return successors().contains(next);
    }

    private Set<TransferStage> successors() {
        switch (this) {
            case PENDING:
                return EnumSet.of(ENCRYPTING, DOWNLOADING, FAILED, CANCELLED);
            case ENCRYPTING:
                return EnumSet.of(ENCRYPTING, UPLOADING, FAILED);
            case UPLOADING:
                return EnumSet.of(COMPLETE, FAILED);
            case DOWNLOADING:
                return EnumSet.of(DECRYPTING, FAILED);
            case DECRYPTING:
                return EnumSet.of(COMPLETE, FAILED);
            default:
                return EnumSet.noneOf(TransferStage.class);
        }
    }
}
