package com.sealedstore.transfer;

/**
 * Result of one item in a batch. {@code remoteId} is set only when {@code stage} is
 * COMPLETE; {@code failureKind} and {@code error} only when it is FAILED.
 */
public record TransferOutcome(
        String itemId,
        String fileName,
        TransferStage stage,
        String remoteId,
        FailureKind failureKind,
        String error
) {

    static TransferOutcome completed(String itemId, String fileName, String remoteId) {
        return new TransferOutcome(itemId, fileName, TransferStage.COMPLETE, remoteId, null, null);
    }

    static TransferOutcome failed(String itemId, String fileName, FailureKind kind, String error) {
        return new TransferOutcome(itemId, fileName, TransferStage.FAILED, null, kind, error);
    }

    static TransferOutcome cancelled(String itemId, String fileName) {
        return new TransferOutcome(itemId, fileName, TransferStage.CANCELLED, null, null, null);
    }

    public boolean isSuccess() {
        return stage == TransferStage.COMPLETE;
    }
}
