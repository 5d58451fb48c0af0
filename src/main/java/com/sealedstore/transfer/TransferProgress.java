package com.sealedstore.transfer;

public record TransferProgress(String itemId, String fileName, TransferStage stage, int percent, String message) {
}
