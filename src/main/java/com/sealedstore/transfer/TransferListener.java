package com.sealedstore.transfer;

@FunctionalInterface
public interface TransferListener {

    void onProgress(TransferProgress progress);
}
