package com.sealedstore.crypto;

/**
 * AEAD tag mismatch: wrong key or tampered ciphertext. No plaintext, partial or
 * otherwise, is ever returned alongside this exception.
 */
public class DecryptionException extends CryptoException {

    private final DecryptionStage stage;

    public DecryptionException(DecryptionStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public DecryptionStage getStage() {
        return stage;
    }

    /**
     * Same failure, re-attributed to the stage of the calling workflow.
     */
    public DecryptionException atStage(DecryptionStage newStage) {
        return new DecryptionException(newStage, getMessage(), getCause());
    }
}
