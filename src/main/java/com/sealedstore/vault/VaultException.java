package com.sealedstore.vault;

import com.sealedstore.crypto.CryptoException;

/**
 * Base type for vault lookups the caller is expected to branch on.
 */
public abstract class VaultException extends CryptoException {

    private final String userId;

    protected VaultException(String userId, String message, Throwable cause) {
        super(message, cause);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
