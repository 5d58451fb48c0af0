package com.sealedstore.session;

import com.sealedstore.crypto.SymmetricKey;

/**
 * The Master Key of one signed-in user, passed explicitly to every operation that
 * needs it. Created at login or vault unlock; {@link #close()} at logout wipes the key.
 */
public final class CryptoSession implements AutoCloseable {

    private final String userId;
    private final SymmetricKey masterKey;

    public CryptoSession(String userId, SymmetricKey masterKey) {
        this.userId = userId;
        this.masterKey = masterKey;
    }

    public String userId() {
        return userId;
    }

    public SymmetricKey masterKey() {
        if (masterKey.isDestroyed()) {
            throw new IllegalStateException("Session for " + userId + " is closed");
        }
        return masterKey;
    }

    public boolean isOpen() {
        return !masterKey.isDestroyed();
    }

    @Override
    public void close() {
        masterKey.destroy();
    }

    @Override
    public String toString() {
        return "CryptoSession[" + userId + (isOpen() ? "" : ", closed") + "]";
    }
}
