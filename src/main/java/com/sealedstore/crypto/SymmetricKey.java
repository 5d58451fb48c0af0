package com.sealedstore.crypto;

import java.security.MessageDigest;
import java.util.Arrays;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import javax.security.auth.Destroyable;

/**
 * Opaque handle over a 256-bit AES key (Master Key, File Key or vault storage key).
 *
 * The backing array is private and zeroed by {@link #destroy()}. Raw bytes only leave
 * the handle through {@link #exportBytes()}, which returns a copy the caller must wipe.
 * {@code toString()} never prints key material.
 */
public final class SymmetricKey implements Destroyable, AutoCloseable {

    public static final int LENGTH = 32;

    private final byte[] key;
    // fixed at construction so the hash survives destroy()
    private final int hash;
    private volatile boolean destroyed;

    private SymmetricKey(byte[] key) {
        this.key = key;
        this.hash = Arrays.hashCode(key);
    }

    /**
     * Imports a key from raw bytes. The input is copied; the caller keeps ownership
     * of (and should wipe) its own array.
     */
    public static SymmetricKey fromBytes(byte[] raw) {
        if (raw == null || raw.length != LENGTH) {
            throw new InvalidInputException("Key must be exactly " + LENGTH + " bytes");
        }
        return new SymmetricKey(raw.clone());
    }

    /** Takes ownership of {@code raw} without copying; used for freshly derived keys. */
    static SymmetricKey adopt(byte[] raw) {
        if (raw.length != LENGTH) {
            throw new InvalidInputException("Key must be exactly " + LENGTH + " bytes");
        }
        return new SymmetricKey(raw);
    }

    public static SymmetricKey random() {
        return adopt(RandomBytes.bytes(LENGTH));
    }

    public byte[] exportBytes() {
        checkNotDestroyed();
        return key.clone();
    }

    /** JCA view of this key for a single cipher operation. */
    SecretKey toSecretKey() {
        checkNotDestroyed();
        return new SecretKeySpec(key, "AES");
    }

    @Override
    public void destroy() {
        Arrays.fill(key, (byte) 0);
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("Key has been destroyed");
        }
    }

    /** A destroyed key only equals itself. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        SymmetricKey other = (SymmetricKey) o;
        if (destroyed || other.destroyed) return false;
        return MessageDigest.isEqual(key, other.key);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return destroyed ? "SymmetricKey[destroyed]" : "SymmetricKey[256-bit]";
    }
}
