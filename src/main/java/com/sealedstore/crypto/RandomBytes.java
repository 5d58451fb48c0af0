package com.sealedstore.crypto;

import java.security.SecureRandom;

/**
 * Cryptographically secure random values for keys, salts and AEAD nonces.
 */
public final class RandomBytes {

    private static final SecureRandom RANDOM = new SecureRandom();

    private RandomBytes() {
    }

    public static byte[] bytes(int length) {
        byte[] out = new byte[length];
        RANDOM.nextBytes(out);
        return out;
    }

    /** A fresh 96-bit AES-GCM nonce. Never reuse one with the same key. */
    public static byte[] nonce() {
        return bytes(AeadCipher.NONCE_LENGTH);
    }
}
