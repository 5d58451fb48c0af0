package com.sealedstore.crypto;

/**
 * Root of the unchecked exceptions raised by the encryption core.
 */
public class CryptoException extends RuntimeException {

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
