package com.sealedstore.crypto;

/**
 * Raised before any cryptographic call when an input is malformed:
 * undecodable Base64, a nonce/salt/key of the wrong length, or a file
 * that fails upload validation. Never silently coerced.
 */
public class InvalidInputException extends CryptoException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
