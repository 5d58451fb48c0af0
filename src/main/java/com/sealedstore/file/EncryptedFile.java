package com.sealedstore.file;

/**
 * Output of {@link FileCipher#encrypt}: the encrypted body plus everything needed
 * to recover its File Key from the Master Key.
 *
 * fileNonce:    AES-GCM nonce of the body under the File Key.
 * keyWrapNonce: AES-GCM nonce of the File Key under the Master Key.
 *               The two nonces are unrelated values; never swap them.
 */
public record EncryptedFile(
        byte[] ciphertext,
        byte[] wrappedFileKey,
        byte[] fileNonce,
        byte[] keyWrapNonce
) {}
