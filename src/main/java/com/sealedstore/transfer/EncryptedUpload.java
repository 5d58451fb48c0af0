package com.sealedstore.transfer;

/**
 * The three values the server stores per file, all Base64 text.
 */
public record EncryptedUpload(String encryptedBody, String encryptedFilename, String encryptedMetadata) {
}
