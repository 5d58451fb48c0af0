package com.sealedstore.transfer;

/**
 * Plaintext ready for a file-save action.
 */
public record DownloadedFile(byte[] bytes, String filename, String mimeType) {
}
