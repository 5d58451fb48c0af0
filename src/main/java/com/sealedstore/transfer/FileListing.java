package com.sealedstore.transfer;

/**
 * Display row for one stored file. {@code readable} is false when the metadata could not
 * be decrypted and the name and type are placeholders.
 */
public record FileListing(String fileId, String filename, String mimeType, long size, boolean readable) {
}
