package com.sealedstore.transfer;

/**
 * A file as the server lists it: its id and the three opaque values stored for it.
 */
public record StoredFile(String fileId, EncryptedUpload upload) {
}
