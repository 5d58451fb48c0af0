package com.sealedstore.metadata;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Plaintext file metadata, serialized to JSON and encrypted as one blob under the
 * Master Key. The three key-material fields are Base64 and are absent on the
 * fallback record.
 *
 * Older clients wrote the same fields as {@code encryptedKey}, {@code iv} and
 * {@code salt} (the last one actually held the key-wrap nonce); those names are
 * still accepted when reading.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileMetadataRecord(
        String filename,
        long size,
        String mimeType,
        @JsonAlias("encryptedKey") String wrappedFileKey,
        @JsonAlias("iv") String fileNonce,
        @JsonAlias("salt") String keyWrapNonce
) {

    public static final String FALLBACK_FILENAME = "Unknown File";
    public static final String FALLBACK_MIME_TYPE = "application/octet-stream";

    private static final FileMetadataRecord FALLBACK =
            new FileMetadataRecord(FALLBACK_FILENAME, 0, FALLBACK_MIME_TYPE, null, null, null);

    /** Record returned for legacy or unreadable metadata. */
    public static FileMetadataRecord fallback() {
        return FALLBACK;
    }

    @JsonIgnore
    public boolean hasKeyMaterial() {
        return wrappedFileKey != null && fileNonce != null && keyWrapNonce != null;
    }
}
