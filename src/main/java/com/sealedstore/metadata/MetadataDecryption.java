package com.sealedstore.metadata;

import java.util.Optional;

/**
 * Decrypted record plus, when the fallback was substituted, the reason why.
 */
public record MetadataDecryption(FileMetadataRecord record, Optional<MetadataFailure> failure) {

    static MetadataDecryption success(FileMetadataRecord record) {
        return new MetadataDecryption(record, Optional.empty());
    }

    static MetadataDecryption fallback(MetadataFailure failure) {
        return new MetadataDecryption(FileMetadataRecord.fallback(), Optional.of(failure));
    }

    public boolean isFallback() {
        return failure.isPresent();
    }
}
