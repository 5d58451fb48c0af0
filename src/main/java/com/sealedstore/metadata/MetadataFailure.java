package com.sealedstore.metadata;

/**
 * Internal reason a metadata blob degraded to the fallback record. Not exposed
 * through {@link MetadataCipher#decryptMetadata}; callers there only see the fallback.
 */
public enum MetadataFailure {
    MALFORMED_ENCODING,
    TRUNCATED,
    AUTHENTICATION,
    MALFORMED_RECORD
}
