package com.sealedstore.crypto;

/**
 * Where an authenticated decryption failed. Callers see one "cannot decrypt"
 * exception type; the stage is kept for diagnostics.
 */
public enum DecryptionStage {
    /** File Key unwrap under the Master Key (wrong or stale Master Key). */
    KEY_UNWRAP,
    /** File body under the File Key (corrupted transport or storage). */
    FILE_BODY,
    METADATA,
    VALUE,
    VAULT
}
