package com.sealedstore.vault;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * At-rest form of a user's Master Key.
 * Holds ONLY what is needed to re-derive the wrapping key from a secret supplied again
 * at retrieval time. Neither the password nor the session secret is ever written here.
 */
@Table("vault_entries")
public class VaultEntry {

    @PrimaryKey("user_id")
    public String userId;

    /** PBKDF2 salt (Base64) for the storage key. Fresh on every store. */
    @Column("storage_salt")
    public String storageSalt;

    /** AES-GCM nonce (Base64) used to wrap the Master Key. */
    @Column("nonce")
    public String nonce;

    /** Master Key wrapped under the storage key, ciphertext plus tag (Base64). */
    @Column("wrapped_master_key")
    public String wrappedMasterKey;

    @Column("created_at")
    public long createdAt;
}
