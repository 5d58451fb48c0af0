package com.sealedstore.vault;

/**
 * No vault entry for the user. The caller should fall back to deriving the Master Key
 * from the password.
 */
public class VaultEntryNotFoundException extends VaultException {

    public VaultEntryNotFoundException(String userId) {
        super(userId, "No stored key for user: " + userId, null);
    }
}
