package com.sealedstore.vault;

/**
 * The entry exists but the supplied secret does not unwrap it. The caller should
 * prompt for the correct password.
 */
public class WrongVaultSecretException extends VaultException {

    public WrongVaultSecretException(String userId, Throwable cause) {
        super(userId, "Wrong password for stored key of user: " + userId, cause);
    }
}
