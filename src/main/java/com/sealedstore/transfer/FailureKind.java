package com.sealedstore.transfer;

import com.sealedstore.crypto.DecryptionException;
import com.sealedstore.crypto.InvalidInputException;

/**
 * What the caller can do about a failed item.
 */
public enum FailureKind {

    /** Transport or storage trouble; the same item may succeed on another attempt. */
    RETRYABLE,

    /** Bad input, wrong key, tampered data or a closed session; retrying cannot help. */
    FATAL;

    public static FailureKind of(Throwable error) {
        if (error instanceof TransferFailedException) {
            return ((TransferFailedException) error).getKind();
        }
        if (error instanceof InvalidInputException
                || error instanceof DecryptionException
                || error instanceof IllegalStateException) {
            return FATAL;
        }
        return RETRYABLE;
    }
}
