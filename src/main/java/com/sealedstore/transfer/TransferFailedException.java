package com.sealedstore.transfer;

import com.sealedstore.crypto.CryptoException;

public class TransferFailedException extends CryptoException {

    private final String fileId;
    private final FailureKind kind;

    public TransferFailedException(String fileId, FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.fileId = fileId;
        this.kind = kind;
    }

    public String getFileId() {
        return fileId;
    }

    public FailureKind getKind() {
        return kind;
    }
}
