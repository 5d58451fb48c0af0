package com.sealedstore.transfer;

import reactor.core.publisher.Mono;

/**
 * Moves opaque encrypted values to and from the server. Supplied by the caller;
 * nothing here knows about HTTP, pagination or auth tokens.
 */
public interface FileTransport {

    /** @return the server-assigned file id */
    Mono<String> upload(EncryptedUpload upload);

    /** Empty when the server has no such file. */
    Mono<EncryptedUpload> download(String fileId);
}
