package com.sealedstore.transfer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.unit.DataSize;

import com.sealedstore.config.TransferProperties;
import com.sealedstore.crypto.ChunkedBase64;
import com.sealedstore.crypto.DecryptionException;
import com.sealedstore.crypto.DecryptionStage;
import com.sealedstore.crypto.InvalidInputException;
import com.sealedstore.crypto.SymmetricKey;
import com.sealedstore.file.EncryptedFile;
import com.sealedstore.file.FileCipher;
import com.sealedstore.metadata.FileMetadataRecord;
import com.sealedstore.metadata.MetadataCipher;
import com.sealedstore.session.CryptoSession;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * End-to-end upload and download.
 *
 * Per file, in this order:
 *   upload:   validate → FileCipher.encrypt → metadata + filename encryption → transport
 *   download: transport → metadata decryption → FileCipher.decrypt
 *
 * Batches run strictly one item at a time in caller order. A failed item is reported
 * and the batch moves on; cancellation is checked before each item starts.
 */
@Service
public class TransferOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TransferOrchestrator.class);

    private final FileCipher fileCipher;
    private final MetadataCipher metadataCipher;
    private final FileTransport transport;
    private final TransferTracker tracker;
    private final TransferProperties properties;

    public TransferOrchestrator(FileCipher fileCipher,
                                MetadataCipher metadataCipher,
                                FileTransport transport,
                                TransferTracker tracker,
                                TransferProperties properties) {
        this.fileCipher = fileCipher;
        this.metadataCipher = metadataCipher;
        this.transport = transport;
        this.tracker = tracker;
        this.properties = properties;
    }

    // ── Upload ────────────────────────────────────────────────────────────────

    public Mono<TransferOutcome> upload(CryptoSession session, UploadRequest request) {
        return uploadAll(session, List.of(request), new TransferHandle()).single();
    }

    /**
     * Uploads {@code requests} sequentially. Every item is registered as PENDING up front;
     * items still pending when {@code handle} is cancelled end as CANCELLED.
     */
    public Flux<TransferOutcome> uploadAll(CryptoSession session, List<UploadRequest> requests, TransferHandle handle) {
        return Flux.defer(() -> {
            List<UploadRequest> batch = new ArrayList<>(requests);
            List<String> itemIds = new ArrayList<>(batch.size());
            for (UploadRequest request : batch) {
                itemIds.add(tracker.register(Objects.requireNonNull(request, "request").filename()));
            }
            Set<String> acceptedNames = new HashSet<>();
            log.info("Starting upload batch of {} item(s)", batch.size());

            return Flux.range(0, batch.size())
                    .concatMap(i -> Mono.defer(() -> {
                        String itemId = itemIds.get(i);
                        UploadRequest request = batch.get(i);
                        if (handle.isCancelled()) {
                            tracker.advance(itemId, TransferStage.CANCELLED, 0, "Cancelled");
                            return Mono.just(TransferOutcome.cancelled(itemId, request.filename()));
                        }
                        return uploadOne(session, itemId, request, acceptedNames);
                    }));
        });
    }

    private Mono<TransferOutcome> uploadOne(CryptoSession session, String itemId, UploadRequest request,
                                            Set<String> acceptedNames) {
        return Mono.fromCallable(() -> {
                    validate(request, acceptedNames);
                    SymmetricKey masterKey = session.masterKey();
                    tracker.advance(itemId, TransferStage.ENCRYPTING, 10, "Encrypting file...");
                    return masterKey;
                })
                .flatMap(masterKey -> encryptForUpload(itemId, request, masterKey))
                .flatMap(payload -> {
                    tracker.advance(itemId, TransferStage.UPLOADING, 60, "Uploading...");
                    return transport.upload(payload)
                            .switchIfEmpty(Mono.error(() -> new TransferFailedException(
                                    itemId, FailureKind.RETRYABLE, "Transport returned no file id", null)));
                })
                .map(remoteId -> {
                    tracker.advance(itemId, TransferStage.COMPLETE, 100, "Upload complete");
                    log.info("Uploaded item {} ({} bytes) as {}", itemId, request.bytes().length, remoteId);
                    return TransferOutcome.completed(itemId, request.filename(), remoteId);
                })
                .onErrorResume(error -> Mono.just(fail(itemId, request.filename(), error)));
    }

    private Mono<EncryptedUpload> encryptForUpload(String itemId, UploadRequest request, SymmetricKey masterKey) {
        return fileCipher.encrypt(masterKey, request.bytes())
                .flatMap(encrypted -> {
                    tracker.advance(itemId, TransferStage.ENCRYPTING, 50, "Encrypting metadata...");
                    FileMetadataRecord record = new FileMetadataRecord(
                            request.filename(),
                            request.bytes().length,
                            request.mimeType(),
                            ChunkedBase64.encode(encrypted.wrappedFileKey()),
                            ChunkedBase64.encode(encrypted.fileNonce()),
                            ChunkedBase64.encode(encrypted.keyWrapNonce()));
                    return Mono.zip(
                                    metadataCipher.encryptMetadata(record, masterKey),
                                    metadataCipher.encryptFilename(request.filename(), masterKey))
                            .map(blobs -> new EncryptedUpload(
                                    ChunkedBase64.encode(encrypted.ciphertext()), blobs.getT2(), blobs.getT1()));
                });
    }

    private void validate(UploadRequest request, Set<String> acceptedNames) {
        if (request.filename() == null || request.filename().isBlank()) {
            throw new InvalidInputException("Filename must not be blank");
        }
        if (request.bytes() == null) {
            throw new InvalidInputException("File content must not be null");
        }
        long limit = properties.maxFileSize().toBytes();
        if (request.bytes().length > limit) {
            throw new InvalidInputException("File too large. Maximum size is " + describe(properties.maxFileSize()));
        }
        if (request.mimeType() == null || !properties.isAllowed(request.mimeType())) {
            throw new InvalidInputException("File type not supported");
        }
        if (!acceptedNames.add(request.filename())) {
            throw new InvalidInputException("Duplicate file name in selection");
        }
    }

    private static String describe(DataSize size) {
        return size.toMegabytes() > 0 ? size.toMegabytes() + "MB" : size.toKilobytes() + "KB";
    }

    private TransferOutcome fail(String itemId, String fileName, Throwable error) {
        FailureKind kind = FailureKind.of(error);
        tracker.advance(itemId, TransferStage.FAILED, 0, error.getMessage());
        log.warn("Upload of item {} failed ({}): {}", itemId, kind, error.getClass().getSimpleName());
        return TransferOutcome.failed(itemId, fileName, kind, error.getMessage());
    }

    // ── Download ──────────────────────────────────────────────────────────────

    /**
     * Fetches and decrypts one file. Every failure surfaces as {@link TransferFailedException}
     * carrying the {@link FailureKind}; the underlying cause is kept.
     */
    public Mono<DownloadedFile> download(CryptoSession session, String fileId) {
        return Mono.defer(() -> {
            String itemId = tracker.register(fileId);
            return Mono.fromCallable(session::masterKey)
                    .flatMap(masterKey -> {
                        tracker.advance(itemId, TransferStage.DOWNLOADING, 10, "Downloading...");
                        return transport.download(fileId)
                                .switchIfEmpty(Mono.error(() -> new TransferFailedException(
                                        fileId, FailureKind.FATAL, "File not found: " + fileId, null)))
                                .flatMap(payload -> {
                                    tracker.advance(itemId, TransferStage.DECRYPTING, 50, "Decrypting...");
                                    return decryptDownload(masterKey, payload);
                                });
                    })
                    .doOnNext(file -> {
                        tracker.advance(itemId, TransferStage.COMPLETE, 100, "Download complete");
                        log.info("Downloaded file {} ({} bytes)", fileId, file.bytes().length);
                    })
                    .onErrorMap(error -> !(error instanceof TransferFailedException),
                            error -> new TransferFailedException(
                                    fileId, FailureKind.of(error), "Download failed: " + error.getMessage(), error))
                    .doOnError(error -> {
                        tracker.advance(itemId, TransferStage.FAILED, 0, error.getMessage());
                        log.warn("Download of file {} failed ({})", fileId, FailureKind.of(error));
                    });
        });
    }

    private Mono<DownloadedFile> decryptDownload(SymmetricKey masterKey, EncryptedUpload payload) {
        return metadataCipher.decryptMetadata(payload.encryptedMetadata(), masterKey)
                .flatMap(record -> {
                    if (!record.hasKeyMaterial()) {
                        return Mono.error(new DecryptionException(
                                DecryptionStage.METADATA, "Metadata does not carry a usable file key", null));
                    }
                    return Mono.fromCallable(() -> new EncryptedFile(
                                    ChunkedBase64.decode(payload.encryptedBody()),
                                    ChunkedBase64.decode(record.wrappedFileKey()),
                                    ChunkedBase64.decode(record.fileNonce()),
                                    ChunkedBase64.decode(record.keyWrapNonce())))
                            .flatMap(encrypted -> fileCipher.decrypt(masterKey, encrypted))
                            .map(plain -> new DownloadedFile(plain, record.filename(), record.mimeType()));
                });
    }

    // ── Key rotation ──────────────────────────────────────────────────────────

    /**
     * Re-encrypts a metadata blob for a new Master Key, re-wrapping the File Key inside it.
     * The stored file body stays valid because neither the File Key nor its nonce changes.
     */
    public Mono<String> rewrapMetadata(CryptoSession oldSession, CryptoSession newSession, String encryptedMetadata) {
        return Mono.defer(() -> {
            SymmetricKey oldKey = oldSession.masterKey();
            SymmetricKey newKey = newSession.masterKey();
            return metadataCipher.decryptMetadataDetailed(encryptedMetadata, oldKey)
                    .flatMap(result -> {
                        FileMetadataRecord record = result.record();
                        if (result.isFallback() || !record.hasKeyMaterial()) {
                            return Mono.error(new DecryptionException(DecryptionStage.METADATA,
                                    "Metadata cannot be read under the current key", null));
                        }
                        return Mono.fromCallable(() -> new byte[][] {
                                        ChunkedBase64.decode(record.wrappedFileKey()),
                                        ChunkedBase64.decode(record.keyWrapNonce())})
                                .flatMap(parts -> fileCipher.rewrapFileKey(oldKey, newKey, parts[0], parts[1]))
                                .map(rewrapped -> new FileMetadataRecord(
                                        record.filename(),
                                        record.size(),
                                        record.mimeType(),
                                        ChunkedBase64.encode(rewrapped.wrappedKey()),
                                        record.fileNonce(),
                                        ChunkedBase64.encode(rewrapped.keyWrapNonce())))
                                .flatMap(updated -> metadataCipher.encryptMetadata(updated, newKey));
                    });
        });
    }
}
