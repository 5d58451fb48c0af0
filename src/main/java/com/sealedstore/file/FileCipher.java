package com.sealedstore.file;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sealedstore.crypto.AeadCipher;
import com.sealedstore.crypto.DecryptionException;
import com.sealedstore.crypto.DecryptionStage;
import com.sealedstore.crypto.RandomBytes;
import com.sealedstore.crypto.SymmetricKey;

import reactor.core.publisher.Mono;

/**
 * Per-file envelope encryption.
 *
 * Upload:   FileKey = random 256 bit
 *           body    = AES-GCM(FileKey, fileNonce, plaintext)
 *           wrapped = AES-GCM(MasterKey, keyWrapNonce, FileKey)
 * Download: FileKey = AES-GCM⁻¹(MasterKey, keyWrapNonce, wrapped)
 *           plain   = AES-GCM⁻¹(FileKey, fileNonce, body)
 *
 * Wrapping is a separate AEAD operation from the body, so a Master Key rotation
 * only re-wraps 48 bytes instead of re-encrypting the file.
 */
@Service
public class FileCipher {

    private static final Logger log = LoggerFactory.getLogger(FileCipher.class);

    private final AeadCipher aead;

    public FileCipher(AeadCipher aead) {
        this.aead = aead;
    }

    public Mono<EncryptedFile> encrypt(SymmetricKey masterKey, byte[] plaintext) {
        return Mono.using(
                SymmetricKey::random,
                fileKey -> {
                    byte[] fileNonce = RandomBytes.nonce();
                    return aead.encrypt(fileKey, fileNonce, plaintext)
                            .flatMap(ciphertext -> wrap(masterKey, fileKey)
                                    .map(wrapped -> new EncryptedFile(
                                            ciphertext, wrapped.wrappedKey(), fileNonce, wrapped.keyWrapNonce())));
                },
                SymmetricKey::destroy)
                .doOnNext(encrypted -> log.debug("Encrypted file body of {} bytes", plaintext.length));
    }

    public Mono<byte[]> decrypt(SymmetricKey masterKey, EncryptedFile file) {
        return unwrap(masterKey, file.wrappedFileKey(), file.keyWrapNonce())
                .flatMap(fileKey -> aead.decrypt(fileKey, file.fileNonce(), file.ciphertext())
                        .onErrorMap(DecryptionException.class, e -> e.atStage(DecryptionStage.FILE_BODY))
                        .doFinally(signal -> fileKey.destroy()))
                .doOnError(DecryptionException.class,
                        e -> log.warn("File decryption failed at stage {}", e.getStage()));
    }

    /**
     * Moves a File Key from one Master Key to another with a fresh wrap nonce.
     * The file body and its nonce are unaffected.
     */
    public Mono<WrappedFileKey> rewrapFileKey(SymmetricKey oldMasterKey, SymmetricKey newMasterKey,
                                              byte[] wrappedKey, byte[] keyWrapNonce) {
        return unwrap(oldMasterKey, wrappedKey, keyWrapNonce)
                .flatMap(fileKey -> wrap(newMasterKey, fileKey)
                        .doFinally(signal -> fileKey.destroy()));
    }

    private Mono<WrappedFileKey> wrap(SymmetricKey masterKey, SymmetricKey fileKey) {
        byte[] keyWrapNonce = RandomBytes.nonce();
        return Mono.using(
                fileKey::exportBytes,
                raw -> aead.encrypt(masterKey, keyWrapNonce, raw)
                        .map(wrapped -> new WrappedFileKey(wrapped, keyWrapNonce)),
                raw -> Arrays.fill(raw, (byte) 0));
    }

    private Mono<SymmetricKey> unwrap(SymmetricKey masterKey, byte[] wrappedKey, byte[] keyWrapNonce) {
        return aead.decrypt(masterKey, keyWrapNonce, wrappedKey)
                .onErrorMap(DecryptionException.class, e -> e.atStage(DecryptionStage.KEY_UNWRAP))
                .map(raw -> {
                    try {
                        return SymmetricKey.fromBytes(raw);
                    } finally {
                        Arrays.fill(raw, (byte) 0);
                    }
                });
    }
}
