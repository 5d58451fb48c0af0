package com.sealedstore.metadata;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sealedstore.crypto.AeadCipher;
import com.sealedstore.crypto.ChunkedBase64;
import com.sealedstore.crypto.CryptoException;
import com.sealedstore.crypto.DecryptionException;
import com.sealedstore.crypto.DecryptionStage;
import com.sealedstore.crypto.InvalidInputException;
import com.sealedstore.crypto.RandomBytes;
import com.sealedstore.crypto.SymmetricKey;

import reactor.core.publisher.Mono;

/**
 * Encrypts file metadata and bare strings under the Master Key.
 *
 * Blob layout (both kinds): Base64( nonce[12] || AES-GCM ciphertext || tag[16] ).
 *
 * <p><strong>Fallback contract:</strong> {@link #decryptMetadata} never fails. Any blob that
 * cannot be decoded, authenticated or parsed yields {@link FileMetadataRecord#fallback()}, so
 * records written before the current format still list. Genuine corruption looks the same to
 * the caller; the reason is only logged and available via {@link #decryptMetadataDetailed}.
 * {@link #decryptValue} has no such fallback and fails closed.
 */
@Service
public class MetadataCipher {

    private static final Logger log = LoggerFactory.getLogger(MetadataCipher.class);

    private static final int MIN_BLOB_LENGTH = AeadCipher.NONCE_LENGTH + AeadCipher.TAG_LENGTH;

    private final AeadCipher aead;
    private final ObjectMapper objectMapper;

    public MetadataCipher(AeadCipher aead, ObjectMapper objectMapper) {
        this.aead = aead;
        this.objectMapper = objectMapper;
    }

    // ── Metadata record ───────────────────────────────────────────────────────

    public Mono<String> encryptMetadata(FileMetadataRecord record, SymmetricKey masterKey) {
        return Mono.fromCallable(() -> serialize(record))
                .flatMap(json -> seal(masterKey, json));
    }

    public Mono<FileMetadataRecord> decryptMetadata(String blob, SymmetricKey masterKey) {
        return decryptMetadataDetailed(blob, masterKey).map(MetadataDecryption::record);
    }

    public Mono<MetadataDecryption> decryptMetadataDetailed(String blob, SymmetricKey masterKey) {
        return Mono.defer(() -> {
            byte[] combined;
            try {
                combined = ChunkedBase64.decode(blob);
            } catch (InvalidInputException e) {
                return Mono.just(MetadataDecryption.fallback(MetadataFailure.MALFORMED_ENCODING));
            }
            if (combined.length < MIN_BLOB_LENGTH) {
                return Mono.just(MetadataDecryption.fallback(MetadataFailure.TRUNCATED));
            }
            return aead.decrypt(masterKey, nonceOf(combined), ciphertextOf(combined))
                    .map(this::parse)
                    .onErrorResume(DecryptionException.class,
                            e -> Mono.just(MetadataDecryption.fallback(MetadataFailure.AUTHENTICATION)));
        }).doOnNext(result -> result.failure().ifPresent(
                failure -> log.warn("Metadata unreadable ({}), using fallback record", failure)));
    }

    // ── Bare strings ──────────────────────────────────────────────────────────

    public Mono<String> encryptFilename(String filename, SymmetricKey masterKey) {
        return encryptValue(filename, masterKey);
    }

    public Mono<String> decryptFilename(String blob, SymmetricKey masterKey) {
        return decryptValue(blob, masterKey);
    }

    public Mono<String> encryptValue(String value, SymmetricKey masterKey) {
        if (value == null) {
            return Mono.error(new InvalidInputException("Value must not be null"));
        }
        return seal(masterKey, value.getBytes(StandardCharsets.UTF_8));
    }

    public Mono<String> decryptValue(String blob, SymmetricKey masterKey) {
        return Mono.fromCallable(() -> {
                    byte[] combined = ChunkedBase64.decode(blob);
                    if (combined.length < MIN_BLOB_LENGTH) {
                        throw new InvalidInputException("Encrypted value is too short to hold a nonce and tag");
                    }
                    return combined;
                })
                .flatMap(combined -> aead.decrypt(masterKey, nonceOf(combined), ciphertextOf(combined)))
                .map(plain -> new String(plain, StandardCharsets.UTF_8))
                .onErrorMap(DecryptionException.class, e -> e.atStage(DecryptionStage.VALUE));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Mono<String> seal(SymmetricKey masterKey, byte[] plaintext) {
        byte[] nonce = RandomBytes.nonce();
        return aead.encrypt(masterKey, nonce, plaintext)
                .map(ciphertext -> {
                    byte[] combined = new byte[nonce.length + ciphertext.length];
                    System.arraycopy(nonce, 0, combined, 0, nonce.length);
                    System.arraycopy(ciphertext, 0, combined, nonce.length, ciphertext.length);
                    return ChunkedBase64.encode(combined);
                });
    }

    private byte[] serialize(FileMetadataRecord record) {
        if (record == null) {
            throw new InvalidInputException("Metadata record must not be null");
        }
        try {
            return objectMapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new CryptoException("Could not serialize metadata record", e);
        }
    }

    private MetadataDecryption parse(byte[] json) {
        try {
            FileMetadataRecord record = objectMapper.readValue(json, FileMetadataRecord.class);
            if (record == null || record.filename() == null || record.mimeType() == null) {
                return MetadataDecryption.fallback(MetadataFailure.MALFORMED_RECORD);
            }
            return MetadataDecryption.success(record);
        } catch (IOException e) {
            return MetadataDecryption.fallback(MetadataFailure.MALFORMED_RECORD);
        } finally {
            Arrays.fill(json, (byte) 0);
        }
    }

    private static byte[] nonceOf(byte[] combined) {
        return Arrays.copyOfRange(combined, 0, AeadCipher.NONCE_LENGTH);
    }

    private static byte[] ciphertextOf(byte[] combined) {
        return Arrays.copyOfRange(combined, AeadCipher.NONCE_LENGTH, combined.length);
    }
}
