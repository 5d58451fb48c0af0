package com.sealedstore.vault;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sealedstore.crypto.AeadCipher;
import com.sealedstore.crypto.ChunkedBase64;
import com.sealedstore.crypto.DecryptionException;
import com.sealedstore.crypto.DecryptionStage;
import com.sealedstore.crypto.InvalidInputException;
import com.sealedstore.crypto.KeyDerivationService;
import com.sealedstore.crypto.RandomBytes;
import com.sealedstore.crypto.SymmetricKey;

import reactor.core.publisher.Mono;

/**
 * Persists a Master Key between sessions.
 *
 * store:    storageKey = PBKDF2(sessionSecret, fresh storageSalt)
 *           entry      = { storageSalt, nonce, AES-GCM(storageKey, nonce, masterKey) }
 * retrieve: same derivation from the stored salt, then unwrap.
 *
 * A missing entry and a wrong secret are reported as different exceptions so the caller
 * can choose between "derive from password" and "ask again".
 */
@Service
public class KeyVault {

    private static final Logger log = LoggerFactory.getLogger(KeyVault.class);

    private final VaultEntryRepository repository;
    private final KeyDerivationService keyDerivation;
    private final AeadCipher aead;

    public KeyVault(VaultEntryRepository repository, KeyDerivationService keyDerivation, AeadCipher aead) {
        this.repository = repository;
        this.keyDerivation = keyDerivation;
        this.aead = aead;
    }

    /**
     * Wraps and saves {@code masterKey}, replacing any previous entry for the user.
     */
    public Mono<Void> store(String userId, SymmetricKey masterKey, char[] sessionSecret) {
        if (isBlank(userId)) {
            return blankUserId();
        }
        byte[] storageSalt = keyDerivation.generateSalt();
        byte[] nonce = RandomBytes.nonce();
        return keyDerivation.deriveMasterKey(sessionSecret, storageSalt)
                .flatMap(storageKey -> Mono.using(
                                masterKey::exportBytes,
                                raw -> aead.encrypt(storageKey, nonce, raw),
                                raw -> Arrays.fill(raw, (byte) 0))
                        .doFinally(signal -> storageKey.destroy()))
                .map(wrapped -> {
                    VaultEntry entry = new VaultEntry();
                    entry.userId = userId;
                    entry.storageSalt = ChunkedBase64.encode(storageSalt);
                    entry.nonce = ChunkedBase64.encode(nonce);
                    entry.wrappedMasterKey = ChunkedBase64.encode(wrapped);
                    entry.createdAt = System.currentTimeMillis();
                    return entry;
                })
                .flatMap(repository::save)
                .doOnNext(saved -> log.info("Stored wrapped key for user {}", userId))
                .then();
    }

    public Mono<SymmetricKey> retrieve(String userId, char[] sessionSecret) {
        if (isBlank(userId)) {
            return blankUserId();
        }
        return repository.findById(userId)
                .switchIfEmpty(Mono.error(() -> new VaultEntryNotFoundException(userId)))
                .flatMap(entry -> unwrap(entry, sessionSecret))
                .onErrorMap(DecryptionException.class,
                        e -> new WrongVaultSecretException(userId, e.atStage(DecryptionStage.VAULT)))
                .doOnError(VaultException.class,
                        e -> log.info("Vault lookup for user {} failed: {}", userId, e.getClass().getSimpleName()));
    }

    public Mono<Void> delete(String userId) {
        if (isBlank(userId)) {
            return blankUserId();
        }
        return repository.deleteById(userId)
                .doOnSuccess(done -> log.info("Deleted stored key for user {}", userId));
    }

    public Mono<Boolean> exists(String userId) {
        if (isBlank(userId)) {
            return blankUserId();
        }
        return repository.existsById(userId);
    }

    public Mono<Void> clearAll() {
        return repository.deleteAll()
                .doOnSuccess(done -> log.warn("Cleared all stored keys"));
    }

    private static boolean isBlank(String userId) {
        return userId == null || userId.isBlank();
    }

    private static <T> Mono<T> blankUserId() {
        return Mono.error(new InvalidInputException("User id must not be blank"));
    }

    private Mono<SymmetricKey> unwrap(VaultEntry entry, char[] sessionSecret) {
        return Mono.fromCallable(() -> decodeEntry(entry))
                .flatMap(parts -> keyDerivation.deriveMasterKey(sessionSecret, parts[0])
                        .flatMap(storageKey -> aead.decrypt(storageKey, parts[1], parts[2])
                                .doFinally(signal -> storageKey.destroy())))
                .map(raw -> {
                    try {
                        return SymmetricKey.fromBytes(raw);
                    } finally {
                        Arrays.fill(raw, (byte) 0);
                    }
                });
    }

    /** {salt, nonce, wrapped}; a column that does not decode means the record is corrupt. */
    private static byte[][] decodeEntry(VaultEntry entry) {
        if (entry.storageSalt == null || entry.nonce == null || entry.wrappedMasterKey == null) {
            throw new InvalidInputException("Vault entry is incomplete for user: " + entry.userId);
        }
        return new byte[][] {
                ChunkedBase64.decode(entry.storageSalt),
                ChunkedBase64.decode(entry.nonce),
                ChunkedBase64.decode(entry.wrappedMasterKey)
        };
    }
}
