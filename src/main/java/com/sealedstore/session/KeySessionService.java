package com.sealedstore.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sealedstore.config.CryptoProperties;
import com.sealedstore.crypto.InvalidInputException;
import com.sealedstore.crypto.KeyDerivationService;
import com.sealedstore.vault.KeyVault;

import reactor.core.publisher.Mono;

/**
 * Session lifecycle around the Master Key.
 *
 * Login flow:
 *   1. The caller fetches the user's salt and sends {@link #authDigest} to the server.
 *   2. On success, {@link #openSession} derives the Master Key locally.
 *   3. {@link #persist} keeps it wrapped in the vault so a reload can {@link #resume}
 *      without another PBKDF2 run over the password.
 * Nothing derived here is ever sent anywhere except the auth digest.
 */
@Service
public class KeySessionService {

    private static final Logger log = LoggerFactory.getLogger(KeySessionService.class);

    private final KeyDerivationService keyDerivation;
    private final KeyVault vault;
    private final CryptoProperties properties;

    public KeySessionService(KeyDerivationService keyDerivation, KeyVault vault, CryptoProperties properties) {
        this.keyDerivation = keyDerivation;
        this.vault = vault;
        this.properties = properties;
    }

    /**
     * Fresh salt plus login digest for a new account. Rejects passwords scoring below
     * {@code sealedstore.crypto.min-password-score}.
     */
    public Mono<RegistrationMaterial> prepareRegistration(char[] password) {
        return Mono.defer(() -> {
            if (password == null) {
                return Mono.error(new InvalidInputException("Password must not be null"));
            }
            PasswordStrength strength = PasswordStrength.evaluate(password);
            if (!strength.meets(properties.minPasswordScore())) {
                return Mono.error(new InvalidInputException(
                        "Password too weak: " + String.join(", ", strength.feedback())));
            }
            String salt = keyDerivation.generateSaltEncoded();
            return keyDerivation.hashForAuth(password, salt)
                    .map(digest -> new RegistrationMaterial(salt, digest));
        });
    }

    public Mono<String> authDigest(char[] password, String saltBase64) {
        return keyDerivation.hashForAuth(password, saltBase64);
    }

    public Mono<CryptoSession> openSession(String userId, char[] password, String saltBase64) {
        return keyDerivation.deriveMasterKey(password, saltBase64)
                .map(masterKey -> new CryptoSession(userId, masterKey))
                .doOnNext(session -> log.info("Opened session for user {}", userId));
    }

    public Mono<Void> persist(CryptoSession session, char[] sessionSecret) {
        return Mono.defer(() -> vault.store(session.userId(), session.masterKey(), sessionSecret));
    }

    public Mono<CryptoSession> resume(String userId, char[] sessionSecret) {
        return vault.retrieve(userId, sessionSecret)
                .map(masterKey -> new CryptoSession(userId, masterKey))
                .doOnNext(session -> log.info("Resumed session for user {} from vault", userId));
    }

    public Mono<Boolean> canResume(String userId) {
        return vault.exists(userId);
    }

    /**
     * Removes the stored key and wipes the in-memory one, even if the vault delete fails.
     */
    public Mono<Void> logout(CryptoSession session) {
        return vault.delete(session.userId())
                .doFinally(signal -> {
                    session.close();
                    log.info("Closed session for user {}", session.userId());
                });
    }
}
