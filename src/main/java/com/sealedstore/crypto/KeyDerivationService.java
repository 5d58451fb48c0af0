package com.sealedstore.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sealedstore.config.CryptoProperties;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Password-based key hierarchy root.
 *
 * Two unrelated derivations live here:
 *   - Master Key   = PBKDF2-HMAC-SHA256(password, salt, >= 100k rounds), 256 bits.
 *                    Deterministic, never leaves the client.
 *   - Auth digest  = SHA-256(password || saltBase64), one pass, Base64, 43 chars.
 *                    Sent to the server for login; useless as a cipher key.
 */
@Service
public class KeyDerivationService {

    private static final Logger log = LoggerFactory.getLogger(KeyDerivationService.class);

    /** Base64 of a SHA-256 digest without its '=' pad; fits bcrypt's 72-byte input ceiling. */
    public static final int AUTH_DIGEST_LENGTH = 43;

    private final CryptoProperties properties;

    public KeyDerivationService(CryptoProperties properties) {
        this.properties = properties;
    }

    public Mono<SymmetricKey> deriveMasterKey(char[] password, String saltBase64) {
        return Mono.fromCallable(() -> decodeSalt(saltBase64))
                .flatMap(salt -> deriveMasterKey(password, salt));
    }

    public Mono<SymmetricKey> deriveMasterKey(char[] password, byte[] salt) {
        return Mono.fromCallable(() -> deriveNow(password, salt))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Synchronous PBKDF2. Callers on a reactive path go through {@link #deriveMasterKey}.
     */
    SymmetricKey deriveNow(char[] password, byte[] salt) {
        if (password == null) {
            throw new InvalidInputException("Password must not be null");
        }
        checkSalt(salt);
        byte[] passwordBytes = PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(password);
        try {
            PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
            generator.init(passwordBytes, salt, properties.pbkdf2Iterations());
            KeyParameter derived = (KeyParameter) generator.generateDerivedParameters(SymmetricKey.LENGTH * 8);
            log.debug("Derived 256-bit key with {} PBKDF2 iterations", properties.pbkdf2Iterations());
            return SymmetricKey.adopt(derived.getKey());
        } finally {
            Arrays.fill(passwordBytes, (byte) 0);
        }
    }

    public byte[] generateSalt() {
        return RandomBytes.bytes(properties.saltLength());
    }

    public String generateSaltEncoded() {
        return ChunkedBase64.encode(generateSalt());
    }

    public SymmetricKey generateMasterKey() {
        return SymmetricKey.random();
    }

    /**
     * Login digest of {@code password || saltBase64}. A {@code null} salt selects the
     * unsalted legacy mode (digest of the password alone).
     */
    public Mono<String> hashForAuth(char[] password, String saltBase64) {
        return Mono.fromCallable(() -> hashNow(password, saltBase64));
    }

    public Mono<String> hashForAuth(char[] password) {
        return hashForAuth(password, null);
    }

    String hashNow(char[] password, String saltBase64) {
        if (password == null) {
            throw new InvalidInputException("Password must not be null");
        }
        byte[] passwordBytes = PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(password);
        byte[] hash = new byte[32];
        try {
            SHA256Digest digest = new SHA256Digest();
            digest.update(passwordBytes, 0, passwordBytes.length);
            if (saltBase64 != null) {
                byte[] saltText = saltBase64.getBytes(StandardCharsets.UTF_8);
                digest.update(saltText, 0, saltText.length);
            }
            digest.doFinal(hash, 0);
            return ChunkedBase64.encode(hash).substring(0, AUTH_DIGEST_LENGTH);
        } finally {
            Arrays.fill(passwordBytes, (byte) 0);
        }
    }

    byte[] decodeSalt(String saltBase64) {
        byte[] salt = ChunkedBase64.decode(saltBase64);
        checkSalt(salt);
        return salt;
    }

    private static void checkSalt(byte[] salt) {
        if (salt == null || salt.length < CryptoProperties.MIN_SALT_LENGTH) {
            throw new InvalidInputException(
                    "Salt must be at least " + CryptoProperties.MIN_SALT_LENGTH + " bytes");
        }
    }
}
