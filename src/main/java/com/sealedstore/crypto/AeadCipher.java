package com.sealedstore.crypto;

import java.security.GeneralSecurityException;
import java.security.Security;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.stereotype.Component;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * AES-256-GCM authenticated encryption.
 *
 * The nonce is always supplied by the caller, which stores it next to the
 * ciphertext it produced; this class never generates one. Output of
 * {@link #encrypt} is ciphertext with the 128-bit tag appended.
 */
@Component
public class AeadCipher {

    private static final String AES_ALGO = "AES/GCM/NoPadding";
    public static final int NONCE_LENGTH = 12; // 96-bit IV
    public static final int TAG_BITS = 128;
    public static final int TAG_LENGTH = TAG_BITS / 8;

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public Mono<byte[]> encrypt(SymmetricKey key, byte[] nonce, byte[] plaintext) {
        return Mono.fromCallable(() -> encryptNow(key, nonce, plaintext))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<byte[]> decrypt(SymmetricKey key, byte[] nonce, byte[] ciphertextAndTag) {
        return Mono.fromCallable(() -> decryptNow(key, nonce, ciphertextAndTag))
                .subscribeOn(Schedulers.boundedElastic());
    }

    byte[] encryptNow(SymmetricKey key, byte[] nonce, byte[] plaintext) {
        checkNonce(nonce);
        if (plaintext == null) {
            throw new InvalidInputException("Plaintext must not be null");
        }
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.ENCRYPT_MODE, key.toSecretKey(), new GCMParameterSpec(TAG_BITS, nonce));
            return cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("AES-GCM encryption failed", e);
        }
    }

    byte[] decryptNow(SymmetricKey key, byte[] nonce, byte[] ciphertextAndTag) {
        checkNonce(nonce);
        if (ciphertextAndTag == null || ciphertextAndTag.length < TAG_LENGTH) {
            throw new InvalidInputException("Ciphertext is shorter than the authentication tag");
        }
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.DECRYPT_MODE, key.toSecretKey(), new GCMParameterSpec(TAG_BITS, nonce));
            return cipher.doFinal(ciphertextAndTag);
        } catch (GeneralSecurityException e) {
            throw decryptFailure(e);
        }
    }

    /**
     * Tag mismatch (AEADBadTagException, or the BadPaddingException some providers raise
     * instead) means wrong key or tampered data. Anything else is a setup fault.
     */
    static CryptoException decryptFailure(GeneralSecurityException e) {
        if (e instanceof BadPaddingException) {
            return new DecryptionException(DecryptionStage.VALUE, "Cannot decrypt: wrong key or tampered data", e);
        }
        return new CryptoException("AES-GCM decryption could not run: " + e.getClass().getSimpleName(), e);
    }

    private static void checkNonce(byte[] nonce) {
        if (nonce == null || nonce.length != NONCE_LENGTH) {
            throw new InvalidInputException("Nonce must be exactly " + NONCE_LENGTH + " bytes");
        }
    }
}
