package com.sealedstore.crypto;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import javax.crypto.AEADBadTagException;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchProviderException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AES-256-GCM properties: round trip, ciphertext uniqueness per nonce and tamper
 * detection. No Spring context.
 */
class AeadCipherTest {

    private final AeadCipher aead = new AeadCipher();

    private static final byte[] PLAINTEXT = "zero knowledge payload".getBytes(StandardCharsets.UTF_8);

    @Test
    void encryptDecryptRoundTrip() {
        SymmetricKey key = SymmetricKey.random();
        byte[] nonce = RandomBytes.nonce();

        byte[] ciphertext = aead.encrypt(key, nonce, PLAINTEXT).block();

        assertEquals(PLAINTEXT.length + AeadCipher.TAG_LENGTH, ciphertext.length,
                "Output is the ciphertext followed by a 16-byte tag");
        StepVerifier.create(aead.decrypt(key, nonce, ciphertext))
                .assertNext(plain -> assertArrayEquals(PLAINTEXT, plain))
                .verifyComplete();
    }

    @Test
    void emptyPlaintextRoundTrips() {
        SymmetricKey key = SymmetricKey.random();
        byte[] nonce = RandomBytes.nonce();

        byte[] ciphertext = aead.encryptNow(key, nonce, new byte[0]);

        assertEquals(0, aead.decryptNow(key, nonce, ciphertext).length);
    }

    @Test
    void distinctNoncesProduceDistinctCiphertexts() {
        SymmetricKey key = SymmetricKey.random();

        byte[] first = aead.encryptNow(key, RandomBytes.nonce(), PLAINTEXT);
        byte[] second = aead.encryptNow(key, RandomBytes.nonce(), PLAINTEXT);

        assertFalse(java.util.Arrays.equals(first, second),
                "Same key and plaintext under two fresh nonces must not give equal ciphertext");
    }

    @Test
    void flippingAnyBitFailsAuthentication() {
        SymmetricKey key = SymmetricKey.random();
        byte[] nonce = RandomBytes.nonce();
        byte[] ciphertext = aead.encryptNow(key, nonce, PLAINTEXT);

        for (int bit = 0; bit < ciphertext.length * 8; bit++) {
            byte[] tampered = ciphertext.clone();
            tampered[bit / 8] ^= (byte) (1 << (bit % 8));
            assertThrows(DecryptionException.class, () -> aead.decryptNow(key, nonce, tampered),
                    "Bit " + bit + " flipped must fail closed");
        }
    }

    @Test
    void wrongKeyFailsWithDecryptionException() {
        byte[] nonce = RandomBytes.nonce();
        byte[] ciphertext = aead.encryptNow(SymmetricKey.random(), nonce, PLAINTEXT);

        StepVerifier.create(aead.decrypt(SymmetricKey.random(), nonce, ciphertext))
                .expectError(DecryptionException.class)
                .verify();
    }

    @Test
    void nonceOfWrongLengthIsRejectedBeforeEncrypting() {
        SymmetricKey key = SymmetricKey.random();

        assertThrows(InvalidInputException.class, () -> aead.encryptNow(key, new byte[16], PLAINTEXT));
        assertThrows(InvalidInputException.class, () -> aead.encryptNow(key, null, PLAINTEXT));
    }

    @Test
    void ciphertextShorterThanTagIsRejected() {
        assertThrows(InvalidInputException.class,
                () -> aead.decryptNow(SymmetricKey.random(), RandomBytes.nonce(), new byte[AeadCipher.TAG_LENGTH - 1]));
    }

    @Test
    void destroyedKeyCannotBeUsed() {
        SymmetricKey key = SymmetricKey.random();
        key.destroy();

        assertThrows(IllegalStateException.class, () -> aead.encryptNow(key, RandomBytes.nonce(), PLAINTEXT));
        assertEquals("SymmetricKey[destroyed]", key.toString());
    }

    @Test
    void onlyTagFailuresAreReportedAsDecryptionFailures() {
        CryptoException badTag = AeadCipher.decryptFailure(new AEADBadTagException("mac check in GCM failed"));
        CryptoException noProvider = AeadCipher.decryptFailure(new NoSuchProviderException("BC"));
        CryptoException badKey = AeadCipher.decryptFailure(new InvalidKeyException("key size"));

        assertInstanceOf(DecryptionException.class, badTag);
        assertFalse(noProvider instanceof DecryptionException,
                "A missing provider is not a wrong key");
        assertFalse(badKey instanceof DecryptionException);
        assertInstanceOf(NoSuchProviderException.class, noProvider.getCause());
    }
}
