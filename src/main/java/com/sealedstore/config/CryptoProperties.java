package com.sealedstore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Key-derivation settings, bound from {@code sealedstore.crypto.*}.
 *
 * @param pbkdf2Iterations PBKDF2-HMAC-SHA256 rounds for Master Key and vault storage keys
 * @param saltLength       bytes of fresh salt generated per user / per vault entry
 * @param minPasswordScore minimum {@code PasswordStrength} score accepted at registration
 */
@ConfigurationProperties(prefix = "sealedstore.crypto")
public record CryptoProperties(
        @DefaultValue("100000") int pbkdf2Iterations,
        @DefaultValue("16") int saltLength,
        @DefaultValue("3") int minPasswordScore
) {

    public static final int MIN_ITERATIONS = 100_000;
    public static final int MIN_SALT_LENGTH = 16;

    public CryptoProperties {
        if (pbkdf2Iterations < MIN_ITERATIONS) {
            throw new IllegalArgumentException(
                    "sealedstore.crypto.pbkdf2-iterations must be at least " + MIN_ITERATIONS);
        }
        if (saltLength < MIN_SALT_LENGTH) {
            throw new IllegalArgumentException(
                    "sealedstore.crypto.salt-length must be at least " + MIN_SALT_LENGTH);
        }
    }

    public static CryptoProperties defaults() {
        return new CryptoProperties(MIN_ITERATIONS, MIN_SALT_LENGTH, 3);
    }
}
