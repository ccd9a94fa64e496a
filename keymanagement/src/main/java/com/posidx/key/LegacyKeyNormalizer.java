package com.posidx.key;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Compatibility transform from an operator secret to a 256-bit AES key.
 *
 * This is NOT a key-derivation function. The secret's UTF-8 bytes are right-padded with
 * ASCII '0' or truncated to exactly 32 bytes, which is how the stored documents were
 * encrypted. Replacing it with a real KDF makes every stored document undecryptable, so
 * a change here needs a re-encryption of the collection.
 */
public final class LegacyKeyNormalizer {

    public static final int KEY_LENGTH = 32;

    /** Pad byte used by the upload service when the secret is shorter than 32 bytes. */
    public static final byte PAD_BYTE = (byte) '0';

    private LegacyKeyNormalizer() {}

    /**
     * @return exactly {@value #KEY_LENGTH} bytes; the caller owns the array
     * @throws IllegalArgumentException if the secret is null
     */
    public static byte[] normalize(String secret) {
        if (secret == null) {
            throw new IllegalArgumentException("secret cannot be null");
        }
        byte[] raw = secret.getBytes(StandardCharsets.UTF_8);
        try {
            byte[] key = Arrays.copyOf(raw, KEY_LENGTH);
            if (raw.length < KEY_LENGTH) {
                Arrays.fill(key, raw.length, KEY_LENGTH, PAD_BYTE);
            }
            return key;
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    /** Normalized secret wrapped as an AES key. */
    public static SecretKey toSecretKey(String secret) {
        byte[] key = normalize(secret);
        try {
            return new SecretKeySpec(key, "AES");
        } finally {
            Arrays.fill(key, (byte) 0); // SecretKeySpec keeps its own copy
        }
    }
}
