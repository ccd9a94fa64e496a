package com.posidx.crypto;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Low-level AES-256-GCM helpers (no AAD) and hex codecs for stored documents.
 */
public final class EncryptionUtils {
    static final String TRANSFORMATION = "AES/GCM/NoPadding";
    public static final int GCM_NONCE_LENGTH = 12;
    public static final int GCM_TAG_LENGTH = 16;
    static final int GCM_TAG_LENGTH_BITS = GCM_TAG_LENGTH * 8;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private EncryptionUtils() {}

    /** Securely generates a 12-byte nonce. */
    public static byte[] generateNonce() {
        byte[] nonce = new byte[GCM_NONCE_LENGTH];
        SECURE_RANDOM.nextBytes(nonce);
        return nonce;
    }

    /** Encrypts under a fresh random nonce. */
    public static EncryptedPayload encrypt(byte[] plaintext, SecretKey key) throws GeneralSecurityException {
        return encrypt(plaintext, key, generateNonce());
    }

    /**
     * Encrypts and splits the JCE output into ciphertext and tag, the layout the documents table stores.
     */
    public static EncryptedPayload encrypt(byte[] plaintext, SecretKey key, byte[] nonce) throws GeneralSecurityException {
        Objects.requireNonNull(plaintext, "plaintext cannot be null");
        Objects.requireNonNull(key, "SecretKey cannot be null");
        Objects.requireNonNull(nonce, "nonce cannot be null");
        if (nonce.length == 0) {
            throw new IllegalArgumentException("nonce cannot be empty");
        }
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, nonce));
        byte[] out = cipher.doFinal(plaintext);
        int ctLen = out.length - GCM_TAG_LENGTH;
        return new EncryptedPayload(
                Arrays.copyOfRange(out, 0, ctLen),
                nonce.clone(),
                Arrays.copyOfRange(out, ctLen, out.length));
    }

    /**
     * Verifies and decrypts. Throws {@link javax.crypto.AEADBadTagException} on tag mismatch.
     */
    public static byte[] decrypt(byte[] ciphertext, byte[] nonce, byte[] tag, SecretKey key) throws GeneralSecurityException {
        Objects.requireNonNull(ciphertext, "ciphertext cannot be null");
        Objects.requireNonNull(nonce, "nonce cannot be null");
        Objects.requireNonNull(tag, "tag cannot be null");
        Objects.requireNonNull(key, "SecretKey cannot be null");
        byte[] input = new byte[ciphertext.length + tag.length];
        System.arraycopy(ciphertext, 0, input, 0, ciphertext.length);
        System.arraycopy(tag, 0, input, ciphertext.length, tag.length);

        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, nonce));
        return cipher.doFinal(input);
    }

    /** Hex to bytes; null stays null. */
    public static byte[] fromHex(String hex) {
        if (hex == null) return null;
        return HexFormat.of().parseHex(hex.trim());
    }

    public static String toHex(byte[] bytes) {
        return HexFormat.of().formatHex(bytes);
    }
}
