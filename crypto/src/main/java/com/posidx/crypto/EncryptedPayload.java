package com.posidx.crypto;

import java.util.HexFormat;

/**
 * Output of one AES-GCM encryption: ciphertext without tag, nonce, and 16-byte tag.
 */
public record EncryptedPayload(byte[] ciphertext, byte[] nonce, byte[] tag) {

    public String ciphertextHex() { return HexFormat.of().formatHex(ciphertext); }
    public String nonceHex() { return HexFormat.of().formatHex(nonce); }
    public String tagHex() { return HexFormat.of().formatHex(tag); }
}
