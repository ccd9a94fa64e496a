package com.posidx.crypto;

import com.posidx.common.EncryptedDocument;
import com.posidx.common.PlaintextDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.SecretKey;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Objects;

/**
 * AES-256-GCM document decryptor: 128-bit tag, no AAD, strict UTF-8.
 *
 * The nonce is whatever the document was encrypted with. This system writes 12-byte nonces,
 * the upload service wrote 16-byte IVs, and GCM accepts both.
 */
public class AesGcmDocumentDecryptor implements DocumentDecryptor {

    private static final Logger log = LoggerFactory.getLogger(AesGcmDocumentDecryptor.class);

    @Override
    public String decrypt(byte[] ciphertext, byte[] nonce, byte[] tag, SecretKey key) {
        return decrypt(null, ciphertext, nonce, tag, key);
    }

    @Override
    public PlaintextDocument decrypt(EncryptedDocument document, SecretKey key) {
        Objects.requireNonNull(document, "document cannot be null");
        String docId = document.getDocId();
        if (!document.hasCiphertext()) {
            log.debug("Document {} has no ciphertext, nothing to decrypt", docId);
            return new PlaintextDocument(docId, "");
        }

        byte[] ct;
        byte[] nonce;
        byte[] tag;
        try {
            ct = EncryptionUtils.fromHex(document.getEncryptedContent());
            nonce = EncryptionUtils.fromHex(document.getIv());
            tag = EncryptionUtils.fromHex(document.getAuthTag());
        } catch (IllegalArgumentException e) {
            throw new AuthenticationFailureException(docId, "Stored ciphertext is not valid hex", e);
        }
        return new PlaintextDocument(docId, decrypt(docId, ct, nonce, tag, key));
    }

    private String decrypt(String docId, byte[] ciphertext, byte[] nonce, byte[] tag, SecretKey key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (isEmpty(ciphertext) || isEmpty(nonce) || isEmpty(tag)) {
            return "";
        }
        if (tag.length != EncryptionUtils.GCM_TAG_LENGTH) {
            throw new AuthenticationFailureException(docId,
                    "Authentication tag must be " + EncryptionUtils.GCM_TAG_LENGTH + " bytes, got " + tag.length, null);
        }

        byte[] plain;
        try {
            plain = EncryptionUtils.decrypt(ciphertext, nonce, tag, key);
        } catch (AEADBadTagException e) {
            throw new AuthenticationFailureException(docId, "Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException(docId, "Decryption failed", e);
        }

        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(plain))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecodeFailureException(docId, "Decrypted content is not valid UTF-8", e);
        } finally {
            Arrays.fill(plain, (byte) 0); // Clear sensitive decrypted data
        }
    }

    private static boolean isEmpty(byte[] b) {
        return b == null || b.length == 0;
    }
}
