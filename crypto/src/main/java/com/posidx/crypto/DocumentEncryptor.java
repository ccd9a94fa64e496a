package com.posidx.crypto;

import com.posidx.common.EncryptedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * Write-side counterpart of {@link AesGcmDocumentDecryptor}: produces the hex triple the
 * documents table stores, under a fresh 12-byte nonce.
 */
public class DocumentEncryptor {

    private static final Logger log = LoggerFactory.getLogger(DocumentEncryptor.class);

    private final SecretKey key;

    public DocumentEncryptor(SecretKey key) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
    }

    public EncryptedDocument encrypt(String docId, String content) {
        Objects.requireNonNull(docId, "docId cannot be null");
        Objects.requireNonNull(content, "content cannot be null");
        try {
            EncryptedPayload p = EncryptionUtils.encrypt(content.getBytes(StandardCharsets.UTF_8), key);
            log.debug("Encrypted document {} ({} bytes)", docId, p.ciphertext().length);
            return new EncryptedDocument(docId, p.ciphertextHex(), p.nonceHex(), p.tagHex());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Encryption failed for doc_id=" + docId, e);
        }
    }
}
