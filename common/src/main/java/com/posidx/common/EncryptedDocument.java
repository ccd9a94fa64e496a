package com.posidx.common;

import java.util.Objects;

/**
 * EncryptedDocument: one row of the documents table as stored at rest.
 *
 * encryptedContent, iv and authTag are hex strings produced by a single AES-GCM
 * encryption call. Any of them may be null or empty for rows that were never encrypted.
 */
public final class EncryptedDocument {
    private final String docId;
    private final String encryptedContent;
    private final String iv;
    private final String authTag;

    public EncryptedDocument(String docId, String encryptedContent, String iv, String authTag) {
        this.docId = Objects.requireNonNull(docId, "docId cannot be null");
        this.encryptedContent = encryptedContent;
        this.iv = iv;
        this.authTag = authTag;
    }

    public String getDocId() { return docId; }
    public String getEncryptedContent() { return encryptedContent; }
    public String getIv() { return iv; }
    public String getAuthTag() { return authTag; }

    /** True when all three ciphertext components are present and non-empty. */
    public boolean hasCiphertext() {
        return notEmpty(encryptedContent) && notEmpty(iv) && notEmpty(authTag);
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("EncryptedDocument{docId=%s, ctHexLen=%d}",
                docId, encryptedContent == null ? 0 : encryptedContent.length());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EncryptedDocument that)) return false;
        return docId.equals(that.docId)
                && Objects.equals(encryptedContent, that.encryptedContent)
                && Objects.equals(iv, that.iv)
                && Objects.equals(authTag, that.authTag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(docId, encryptedContent, iv, authTag);
    }
}
