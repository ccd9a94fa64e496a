package com.posidx.common;

/**
 * Decrypted document content. Lives only for the duration of a run and is never persisted.
 */
public record PlaintextDocument(String docId, String content) {

    public boolean isEmpty() {
        return content == null || content.isEmpty();
    }

    @Override
    public String toString() {
        // content stays out of logs
        return "PlaintextDocument{docId=" + docId + ", chars=" + (content == null ? 0 : content.length()) + '}';
    }
}
