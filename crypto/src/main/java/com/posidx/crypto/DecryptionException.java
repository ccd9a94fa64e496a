package com.posidx.crypto;

/**
 * A document could not be turned back into text. Always fatal for that document.
 */
public class DecryptionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String docId;

    public DecryptionException(String docId, String message, Throwable cause) {
        super(docId == null ? message : message + " (doc_id=" + docId + ")", cause);
        this.docId = docId;
    }

    /** Id of the document that failed, or null when raw bytes were decrypted. */
    public String getDocId() {
        return docId;
    }
}
