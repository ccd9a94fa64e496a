package com.posidx.crypto;

/**
 * Authenticated plaintext is not valid UTF-8.
 */
public class DecodeFailureException extends DecryptionException {
    private static final long serialVersionUID = 1L;

    public DecodeFailureException(String docId, String message, Throwable cause) {
        super(docId, message, cause);
    }
}
