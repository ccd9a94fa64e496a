package com.posidx.crypto;

/**
 * GCM tag verification failed: the ciphertext, nonce or tag was altered, or the key is wrong.
 */
public class AuthenticationFailureException extends DecryptionException {
    private static final long serialVersionUID = 1L;

    public AuthenticationFailureException(String docId, String message, Throwable cause) {
        super(docId, message, cause);
    }
}
