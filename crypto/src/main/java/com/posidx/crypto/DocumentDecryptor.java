package com.posidx.crypto;

import com.posidx.common.EncryptedDocument;
import com.posidx.common.PlaintextDocument;

import javax.crypto.SecretKey;

/**
 * DocumentDecryptor: authenticated decryption of stored documents.
 *
 * Implementations are stateless and safe to share between worker threads.
 */
public interface DocumentDecryptor {

    /**
     * Decrypts one ciphertext.
     *
     * @return the UTF-8 plaintext, or "" when any of ciphertext, nonce or tag is null or empty
     * @throws AuthenticationFailureException if the tag does not verify
     * @throws DecodeFailureException if the authenticated bytes are not valid UTF-8
     */
    String decrypt(byte[] ciphertext, byte[] nonce, byte[] tag, SecretKey key);

    /**
     * Decodes the stored hex components of a document and decrypts them.
     * Failures carry the document id.
     */
    PlaintextDocument decrypt(EncryptedDocument document, SecretKey key);
}
