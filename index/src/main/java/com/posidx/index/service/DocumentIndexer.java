package com.posidx.index.service;

import com.posidx.common.DocumentOutcome;
import com.posidx.common.EncryptedDocument;
import com.posidx.common.PlaintextDocument;
import com.posidx.common.PositionalEntry;
import com.posidx.crypto.DecryptionException;
import com.posidx.crypto.DocumentDecryptor;
import com.posidx.index.core.PositionalIndexBuilder;
import com.posidx.index.core.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.util.List;
import java.util.Objects;

/**
 * Per-document map stage: decrypt, tokenize, build positions.
 *
 * Holds no mutable state; one instance serves every worker thread of a run.
 */
public final class DocumentIndexer {

    private static final Logger log = LoggerFactory.getLogger(DocumentIndexer.class);

    private final DocumentDecryptor decryptor;
    private final Tokenizer tokenizer;
    private final PositionalIndexBuilder builder;
    private final SecretKey key;

    public DocumentIndexer(DocumentDecryptor decryptor, Tokenizer tokenizer, PositionalIndexBuilder builder, SecretKey key) {
        this.decryptor = Objects.requireNonNull(decryptor, "decryptor");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.key = Objects.requireNonNull(key, "key");
    }

    /**
     * Never throws for decryption problems: they come back as a FAILED outcome and the
     * caller's failure policy decides what happens to the run.
     */
    public DocumentOutcome index(EncryptedDocument document) {
        Objects.requireNonNull(document, "document cannot be null");
        String docId = document.getDocId();

        PlaintextDocument plain;
        try {
            plain = decryptor.decrypt(document, key);
        } catch (DecryptionException e) {
            log.debug("Document {} failed to decrypt: {}", docId, e.getMessage());
            return DocumentOutcome.failed(docId, e);
        }

        if (plain.isEmpty()) {
            log.debug("Document {} has no content, skipped", docId);
            return DocumentOutcome.skipped(docId);
        }

        List<String> tokens = tokenizer.tokenize(plain.content());
        PositionalEntry entry = builder.build(docId, tokens);
        log.debug("Document {}: {} tokens, {} distinct terms", docId, entry.getTokenCount(), entry.termCount());
        return DocumentOutcome.indexed(entry);
    }
}
