package com.posidx.loader;

import com.posidx.common.DocumentSource;
import com.posidx.common.EncryptedDocument;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Fixed document list, sorted by doc_id like the JDBC source. Used for local runs and tests.
 */
public class InMemoryDocumentSource implements DocumentSource {

    private final List<EncryptedDocument> documents;

    public InMemoryDocumentSource(List<EncryptedDocument> documents) {
        Objects.requireNonNull(documents, "documents cannot be null");
        List<EncryptedDocument> sorted = new ArrayList<>(documents);
        sorted.sort(Comparator.comparing(EncryptedDocument::getDocId));
        this.documents = List.copyOf(sorted);
    }

    @Override
    public List<EncryptedDocument> loadAll() {
        return documents;
    }
}
