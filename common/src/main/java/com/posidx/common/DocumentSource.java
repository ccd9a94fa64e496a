package com.posidx.common;

import java.util.List;

/**
 * Source of encrypted documents for a full index rebuild.
 */
public interface DocumentSource {

    /**
     * Reads every document. No incremental filter: each run sees the whole collection.
     *
     * @return all documents, in a stable order
     * @throws IndexPersistenceException if the backing store cannot be read
     */
    List<EncryptedDocument> loadAll() throws IndexPersistenceException;
}
