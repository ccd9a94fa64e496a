package com.posidx.loader;

import com.posidx.common.EncryptedDocument;
import com.posidx.common.IndexPersistenceException;
import com.posidx.common.db.DriverManagerConnectionFactory;
import com.posidx.crypto.DocumentEncryptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDocumentSourceTest {

    private DriverManagerConnectionFactory factory;

    @BeforeEach
    void setUp() throws Exception {
        factory = new DriverManagerConnectionFactory(
                "jdbc:h2:mem:docs-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        String ddl;
        try (var in = getClass().getResourceAsStream("/documents.sql")) {
            ddl = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        try (Connection c = factory.open(); Statement st = c.createStatement()) {
            st.execute(ddl);
        }
    }

    private void insert(EncryptedDocument d) throws Exception {
        try (Connection c = factory.open();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO documents (doc_id, filename, content, encrypted_content, iv, auth_tag, content_hash) "
                             + "VALUES (?, ?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, d.getDocId());
            ps.setString(2, d.getDocId() + ".txt");
            ps.setString(3, "[ENCRYPTED]");
            ps.setString(4, d.getEncryptedContent());
            ps.setString(5, d.getIv());
            ps.setString(6, d.getAuthTag());
            ps.setString(7, "0".repeat(64));
            ps.executeUpdate();
        }
    }

    @Test
    void loadAll_readsCiphertextTripleOrderedByDocId() throws Exception {
        DocumentEncryptor encryptor = new DocumentEncryptor(new SecretKeySpec(new byte[32], "AES"));
        EncryptedDocument doc2 = encryptor.encrypt("doc2", "the dog sat");
        EncryptedDocument doc1 = encryptor.encrypt("doc1", "the cat sat");
        insert(doc2);
        insert(doc1);
        insert(new EncryptedDocument("doc3", null, null, null));

        JdbcDocumentSource source = new JdbcDocumentSource(factory, "documents");
        List<EncryptedDocument> docs = source.loadAll();

        assertEquals(List.of(doc1, doc2, new EncryptedDocument("doc3", null, null, null)), docs);
        assertFalse(docs.get(2).hasCiphertext());
    }

    @Test
    void loadAll_emptyTable() throws Exception {
        JdbcDocumentSource source = new JdbcDocumentSource(factory, "documents");
        assertTrue(source.loadAll().isEmpty());
    }

    @Test
    void missingTable_raisesPersistenceException() {
        JdbcDocumentSource source = new JdbcDocumentSource(factory, "missing_docs");
        assertThrows(IndexPersistenceException.class, source::loadAll);
    }

    @Test
    void rejectsUnsafeTableName() {
        assertThrows(IllegalArgumentException.class, () -> new JdbcDocumentSource(factory, "documents--"));
    }
}
