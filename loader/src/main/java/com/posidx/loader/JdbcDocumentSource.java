package com.posidx.loader;

import com.posidx.common.DocumentSource;
import com.posidx.common.EncryptedDocument;
import com.posidx.common.IndexPersistenceException;
import com.posidx.common.db.ConnectionFactory;
import com.posidx.common.db.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the documents table in full, ordered by doc_id.
 *
 * Only the id and the ciphertext triple are selected; the plaintext column some stores keep
 * alongside is never read.
 */
public class JdbcDocumentSource implements DocumentSource {

    private static final Logger log = LoggerFactory.getLogger(JdbcDocumentSource.class);

    private final ConnectionFactory connections;
    private final String table;

    public JdbcDocumentSource(ConnectionFactory connections, String table) {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.table = SqlDialect.checkIdentifier(table);
    }

    @Override
    public List<EncryptedDocument> loadAll() throws IndexPersistenceException {
        String sql = "SELECT doc_id, encrypted_content, iv, auth_tag FROM " + table + " ORDER BY doc_id";
        try (Connection c = connections.open();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            List<EncryptedDocument> docs = new ArrayList<>();
            while (rs.next()) {
                docs.add(new EncryptedDocument(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4)));
            }
            log.info("Loaded {} documents from {}", docs.size(), table);
            return docs;
        } catch (SQLException e) {
            throw new IndexPersistenceException("Failed to load documents from " + table, e);
        }
    }

    public String getTable() {
        return table;
    }
}
