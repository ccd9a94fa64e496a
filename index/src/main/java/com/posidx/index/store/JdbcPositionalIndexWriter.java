package com.posidx.index.store;

import com.posidx.common.IndexPersistenceException;
import com.posidx.common.IndexRow;
import com.posidx.common.IndexStatistics;
import com.posidx.common.PositionalIndexWriter;
import com.posidx.common.db.ConnectionFactory;
import com.posidx.common.db.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Batch index writer over JDBC.
 *
 * A rebuild is one transaction: lock (where the dialect has one), DELETE, batched upsert, COMMIT.
 * On any failure the transaction is rolled back and the previous index stays in place.
 */
public class JdbcPositionalIndexWriter implements PositionalIndexWriter {

    private static final Logger log = LoggerFactory.getLogger(JdbcPositionalIndexWriter.class);

    private final ConnectionFactory connections;
    private final SqlDialect dialect;
    private final String table;
    private final int batchSize;

    public JdbcPositionalIndexWriter(ConnectionFactory connections, SqlDialect dialect, String table, int batchSize) {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.table = SqlDialect.checkIdentifier(table);
        if (batchSize <= 0) throw new IllegalArgumentException("Batch size must be positive");
        this.batchSize = batchSize;
    }

    @Override
    public IndexStatistics replaceAll(List<IndexRow> rows) throws IndexPersistenceException {
        Objects.requireNonNull(rows, "rows cannot be null");
        requireUniqueKeys(rows);

        try (Connection c = connections.open()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                writeInTransaction(c, rows);
                c.commit();
            } catch (SQLException | RuntimeException e) {
                rollback(c, e);
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new IndexPersistenceException("Failed to rebuild " + table + "; previous index kept", e);
        }

        log.info("Inserted {} entries into {}", rows.size(), table);
        return statistics();
    }

    private void writeInTransaction(Connection c, List<IndexRow> rows) throws SQLException {
        try (Statement st = c.createStatement()) {
            var lock = dialect.exclusiveLockSql(table);
            if (lock.isPresent()) {
                st.execute(lock.get());
            }
            int deleted = st.executeUpdate("DELETE FROM " + table);
            log.info("Cleared existing index ({} rows)", deleted);
        }

        try (PreparedStatement ps = c.prepareStatement(dialect.upsertSql(table))) {
            int pending = 0;
            int batches = 0;
            for (IndexRow row : rows) {
                Array positions = dialect.positionsArray(c, row.positionsArray());
                ps.setString(1, row.getTerm());
                ps.setString(2, row.getDocId());
                ps.setArray(3, positions);
                ps.addBatch();
                if (++pending == batchSize) {
                    ps.executeBatch();
                    pending = 0;
                    batches++;
                }
            }
            if (pending > 0) {
                ps.executeBatch();
                batches++;
            }
            log.debug("Upserted {} rows in {} batches of at most {}", rows.size(), batches, batchSize);
        }
    }

    private void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
            log.warn("Index write rolled back: {}", cause.getMessage());
        } catch (SQLException re) {
            cause.addSuppressed(re);
            log.error("Rollback failed, {} may be inconsistent", table, re);
        }
    }

    private static void requireUniqueKeys(List<IndexRow> rows) {
        Set<String> seen = new HashSet<>(rows.size() * 2);
        for (IndexRow r : rows) {
            // \u0000 cannot occur in a term
            if (!seen.add(r.getTerm() + '\u0000' + r.getDocId())) {
                throw new IllegalArgumentException("Duplicate index key (" + r.getTerm() + ", " + r.getDocId() + ")");
            }
        }
    }

    @Override
    public IndexStatistics statistics() throws IndexPersistenceException {
        String sql = "SELECT COUNT(DISTINCT term), COUNT(DISTINCT doc_id), COUNT(*) FROM " + table;
        try (Connection c = connections.open();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            if (!rs.next()) return IndexStatistics.EMPTY;
            return new IndexStatistics(rs.getLong(1), rs.getLong(2), rs.getLong(3));
        } catch (SQLException e) {
            throw new IndexPersistenceException("Failed to read statistics of " + table, e);
        }
    }

    @Override
    public List<IndexRow> sample(int limit) throws IndexPersistenceException {
        if (limit <= 0) return List.of();
        return query("SELECT term, doc_id, positions FROM " + table + " ORDER BY term, doc_id LIMIT ?", limit);
    }

    @Override
    public List<IndexRow> readAll() throws IndexPersistenceException {
        return query("SELECT term, doc_id, positions FROM " + table + " ORDER BY term, doc_id", -1);
    }

    private List<IndexRow> query(String sql, int limit) throws IndexPersistenceException {
        try (Connection c = connections.open();
             PreparedStatement ps = c.prepareStatement(sql)) {
            if (limit >= 0) {
                ps.setInt(1, limit);
            }
            List<IndexRow> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new IndexRow(rs.getString(1), rs.getString(2), SqlDialect.readPositions(rs.getArray(3))));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new IndexPersistenceException("Failed to read " + table, e);
        }
    }

    public String getTable() {
        return table;
    }

    public int getBatchSize() {
        return batchSize;
    }
}
