package com.posidx.common.db;

import java.sql.Array;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * SQL that differs between the production store (PostgreSQL) and the embedded store used by tests (H2).
 */
public enum SqlDialect {

    POSTGRESQL("int4") {
        @Override
        public String upsertSql(String table) {
            return "INSERT INTO " + checkIdentifier(table) + " (term, doc_id, positions) VALUES (?, ?, ?) "
                    + "ON CONFLICT (term, doc_id) DO UPDATE SET positions = EXCLUDED.positions";
        }

        @Override
        public Optional<String> exclusiveLockSql(String table) {
            // blocks a concurrent rebuild, readers keep going
            return Optional.of("LOCK TABLE " + checkIdentifier(table) + " IN SHARE ROW EXCLUSIVE MODE");
        }
    },

    H2("INTEGER") {
        @Override
        public String upsertSql(String table) {
            return "MERGE INTO " + checkIdentifier(table) + " (term, doc_id, positions) KEY (term, doc_id) VALUES (?, ?, ?)";
        }

        @Override
        public Optional<String> exclusiveLockSql(String table) {
            return Optional.empty();
        }
    };

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String integerArrayType;

    SqlDialect(String integerArrayType) {
        this.integerArrayType = integerArrayType;
    }

    /** Insert-or-overwrite of (term, doc_id, positions) keyed on (term, doc_id). */
    public abstract String upsertSql(String table);

    /** Statement taking a single-writer lock on the index table inside the current transaction. */
    public abstract Optional<String> exclusiveLockSql(String table);

    public Array positionsArray(Connection connection, Integer[] positions) throws SQLException {
        return connection.createArrayOf(integerArrayType, positions);
    }

    /**
     * Picks the dialect from a JDBC URL.
     *
     * @throws IllegalArgumentException for URLs of any other database
     */
    public static SqlDialect fromJdbcUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            throw new IllegalArgumentException("JDBC URL cannot be null");
        }
        String url = jdbcUrl.toLowerCase(Locale.ROOT);
        if (url.startsWith("jdbc:postgresql:")) return POSTGRESQL;
        if (url.startsWith("jdbc:h2:")) return H2;
        throw new IllegalArgumentException("Unsupported JDBC URL: " + jdbcUrl);
    }

    /**
     * Table names are spliced into SQL, so only plain identifiers are accepted.
     */
    public static String checkIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
        return name;
    }

    /** Reads an integer array column; drivers differ in the element type they hand back. */
    public static List<Integer> readPositions(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        try {
            Object[] raw = (Object[]) array.getArray();
            List<Integer> out = new ArrayList<>(raw.length);
            for (Object o : raw) {
                out.add(((Number) o).intValue());
            }
            return out;
        } finally {
            array.free();
        }
    }
}
