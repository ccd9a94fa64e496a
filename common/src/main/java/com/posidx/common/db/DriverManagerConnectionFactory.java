package com.posidx.common.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Plain {@link DriverManager} connections; no pooling, a run opens a handful at most.
 */
public final class DriverManagerConnectionFactory implements ConnectionFactory {
    private static final Logger log = LoggerFactory.getLogger(DriverManagerConnectionFactory.class);

    private final String url;
    private final String user;
    private final String password;

    public DriverManagerConnectionFactory(String url, String user, String password) {
        this.url = Objects.requireNonNull(url, "url cannot be null");
        this.user = user;
        this.password = password;
    }

    @Override
    public Connection open() throws SQLException {
        log.debug("Opening JDBC connection to {}", url);
        return DriverManager.getConnection(url, user, password);
    }

    public String getUrl() {
        return url;
    }

    public SqlDialect dialect() {
        return SqlDialect.fromJdbcUrl(url);
    }

    /**
     * Opens and closes one connection so that an unreachable store is reported before any work starts.
     */
    public void verify() throws SQLException {
        try (Connection c = open()) {
            if (!c.isValid(5)) {
                throw new SQLException("Connection to " + url + " is not valid");
            }
        }
    }

    @Override
    public String toString() {
        return "DriverManagerConnectionFactory{url=" + url + ", user=" + user + '}';
    }
}
