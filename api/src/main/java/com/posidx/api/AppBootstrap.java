package com.posidx.api;

import com.posidx.common.db.DriverManagerConnectionFactory;
import com.posidx.common.db.SqlDialect;
import com.posidx.config.EncryptionSecret;
import com.posidx.config.SystemConfig;
import com.posidx.config.SystemConfig.ConfigLoadException;
import com.posidx.index.store.JdbcPositionalIndexWriter;
import com.posidx.key.LegacyKeyNormalizer;
import com.posidx.loader.JdbcDocumentSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.sql.SQLException;
import java.util.Objects;

public final class AppBootstrap {

    private static final Logger log = LoggerFactory.getLogger(AppBootstrap.class);

    public static final class Components {
        public final SystemConfig config;
        public final DriverManagerConnectionFactory connections;
        public final JdbcDocumentSource source;
        public final JdbcPositionalIndexWriter writer;
        public final PipelineContext context;

        Components(SystemConfig cfg,
                   DriverManagerConnectionFactory connections,
                   JdbcDocumentSource source,
                   JdbcPositionalIndexWriter writer,
                   PipelineContext context) {
            this.config = cfg;
            this.connections = connections;
            this.source = source;
            this.writer = writer;
            this.context = context;
        }

        public PositionalIndexPipeline pipeline() {
            return new PositionalIndexPipeline(source, writer, context);
        }

        public ConsoleReport consoleReport() {
            return new ConsoleReport(config.getSamplePositions());
        }
    }

    /**
     * Wires the run and checks the database once. Nothing is read or written yet.
     *
     * @throws ConfigLoadException when the database cannot be reached
     */
    public static Components init(SystemConfig cfg, EncryptionSecret secret) throws ConfigLoadException {
        Objects.requireNonNull(cfg, "cfg");
        Objects.requireNonNull(secret, "secret");

        SystemConfig.DatabaseConfig db = cfg.getDatabase();
        DriverManagerConnectionFactory connections =
                new DriverManagerConnectionFactory(db.jdbcUrl(), db.user, db.password);
        log.info("Connecting to {}", connections.getUrl());
        try {
            connections.verify();
        } catch (SQLException e) {
            throw new ConfigLoadException("Database unreachable: " + connections.getUrl(), e);
        }
        SqlDialect dialect = connections.dialect();

        SecretKey key = LegacyKeyNormalizer.toSecretKey(secret.value());
        PipelineMetrics metrics = cfg.isMetricsEnabled()
                ? new PipelineMetrics(new SimpleMeterRegistry())
                : PipelineMetrics.disabled();
        PipelineContext context = PipelineContext.from(cfg, key, metrics);

        JdbcDocumentSource source = new JdbcDocumentSource(connections, cfg.getTables().documents);
        JdbcPositionalIndexWriter writer = new JdbcPositionalIndexWriter(
                connections, dialect, cfg.getTables().index, cfg.getBatchSize());

        log.debug("Bootstrapped {} with {}", dialect, context);
        return new Components(cfg, connections, source, writer, context);
    }

    private AppBootstrap() {}
}
