package com.posidx.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.posidx.common.FailurePolicy;
import com.posidx.common.db.SqlDialect;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Configuration of an index build.
 *
 * - Loaded from JSON via {@link #load(String, boolean)}, cached per real path.
 * - {@link #resolve(String, Map)} layers environment overrides on top of the file (or the defaults).
 * - The decryption secret is never part of this object, see {@link EncryptionSecret}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SystemConfig {

    private static final int MAX_BATCH_SIZE  = 100_000;
    private static final int MAX_PARALLELISM = 256;
    private static final int MAX_SAMPLE      = 1_000;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Per-path cache for loaded configs. */
    private static final ConcurrentMap<String, SystemConfig> configCache = new ConcurrentHashMap<>();

    /* ======================== Top-level fields ======================== */

    @JsonProperty("batchSize")
    private int batchSize = 1000;

    /** 0 means one worker per available processor. */
    @JsonProperty("parallelism")
    private int parallelism = 0;

    @JsonProperty("sampleSize")
    private int sampleSize = 10;

    @JsonProperty("samplePositions")
    private int samplePositions = 10;

    @JsonProperty("failurePolicy")
    private FailurePolicy failurePolicy = FailurePolicy.FAIL_FAST;

    @JsonProperty("metricsEnabled")
    private boolean metricsEnabled = true;

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("tables")
    private TablesConfig tables = new TablesConfig();

    /* ======================== Static loading API ======================== */

    public static SystemConfig load(String path, boolean refresh) throws ConfigLoadException {
        Objects.requireNonNull(path, "Config path cannot be null");
        String key;
        try {
            Path p = Paths.get(path).toAbsolutePath().normalize();
            if (Files.exists(p)) {
                p = p.toRealPath();
            }
            key = p.toString();
        } catch (Exception e) {
            throw new ConfigLoadException("Invalid config path: " + path, e);
        }

        if (!refresh) {
            SystemConfig cached = configCache.get(key);
            if (cached != null) return cached;
        }

        SystemConfig cfg;
        try {
            Path p = Paths.get(key);
            if (!Files.isRegularFile(p) || !Files.isReadable(p)) {
                throw new IOException("Config file not found or not readable: " + key);
            }
            cfg = MAPPER.readValue(p.toFile(), SystemConfig.class);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read/parse SystemConfig from " + key, e);
        }

        cfg.validate();
        configCache.put(key, cfg);
        return cfg;
    }

    /**
     * Loads {@code path} (or starts from the defaults when it is null) and applies environment overrides.
     * The cached instance is never modified; overrides go to a copy.
     */
    public static SystemConfig resolve(String path, Map<String, String> env) throws ConfigLoadException {
        SystemConfig base = (path == null || path.isBlank()) ? new SystemConfig() : load(path, false);
        SystemConfig cfg = base.copy();
        cfg.applyEnvironment(env == null ? Map.of() : env);
        cfg.validate();
        return cfg;
    }

    public static void clearCache() {
        configCache.clear();
    }

    SystemConfig copy() {
        return MAPPER.convertValue(this, SystemConfig.class);
    }

    void applyEnvironment(Map<String, String> env) throws ConfigLoadException {
        DatabaseConfig db = database;
        db.url      = envOr(env, "DB_URL", db.url);
        db.host     = envOr(env, "DB_HOST", db.host);
        db.port     = envInt(env, "DB_PORT", db.port);
        db.name     = envOr(env, "DB_NAME", db.name);
        db.user     = envOr(env, "DB_USER", db.user);
        db.password = envOr(env, "DB_PASSWORD", db.password);

        batchSize   = envInt(env, "INDEX_BATCH_SIZE", batchSize);
        parallelism = envInt(env, "INDEX_PARALLELISM", parallelism);

        String policy = env.get("INDEX_FAILURE_POLICY");
        if (policy != null && !policy.isBlank()) {
            try {
                failurePolicy = FailurePolicy.parse(policy);
            } catch (IllegalArgumentException e) {
                throw new ConfigLoadException("Invalid INDEX_FAILURE_POLICY: " + policy, e);
            }
        }
    }

    private void validate() throws ConfigLoadException {
        if (database == null) database = new DatabaseConfig();
        if (tables == null) tables = new TablesConfig();
        if (failurePolicy == null) failurePolicy = FailurePolicy.FAIL_FAST;

        batchSize       = clamp(batchSize, 1, MAX_BATCH_SIZE);
        parallelism     = clamp(parallelism, 0, MAX_PARALLELISM);
        sampleSize      = clamp(sampleSize, 0, MAX_SAMPLE);
        samplePositions = clamp(samplePositions, 1, MAX_SAMPLE);

        try {
            SqlDialect.checkIdentifier(tables.documents);
            SqlDialect.checkIdentifier(tables.index);
            SqlDialect.fromJdbcUrl(database.jdbcUrl());
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(e.getMessage(), e);
        }
        if (database.port < 1 || database.port > 65_535) {
            throw new ConfigLoadException("Invalid database port: " + database.port, null);
        }
    }

    /* ======================== Getters ======================== */

    public int getBatchSize() {
        return clamp(batchSize, 1, MAX_BATCH_SIZE);
    }

    /** Worker count for the map phase, never below one. */
    public int getEffectiveParallelism() {
        return parallelism > 0 ? parallelism : Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getSamplePositions() {
        return samplePositions;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public DatabaseConfig getDatabase() {
        return database;
    }

    public TablesConfig getTables() {
        return tables;
    }

    /* ======================== Helpers ======================== */

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    private static String envOr(Map<String, String> env, String name, String current) {
        String v = env.get(name);
        return (v != null && !v.isBlank()) ? v.trim() : current;
    }

    private static int envInt(Map<String, String> env, String name, int current) throws ConfigLoadException {
        String v = env.get(name);
        if (v == null || v.isBlank()) return current;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Environment variable " + name + " is not an integer: " + v, e);
        }
    }

    /* ======================== Nested sections ======================== */

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DatabaseConfig {
        /** Full JDBC URL; when set, host/port/name are ignored. */
        @JsonProperty("url")
        public String url;

        @JsonProperty("host")
        public String host = "localhost";

        @JsonProperty("port")
        public int port = 5432;

        @JsonProperty("name")
        public String name = "ir_system";

        @JsonProperty("user")
        public String user = "postgres";

        @JsonProperty("password")
        public String password = "";

        public String jdbcUrl() {
            if (url != null && !url.isBlank()) {
                return url;
            }
            return "jdbc:postgresql://" + host + ":" + port + "/" + name;
        }

        @Override
        public String toString() {
            // password stays out of logs
            return "DatabaseConfig{url=" + jdbcUrl() + ", user=" + user + '}';
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TablesConfig {
        @JsonProperty("documents")
        public String documents = "documents";

        @JsonProperty("index")
        public String index = "positional_index";
    }

    /* ======================== Exception type ======================== */

    /**
     * Fatal configuration problem, reported before any document is read.
     */
    public static class ConfigLoadException extends Exception {
        private static final long serialVersionUID = 1L;

        public ConfigLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
