package com.posidx.api;

import com.posidx.config.EncryptionSecret;
import com.posidx.config.SystemConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Map;

/**
 * Command-line entry point: one full rebuild of the positional index, then exit.
 *
 * <pre>
 *   ENCRYPTION_KEY=... java -jar api.jar [--config path/to/config.json]
 * </pre>
 */
public final class IndexerApplication {

    private static final Logger log = LoggerFactory.getLogger(IndexerApplication.class);

    public static void main(String[] args) {
        int code = run(args, System.getenv(), System.out, System.err);
        System.exit(code);
    }

    /** @return process exit status, 0 for a completed or no-op run and 1 for any failure */
    static int run(String[] args, Map<String, String> env, PrintStream out, PrintStream err) {
        try {
            String configPath = parseConfigPath(args);
            SystemConfig cfg = SystemConfig.resolve(configPath, env);
            EncryptionSecret secret = EncryptionSecret.fromEnvironment(env);

            AppBootstrap.Components components = AppBootstrap.init(cfg, secret);
            PipelineReport report = components.pipeline().run();
            components.consoleReport().print(report, components.context.getMetrics(), out);
            return 0;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            e.printStackTrace(err);
            log.error("Index build failed: {}", e.getMessage());
            return 1;
        }
    }

    static String parseConfigPath(String[] args) {
        if (args == null) return null;
        String path = null;
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if ("--config".equals(a)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a path");
                }
                path = args[++i];
            } else if (a.startsWith("--config=")) {
                path = a.substring("--config=".length());
            } else {
                throw new IllegalArgumentException("Unknown argument: " + a);
            }
        }
        return path;
    }

    private IndexerApplication() {}
}
