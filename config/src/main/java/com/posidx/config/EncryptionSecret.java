package com.posidx.config;

import java.util.Map;
import java.util.Objects;

/**
 * The operator-supplied decryption secret. Read from the process environment only.
 */
public final class EncryptionSecret {

    public static final String ENV_VAR = "ENCRYPTION_KEY";

    private final String value;

    private EncryptionSecret(String value) {
        this.value = value;
    }

    /**
     * @throws SystemConfig.ConfigLoadException if {@value #ENV_VAR} is absent or empty; there is no default
     */
    public static EncryptionSecret fromEnvironment(Map<String, String> env) throws SystemConfig.ConfigLoadException {
        Objects.requireNonNull(env, "env cannot be null");
        String v = env.get(ENV_VAR);
        if (v == null || v.isEmpty()) {
            throw new SystemConfig.ConfigLoadException(
                    ENV_VAR + " environment variable is required to decrypt documents.", null);
        }
        return new EncryptionSecret(v);
    }

    public static EncryptionSecret of(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("secret cannot be empty");
        }
        return new EncryptionSecret(value);
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return "EncryptionSecret{***}";
    }
}
