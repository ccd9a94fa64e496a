package com.posidx.common;

import java.util.Locale;

/**
 * What a run does when one document cannot be decrypted or decoded.
 */
public enum FailurePolicy {
    /** Abort the whole run before anything is written. The store keeps the previous index. */
    FAIL_FAST,
    /** Report the failed documents and index everything else. */
    SKIP_FAILED;

    public static FailurePolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return FAIL_FAST;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
