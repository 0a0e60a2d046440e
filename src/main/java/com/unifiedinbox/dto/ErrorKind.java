package com.unifiedinbox.dto;

/**
 * Classification of a failed sync attempt, consumed by the retry policy.
 */
public enum ErrorKind {
    TRANSIENT,
    AUTH_EXPIRED,
    PERMANENT
}
