package com.my.bridge.domain.exception;

public enum ValidationError {
    SAME_SERVER,
    DUPLICATE_CONNECTION,
    QUOTA_EXCEEDED,
    UNKNOWN_SETTING,
    INVALID_SETTING_VALUE,
    RETENTION_TOO_SHORT,
    INVALID_ARGUMENT
}
