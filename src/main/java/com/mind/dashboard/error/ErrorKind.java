package com.mind.dashboard.error;

public enum ErrorKind {
    VALIDATION,
    AUTHORIZATION,
    DATA_UNAVAILABLE,
    INTERNAL
}
