package com.mind.dashboard.error;

import java.time.Duration;

public class DataUnavailableException extends MetricException {
    private final Duration retryAfter;

    public DataUnavailableException(String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.retryAfter = retryAfter;
    }

    public Duration retryAfter() {
        return retryAfter;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DATA_UNAVAILABLE;
    }
}
