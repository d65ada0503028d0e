package com.mind.dashboard.error;

public abstract class MetricException extends RuntimeException {

    protected MetricException(String message) {
        super(message);
    }

    protected MetricException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
