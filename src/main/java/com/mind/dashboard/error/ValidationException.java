package com.mind.dashboard.error;

public class ValidationException extends MetricException {
    private final String parameter;

    public ValidationException(String message) {
        this(null, message);
    }

    public ValidationException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
