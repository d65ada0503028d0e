package com.mind.dashboard.error;

public class AuthorizationException extends MetricException {

    public AuthorizationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.AUTHORIZATION;
    }
}
