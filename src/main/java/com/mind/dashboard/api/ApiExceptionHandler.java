package com.mind.dashboard.api;

import com.mind.dashboard.catalog.MetricModels.MetricError;
import com.mind.dashboard.error.ErrorKind;
import com.mind.dashboard.error.MetricException;
import com.mind.dashboard.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MetricException.class)
    public ResponseEntity<MetricError> handleMetricException(MetricException ex) {
        log.debug("Request rejected: {}", ex.getMessage());
        String parameter = ex instanceof ValidationException v ? v.parameter() : null;
        return ResponseEntity.status(MetricController.statusOf(ex.kind()))
                .body(new MetricError(ex.kind(), ex.getMessage(), parameter, null));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<MetricError> handleMissingHeader(MissingRequestHeaderException ex) {
        return ResponseEntity.status(MetricController.statusOf(ErrorKind.AUTHORIZATION))
                .body(new MetricError(ErrorKind.AUTHORIZATION, "Missing header " + ex.getHeaderName(), null, null));
    }
}
