package com.mind.dashboard.api;

import com.mind.dashboard.cache.CacheStatistics;
import com.mind.dashboard.catalog.MetricModels.MetricError;
import com.mind.dashboard.catalog.MetricModels.MetricResponse;
import com.mind.dashboard.catalog.MetricModels.MetricSummary;
import com.mind.dashboard.domain.Role;
import com.mind.dashboard.error.AuthorizationException;
import com.mind.dashboard.error.ErrorKind;
import com.mind.dashboard.scoping.CallerContext;
import com.mind.dashboard.service.MetricQueryService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/metrics")
public class MetricController {
    static final String CALLER_ID_HEADER = "X-Caller-Id";
    static final String CALLER_ROLE_HEADER = "X-Caller-Role";

    private final MetricQueryService queryService;

    public MetricController(MetricQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping
    public ResponseEntity<List<MetricSummary>> catalog(@RequestHeader(CALLER_ID_HEADER) String callerId,
                                                       @RequestHeader(CALLER_ROLE_HEADER) String callerRole) {
        return ResponseEntity.ok(queryService.catalogFor(caller(callerId, callerRole)));
    }

    @GetMapping("/{metricId}")
    public ResponseEntity<MetricResponse> metric(@PathVariable String metricId,
                                                 @RequestParam Map<String, String> params,
                                                 @RequestHeader(value = CALLER_ID_HEADER, required = false) String callerId,
                                                 @RequestHeader(value = CALLER_ROLE_HEADER, required = false) String callerRole) {
        MetricResponse response;
        try {
            response = queryService.query(metricId, params, caller(callerId, callerRole));
        } catch (AuthorizationException e) {
            response = MetricResponse.failure(metricId, new MetricError(e.kind(), e.getMessage(), null, null));
        }
        if (response.ok()) return ResponseEntity.ok(response);

        ResponseEntity.BodyBuilder builder = ResponseEntity.status(statusOf(response.error().kind()));
        if (response.error().retryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(response.error().retryAfterSeconds()));
        }
        return builder.body(response);
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStatistics> cacheStatistics(@RequestHeader(CALLER_ID_HEADER) String callerId,
                                                           @RequestHeader(CALLER_ROLE_HEADER) String callerRole) {
        return ResponseEntity.ok(queryService.cacheStatistics(caller(callerId, callerRole)));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> invalidateAll(@RequestHeader(CALLER_ID_HEADER) String callerId,
                                              @RequestHeader(CALLER_ROLE_HEADER) String callerRole) {
        queryService.invalidateAll(caller(callerId, callerRole));
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/cache/{metricId}")
    public ResponseEntity<Map<String, Integer>> invalidate(@PathVariable String metricId,
                                                           @RequestHeader(CALLER_ID_HEADER) String callerId,
                                                           @RequestHeader(CALLER_ROLE_HEADER) String callerRole) {
        return ResponseEntity.ok(Map.of("invalidated", queryService.invalidate(metricId, caller(callerId, callerRole))));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case DATA_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static CallerContext caller(String callerId, String callerRole) {
        if (callerId == null || callerId.isBlank() || callerRole == null) {
            throw new AuthorizationException("Caller identity and role headers are required");
        }
        try {
            return CallerContext.of(callerId.trim(), Role.fromValue(callerRole));
        } catch (IllegalArgumentException e) {
            throw new AuthorizationException("Unknown caller role '" + callerRole + "'");
        }
    }
}
