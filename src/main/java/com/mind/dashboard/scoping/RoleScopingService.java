package com.mind.dashboard.scoping;

import com.mind.dashboard.catalog.EffectiveFilters;
import com.mind.dashboard.catalog.MetricDefinition;
import com.mind.dashboard.catalog.MetricParams;
import com.mind.dashboard.catalog.Param;
import com.mind.dashboard.config.DashboardProperties;
import com.mind.dashboard.domain.DomainModels.RecordType;
import com.mind.dashboard.domain.Role;
import com.mind.dashboard.error.AuthorizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RoleScopingService {
    private static final Logger log = LoggerFactory.getLogger(RoleScopingService.class);

    private final DashboardProperties properties;

    public RoleScopingService(DashboardProperties properties) {
        this.properties = properties;
    }

    public void requireCaller(CallerContext caller) {
        if (caller == null || caller.role() == null || caller.identity() == null || caller.identity().isBlank()) {
            throw new AuthorizationException("Caller identity and role are required");
        }
    }

    public void guardOwnership(MetricParams params, CallerContext caller) {
        requireCaller(caller);
        if (caller.role() != Role.STUDENT) return;
        if (params.owner() != null && !params.owner().equals(caller.identity())) {
            log.warn("Student {} requested data owned by {}", caller.identity(), params.owner());
            throw new AuthorizationException("Students may only read their own records");
        }
        if (params.department() != null || params.cohort() != null) {
            throw new AuthorizationException("Students may not filter by department or cohort");
        }
    }

    public EffectiveFilters scope(MetricDefinition definition, MetricParams params, CallerContext caller) {
        guardOwnership(params, caller);
        Role role = caller.role();

        if (!definition.visibleTo(role)) {
            if (role == Role.DEVELOPER && definition.recordType() != RecordType.TELEMETRY) {
                throw new AuthorizationException("Scope violation: developer role may only read telemetry metrics, not '" + definition.id() + "'");
            }
            throw new AuthorizationException("Role '" + role.value() + "' may not read metric '" + definition.id() + "'");
        }

        String owner = params.owner();
        if (role == Role.STUDENT) {
            if (definition.recordType() != RecordType.GRADE) {
                throw new AuthorizationException("Students may only read grade metrics");
            }
            owner = caller.identity();
        }

        MetricDefinition.Defaults defaults = definition.defaults();
        return new EffectiveFilters(
                params.window() != null ? params.window() : definition.defaultWindow(),
                definition.accepts(Param.OWNER) ? owner : null,
                definition.accepts(Param.DEPARTMENT) ? params.department() : null,
                definition.accepts(Param.COHORT) ? params.cohort() : null,
                definition.accepts(Param.CASE_STUDY) ? params.caseStudy() : null,
                definition.accepts(Param.SERVICE) ? params.service() : null,
                definition.accepts(Param.THRESHOLD) ? firstNonNull(params.threshold(), defaults.threshold(), properties.defaultAtRiskThreshold()) : null,
                definition.accepts(Param.GRANULARITY) ? firstNonNull(params.granularity(), defaults.granularity()) : null,
                definition.accepts(Param.LIMIT) ? firstNonNull(params.limit(), defaults.limit()) : null,
                definition.accepts(Param.WINDOW_SIZE) ? firstNonNull(params.windowSize(), defaults.windowSize()) : null,
                definition.accepts(Param.SLA_MS) ? firstNonNull(params.slaMs(), defaults.slaMs()) : null,
                definition.accepts(Param.SEARCH) ? params.search() : null
        );
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... candidates) {
        for (T candidate : candidates) {
            if (candidate != null) return candidate;
        }
        return null;
    }
}
