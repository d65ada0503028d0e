package com.mind.dashboard.catalog;

import com.mind.dashboard.aggregation.Granularity;
import com.mind.dashboard.domain.DomainModels.RecordType;
import com.mind.dashboard.domain.Role;

import java.time.Duration;
import java.util.*;

public record MetricDefinition(String id,
                               String label,
                               RecordType recordType,
                               Set<Param> parameters,
                               TimeWindow defaultWindow,
                               Duration ttl,
                               Set<Role> visibleTo,
                               Defaults defaults,
                               MetricPipeline pipeline) {

    private static final Map<RecordType, Set<Param>> BASE_PARAMS = Map.of(
            RecordType.ACCOUNT, EnumSet.of(Param.WINDOW, Param.DEPARTMENT, Param.COHORT),
            RecordType.GRADE, EnumSet.of(Param.WINDOW, Param.OWNER, Param.DEPARTMENT, Param.COHORT, Param.CASE_STUDY),
            RecordType.TELEMETRY, EnumSet.of(Param.WINDOW, Param.SERVICE)
    );

    private static final Map<RecordType, Set<Role>> BASE_VISIBILITY = Map.of(
            RecordType.ACCOUNT, EnumSet.of(Role.ADMIN, Role.FACULTY),
            RecordType.GRADE, EnumSet.of(Role.ADMIN, Role.FACULTY, Role.STUDENT),
            RecordType.TELEMETRY, EnumSet.of(Role.ADMIN, Role.DEVELOPER)
    );

    private static final Map<RecordType, Duration> BASE_TTL = Map.of(
            RecordType.ACCOUNT, Duration.ofHours(1),
            RecordType.GRADE, Duration.ofMinutes(15),
            RecordType.TELEMETRY, Duration.ofMinutes(1)
    );

    public record Defaults(Double threshold, Granularity granularity, Integer limit, Integer windowSize, Double slaMs) {
        public static final Defaults NONE = new Defaults(null, null, null, null, null);
    }

    public boolean accepts(Param param) {
        return parameters.contains(param);
    }

    public boolean visibleTo(Role role) {
        return visibleTo.contains(role);
    }

    public static Builder builder(String id, String label, RecordType recordType) {
        return new Builder(id, label, recordType);
    }

    public static final class Builder {
        private final String id;
        private final String label;
        private final RecordType recordType;
        private final Set<Param> parameters;
        private Set<Role> visibleTo;
        private TimeWindow defaultWindow = TimeWindow.ALL_TIME;
        private Duration ttl;
        private Double threshold;
        private Granularity granularity;
        private Integer limit;
        private Integer windowSize;
        private Double slaMs;
        private MetricPipeline pipeline;

        private Builder(String id, String label, RecordType recordType) {
            this.id = Objects.requireNonNull(id);
            this.label = Objects.requireNonNull(label);
            this.recordType = Objects.requireNonNull(recordType);
            this.parameters = EnumSet.copyOf(BASE_PARAMS.get(recordType));
            this.visibleTo = EnumSet.copyOf(BASE_VISIBILITY.get(recordType));
            this.ttl = BASE_TTL.get(recordType);
        }

        public Builder window(TimeWindow window) {
            this.defaultWindow = window;
            return this;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder visibleTo(Role... roles) {
            this.visibleTo = EnumSet.copyOf(Arrays.asList(roles));
            return this;
        }

        public Builder threshold(double defaultThreshold) {
            parameters.add(Param.THRESHOLD);
            this.threshold = defaultThreshold;
            return this;
        }

        public Builder configuredThreshold() {
            parameters.add(Param.THRESHOLD);
            this.threshold = null;
            return this;
        }

        public Builder granularity(Granularity defaultGranularity) {
            parameters.add(Param.GRANULARITY);
            this.granularity = defaultGranularity;
            return this;
        }

        public Builder limit(int defaultLimit) {
            parameters.add(Param.LIMIT);
            this.limit = defaultLimit;
            return this;
        }

        public Builder windowSize(int defaultWindowSize) {
            parameters.add(Param.WINDOW_SIZE);
            this.windowSize = defaultWindowSize;
            return this;
        }

        public Builder slaMs(double defaultSlaMs) {
            parameters.add(Param.SLA_MS);
            this.slaMs = defaultSlaMs;
            return this;
        }

        public Builder search() {
            parameters.add(Param.SEARCH);
            return this;
        }

        public Builder pipeline(MetricPipeline pipeline) {
            this.pipeline = pipeline;
            return this;
        }

        public MetricDefinition build() {
            if (pipeline == null) throw new IllegalStateException("Metric " + id + " has no pipeline");
            if (ttl == null || ttl.isZero() || ttl.isNegative()) throw new IllegalStateException("Metric " + id + " needs a positive TTL");
            if (parameters.contains(Param.WINDOW)) {
                parameters.add(Param.FROM);
                parameters.add(Param.TO);
            }
            return new MetricDefinition(id, label, recordType,
                    Collections.unmodifiableSet(EnumSet.copyOf(parameters)),
                    defaultWindow, ttl,
                    Collections.unmodifiableSet(EnumSet.copyOf(visibleTo)),
                    new Defaults(threshold, granularity, limit, windowSize, slaMs),
                    pipeline);
        }
    }
}
