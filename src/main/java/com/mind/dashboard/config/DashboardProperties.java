package com.mind.dashboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

@ConfigurationProperties(prefix = "dashboard")
public record DashboardProperties(@DefaultValue("70") double defaultAtRiskThreshold,
                                  @DefaultValue("MONDAY") DayOfWeek timeBucketWeekStartDay,
                                  @DefaultValue("UTC") ZoneId zone,
                                  @DefaultValue Cache cache,
                                  @DefaultValue RecordStore recordStore) {

    public DashboardProperties {
        if (defaultAtRiskThreshold < 0 || defaultAtRiskThreshold > 100) {
            throw new IllegalStateException("dashboard.default-at-risk-threshold must be within [0,100]: " + defaultAtRiskThreshold);
        }
    }

    public record Cache(@DefaultValue("10000") long maximumSize,
                        Map<String, Long> ttlSecondsByMetric) {
        public Cache {
            ttlSecondsByMetric = ttlSecondsByMetric == null ? Map.of() : Map.copyOf(ttlSecondsByMetric);
            ttlSecondsByMetric.forEach((metric, ttl) -> {
                if (ttl == null || ttl <= 0) {
                    throw new IllegalStateException("dashboard.cache.ttl-seconds-by-metric." + metric + " must be positive");
                }
            });
        }
    }

    public record RecordStore(@DefaultValue("10s") Duration timeout,
                              @DefaultValue("8") int threads,
                              @DefaultValue("30s") Duration retryAfter) {}
}
