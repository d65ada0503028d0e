package com.mind.dashboard.catalog;

import com.mind.dashboard.catalog.MetricModels.MetricValue;

@FunctionalInterface
public interface MetricPipeline {
    MetricValue compute(MetricContext context);
}
