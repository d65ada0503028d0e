package com.mind.dashboard.repository;

public record RecordFilter(String ownerId,
                           String department,
                           String cohort,
                           String caseStudyId,
                           String serviceName) {
    public static final RecordFilter NONE = new RecordFilter(null, null, null, null, null);
}
