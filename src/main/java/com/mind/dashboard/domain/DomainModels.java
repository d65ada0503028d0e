package com.mind.dashboard.domain;

import java.time.Instant;

public class DomainModels {
    public record Account(String id,
                          Role role,
                          String name,
                          String email,
                          String department,
                          String cohort,
                          Instant registeredAt) {}

    public record GradeRecord(String id,
                              String ownerId,
                              String caseStudyId,
                              Double finalScore,
                              Instant submittedAt,
                              String summary) {
        public boolean graded() {
            return finalScore != null;
        }
    }

    public record TelemetryEvent(String id,
                                 Instant timestamp,
                                 String serviceName,
                                 String route,
                                 int statusCode,
                                 Double latencyMs,
                                 boolean error,
                                 String aiModel,
                                 Long aiTokens) {}

    public record CaseStudy(String id, String title) {}

    public enum RecordType { ACCOUNT, GRADE, TELEMETRY }
}
