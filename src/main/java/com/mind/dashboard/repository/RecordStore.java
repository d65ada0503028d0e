package com.mind.dashboard.repository;

import com.mind.dashboard.domain.DomainModels.Account;
import com.mind.dashboard.domain.DomainModels.CaseStudy;
import com.mind.dashboard.domain.DomainModels.GradeRecord;
import com.mind.dashboard.domain.DomainModels.TelemetryEvent;

import java.util.List;

public interface RecordStore {
    List<Account> accounts(TimeRange range, RecordFilter filter);

    List<GradeRecord> gradeRecords(TimeRange range, RecordFilter filter);

    List<TelemetryEvent> telemetryEvents(TimeRange range, RecordFilter filter);

    List<CaseStudy> caseStudies();
}
