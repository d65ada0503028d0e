package com.mind.dashboard.catalog;

import com.mind.dashboard.aggregation.Aggregations;
import com.mind.dashboard.aggregation.Granularity;
import com.mind.dashboard.domain.DomainModels.Account;
import com.mind.dashboard.domain.DomainModels.CaseStudy;
import com.mind.dashboard.domain.DomainModels.GradeRecord;
import com.mind.dashboard.domain.DomainModels.TelemetryEvent;
import com.mind.dashboard.repository.RecordFilter;
import com.mind.dashboard.repository.RecordStore;
import com.mind.dashboard.repository.TimeRange;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.util.*;
import java.util.function.Function;

public class MetricContext {
    private final EffectiveFilters filters;
    private final RecordStore store;
    private final TimeRange range;
    private final DayOfWeek weekStart;
    private final ZoneId zone;

    private List<Account> accounts;
    private List<GradeRecord> grades;
    private List<TelemetryEvent> telemetry;
    private Map<String, String> caseStudyTitles;
    private Map<String, Account> accountDirectory;

    public MetricContext(EffectiveFilters filters, RecordStore store, Clock clock, DayOfWeek weekStart, ZoneId zone) {
        this.filters = filters;
        this.store = store;
        this.range = filters.window().resolve(clock, zone);
        this.weekStart = weekStart;
        this.zone = zone;
    }

    public EffectiveFilters filters() {
        return filters;
    }

    public TimeRange range() {
        return range;
    }

    public List<Account> accounts() {
        if (accounts == null) accounts = store.accounts(range, filters.recordFilter());
        return accounts;
    }

    public Map<String, Account> accountDirectory() {
        if (accountDirectory == null) {
            RecordFilter f = filters.recordFilter();
            accountDirectory = new LinkedHashMap<>();
            store.accounts(TimeRange.UNBOUNDED, new RecordFilter(f.ownerId(), f.department(), f.cohort(), null, null))
                    .forEach(a -> accountDirectory.put(a.id(), a));
        }
        return accountDirectory;
    }

    public List<GradeRecord> grades() {
        if (grades == null) grades = store.gradeRecords(range, filters.recordFilter());
        return grades;
    }

    public List<TelemetryEvent> telemetry() {
        if (telemetry == null) telemetry = store.telemetryEvents(range, filters.recordFilter());
        return telemetry;
    }

    public Map<String, String> caseStudyTitles() {
        if (caseStudyTitles == null) {
            caseStudyTitles = new LinkedHashMap<>();
            for (CaseStudy cs : store.caseStudies()) caseStudyTitles.put(cs.id(), cs.title());
        }
        return caseStudyTitles;
    }

    public Granularity granularity() {
        return filters.granularity() == null ? Granularity.DAY : filters.granularity();
    }

    public <T> TreeMap<Instant, List<T>> buckets(Collection<T> records, Function<? super T, Instant> timestampFn) {
        return Aggregations.bucketByTime(records, timestampFn, granularity(), weekStart, zone);
    }

    public String bucketLabel(Instant bucketStart) {
        return bucketStart.toString();
    }
}
