package com.mind.dashboard.repository;

import com.mind.dashboard.domain.DomainModels.Account;
import com.mind.dashboard.domain.DomainModels.CaseStudy;
import com.mind.dashboard.domain.DomainModels.GradeRecord;
import com.mind.dashboard.domain.DomainModels.TelemetryEvent;
import com.mind.dashboard.error.DataUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

public class GuardedRecordStore implements RecordStore {
    private static final Logger log = LoggerFactory.getLogger(GuardedRecordStore.class);

    private final RecordStore delegate;
    private final ExecutorService executor;
    private final Duration timeout;
    private final Duration retryAfter;

    public GuardedRecordStore(RecordStore delegate, ExecutorService executor, Duration timeout, Duration retryAfter) {
        this.delegate = delegate;
        this.executor = executor;
        this.timeout = timeout;
        this.retryAfter = retryAfter;
    }

    @Override
    public List<Account> accounts(TimeRange range, RecordFilter filter) {
        return fetch("accounts", () -> delegate.accounts(range, filter));
    }

    @Override
    public List<GradeRecord> gradeRecords(TimeRange range, RecordFilter filter) {
        return fetch("grade_records", () -> delegate.gradeRecords(range, filter));
    }

    @Override
    public List<TelemetryEvent> telemetryEvents(TimeRange range, RecordFilter filter) {
        return fetch("telemetry_events", () -> delegate.telemetryEvents(range, filter));
    }

    @Override
    public List<CaseStudy> caseStudies() {
        return fetch("case_studies", delegate::caseStudies);
    }

    private <T> List<T> fetch(String collection, Supplier<List<T>> call) {
        Future<List<T>> future;
        try {
            future = executor.submit(call::get);
        } catch (RejectedExecutionException e) {
            throw new DataUnavailableException("Record store is not accepting requests", retryAfter, e);
        }

        try {
            return List.copyOf(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Fetch of {} exceeded {} ms, cancelled", collection, timeout.toMillis());
            throw new DataUnavailableException("Timed out reading " + collection + " after " + timeout.toMillis() + " ms", retryAfter, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DataUnavailableException("Interrupted while reading " + collection, retryAfter, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DataAccessException) {
                log.error("Record store failed reading {}", collection, cause);
                throw new DataUnavailableException("Record store unavailable while reading " + collection, retryAfter, cause);
            }
            if (cause instanceof RuntimeException runtime) throw runtime;
            throw new DataUnavailableException("Failed reading " + collection, retryAfter, cause);
        }
    }
}
