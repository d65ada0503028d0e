package com.mind.dashboard;

import com.mind.dashboard.domain.DomainModels.Account;
import com.mind.dashboard.domain.DomainModels.CaseStudy;
import com.mind.dashboard.domain.DomainModels.GradeRecord;
import com.mind.dashboard.domain.DomainModels.TelemetryEvent;
import com.mind.dashboard.error.DataUnavailableException;
import com.mind.dashboard.repository.GuardedRecordStore;
import com.mind.dashboard.repository.RecordFilter;
import com.mind.dashboard.repository.RecordStore;
import com.mind.dashboard.repository.TimeRange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class GuardedRecordStoreTest {
    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void slowStoreTimesOutAsDataUnavailable() {
        var store = new GuardedRecordStore(new StubStore() {
            @Override
            public List<GradeRecord> gradeRecords(TimeRange range, RecordFilter filter) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of();
            }
        }, executor, Duration.ofMillis(100), Duration.ofSeconds(30));

        var ex = assertThrows(DataUnavailableException.class, () -> store.gradeRecords(TimeRange.UNBOUNDED, RecordFilter.NONE));
        assertEquals(Duration.ofSeconds(30), ex.retryAfter());
    }

    @Test
    void dataAccessFailureIsDataUnavailable() {
        var store = new GuardedRecordStore(new StubStore() {
            @Override
            public List<CaseStudy> caseStudies() {
                throw new DataAccessResourceFailureException("connection refused");
            }
        }, executor, Duration.ofSeconds(1), Duration.ofSeconds(15));

        var ex = assertThrows(DataUnavailableException.class, store::caseStudies);
        assertEquals(Duration.ofSeconds(15), ex.retryAfter());
    }

    @Test
    void fastStoreResultsPassThrough() {
        var store = new GuardedRecordStore(new StubStore() {
            @Override
            public List<CaseStudy> caseStudies() {
                return List.of(new CaseStudy("cs-1", "Supply chain"));
            }
        }, executor, Duration.ofSeconds(1), Duration.ofSeconds(15));

        assertEquals(List.of(new CaseStudy("cs-1", "Supply chain")), store.caseStudies());
    }

    private static class StubStore implements RecordStore {
        @Override
        public List<Account> accounts(TimeRange range, RecordFilter filter) {
            return List.of();
        }

        @Override
        public List<GradeRecord> gradeRecords(TimeRange range, RecordFilter filter) {
            return List.of();
        }

        @Override
        public List<TelemetryEvent> telemetryEvents(TimeRange range, RecordFilter filter) {
            return List.of();
        }

        @Override
        public List<CaseStudy> caseStudies() {
            return List.of();
        }
    }
}
