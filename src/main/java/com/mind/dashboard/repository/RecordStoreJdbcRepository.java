package com.mind.dashboard.repository;

import com.mind.dashboard.domain.DomainModels.Account;
import com.mind.dashboard.domain.DomainModels.CaseStudy;
import com.mind.dashboard.domain.DomainModels.GradeRecord;
import com.mind.dashboard.domain.DomainModels.TelemetryEvent;
import com.mind.dashboard.domain.Role;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

@Repository
public class RecordStoreJdbcRepository implements RecordStore {
    private static final String RANGE = "(CAST(? AS TIMESTAMP WITH TIME ZONE) IS NULL OR %1$s >= ?) " +
            "AND (CAST(? AS TIMESTAMP WITH TIME ZONE) IS NULL OR %1$s < ?)";
    private static final String EQ = "(CAST(? AS VARCHAR) IS NULL OR %s = ?)";

    private final JdbcTemplate jdbcTemplate;

    public RecordStoreJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Account> accounts(TimeRange range, RecordFilter filter) {
        return jdbcTemplate.query(
                "SELECT id, role, name, email, department, cohort, registered_at FROM accounts WHERE " +
                        RANGE.formatted("registered_at") + " AND " + EQ.formatted("id") + " AND " +
                        EQ.formatted("department") + " AND " + EQ.formatted("cohort") + " ORDER BY id",
                (rs, n) -> new Account(
                        rs.getString(1), Role.fromValue(rs.getString(2)), rs.getString(3), rs.getString(4),
                        rs.getString(5), rs.getString(6), instant(rs, 7)
                ),
                from(range), from(range), to(range), to(range),
                filter.ownerId(), filter.ownerId(),
                filter.department(), filter.department(),
                filter.cohort(), filter.cohort()
        );
    }

    @Override
    public List<GradeRecord> gradeRecords(TimeRange range, RecordFilter filter) {
        return jdbcTemplate.query(
                "SELECT g.id, g.owner_id, g.case_study_id, g.final_score, g.submitted_at, g.summary " +
                        "FROM grade_records g LEFT JOIN accounts a ON a.id = g.owner_id WHERE " +
                        RANGE.formatted("g.submitted_at") + " AND " + EQ.formatted("g.owner_id") + " AND " +
                        EQ.formatted("g.case_study_id") + " AND " + EQ.formatted("a.department") + " AND " +
                        EQ.formatted("a.cohort") + " ORDER BY g.submitted_at, g.id",
                (rs, n) -> new GradeRecord(
                        rs.getString(1), rs.getString(2), rs.getString(3),
                        rs.getObject(4, Double.class), instant(rs, 5), rs.getString(6)
                ),
                from(range), from(range), to(range), to(range),
                filter.ownerId(), filter.ownerId(),
                filter.caseStudyId(), filter.caseStudyId(),
                filter.department(), filter.department(),
                filter.cohort(), filter.cohort()
        );
    }

    @Override
    public List<TelemetryEvent> telemetryEvents(TimeRange range, RecordFilter filter) {
        return jdbcTemplate.query(
                "SELECT id, ts, service_name, http_route, status_code, latency_ms, is_error, ai_model, ai_tokens " +
                        "FROM telemetry_events WHERE " + RANGE.formatted("ts") + " AND " +
                        EQ.formatted("service_name") + " ORDER BY ts, id",
                (rs, n) -> new TelemetryEvent(
                        rs.getString(1), instant(rs, 2), rs.getString(3), rs.getString(4), rs.getInt(5),
                        rs.getObject(6, Double.class), rs.getBoolean(7), rs.getString(8), rs.getObject(9, Long.class)
                ),
                from(range), from(range), to(range), to(range),
                filter.serviceName(), filter.serviceName()
        );
    }

    @Override
    public List<CaseStudy> caseStudies() {
        return jdbcTemplate.query(
                "SELECT id, title FROM case_studies ORDER BY id",
                (rs, n) -> new CaseStudy(rs.getString(1), rs.getString(2))
        );
    }

    private static OffsetDateTime from(TimeRange range) {
        return range.from() == null ? null : range.from().atOffset(ZoneOffset.UTC);
    }

    private static OffsetDateTime to(TimeRange range) {
        return range.to() == null ? null : range.to().atOffset(ZoneOffset.UTC);
    }

    private static Instant instant(ResultSet rs, int column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
