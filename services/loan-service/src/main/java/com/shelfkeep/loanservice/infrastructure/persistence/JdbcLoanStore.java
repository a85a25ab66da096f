package com.shelfkeep.loanservice.infrastructure.persistence;

import com.shelfkeep.loanservice.domain.model.Loan;
import com.shelfkeep.loanservice.domain.model.LoanStatus;
import com.shelfkeep.loanservice.domain.port.LoanStore;
import com.shelfkeep.security.TenantScope;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * {@link LoanStore} over the {@code loans} table.
 *
 * <p>Timestamps are bound and read as {@link OffsetDateTime} in UTC, which both the PostgreSQL
 * and H2 drivers map to {@code TIMESTAMP WITH TIME ZONE}.
 */
@Repository
public class JdbcLoanStore implements LoanStore {

    private static final String COLUMNS =
            "id, item_id, member_id, tenant_id, borrowed_at, due_date, returned_at, status";

    private static final String INSERT =
            "INSERT INTO loans (id, item_id, member_id, tenant_id, borrowed_at, due_date, status)"
                    + " VALUES (:id, :itemId, :memberId, :tenantId, :borrowedAt, :dueDate, :status)";

    private static final String MARK_RETURNED =
            "UPDATE loans SET status = 'returned', returned_at = :returnedAt"
                    + " WHERE id = :id AND status = 'active'";

    private static final String COUNT_ACTIVE =
            "SELECT COUNT(*) FROM loans WHERE member_id = :memberId AND status = 'active'";

    private static final RowMapper<Loan> LOAN_MAPPER =
            (rs, rowNum) ->
                    new Loan(
                            rs.getString("id"),
                            rs.getString("item_id"),
                            rs.getString("member_id"),
                            rs.getString("tenant_id"),
                            instant(rs, "borrowed_at"),
                            instant(rs, "due_date"),
                            instant(rs, "returned_at"),
                            LoanStatus.fromValue(rs.getString("status")));

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcLoanStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Loan> findById(String loanId) {
        return jdbc.query(
                        "SELECT " + COLUMNS + " FROM loans WHERE id = :id",
                        Map.of("id", loanId),
                        LOAN_MAPPER)
                .stream()
                .findFirst();
    }

    @Override
    public void insert(Loan loan) {
        if (!loan.isActive()) {
            throw new IllegalArgumentException("Only active loans are inserted: " + loan.id());
        }
        var params =
                new MapSqlParameterSource()
                        .addValue("id", loan.id())
                        .addValue("itemId", loan.itemId())
                        .addValue("memberId", loan.memberId())
                        .addValue("tenantId", loan.tenantId())
                        .addValue("borrowedAt", utc(loan.borrowedAt()))
                        .addValue("dueDate", utc(loan.dueDate()))
                        .addValue("status", loan.status().value());
        jdbc.update(INSERT, params);
    }

    @Override
    public boolean markReturned(String loanId, Instant returnedAt) {
        var params =
                new MapSqlParameterSource()
                        .addValue("id", loanId)
                        .addValue("returnedAt", utc(returnedAt));
        return jdbc.update(MARK_RETURNED, params) == 1;
    }

    @Override
    public int countActive(String memberId) {
        Integer count = jdbc.queryForObject(COUNT_ACTIVE, Map.of("memberId", memberId), Integer.class);
        return count != null ? count : 0;
    }

    @Override
    public List<Loan> findOverdue(TenantScope scope, Instant now) {
        var params = new MapSqlParameterSource().addValue("now", utc(now));
        var sql =
                new StringBuilder("SELECT ")
                        .append(COLUMNS)
                        .append(" FROM loans WHERE status = 'active' AND due_date < :now");
        if (!scope.isGlobal()) {
            sql.append(" AND tenant_id = :tenantId");
            params.addValue("tenantId", scope.tenantId());
        }
        sql.append(" ORDER BY due_date, id");
        return jdbc.query(sql.toString(), params, LOAN_MAPPER);
    }

    @Override
    public List<Loan> findByMember(String memberId) {
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM loans WHERE member_id = :memberId"
                        + " ORDER BY borrowed_at DESC, id DESC",
                Map.of("memberId", memberId),
                LOAN_MAPPER);
    }

    @Override
    public List<Loan> findByScope(TenantScope scope) {
        var params = new MapSqlParameterSource();
        var sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM loans");
        if (!scope.isGlobal()) {
            sql.append(" WHERE tenant_id = :tenantId");
            params.addValue("tenantId", scope.tenantId());
        }
        sql.append(" ORDER BY borrowed_at DESC, id DESC");
        return jdbc.query(sql.toString(), params, LOAN_MAPPER);
    }

    private static OffsetDateTime utc(Instant instant) {
        return instant != null ? OffsetDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }
}
