package com.shelfkeep.loanservice.infrastructure.persistence;

import com.shelfkeep.loanservice.domain.model.Member;
import com.shelfkeep.loanservice.domain.port.MemberDirectory;
import com.shelfkeep.security.Role;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** {@link MemberDirectory} over the {@code members} table. */
@Repository
public class JdbcMemberDirectory implements MemberDirectory {

    private static final String SELECT_MEMBER =
            "SELECT id, tenant_id, role FROM members WHERE id = :id";

    private static final RowMapper<Member> MEMBER_MAPPER =
            (rs, rowNum) -> {
                String role = rs.getString("role");
                return new Member(
                        rs.getString("id"),
                        rs.getString("tenant_id"),
                        Role.fromString(role)
                                .orElseThrow(
                                        () -> new IllegalStateException("Unknown member role: " + role)));
            };

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcMemberDirectory(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Member> find(String memberId) {
        return jdbc.query(SELECT_MEMBER, Map.of("id", memberId), MEMBER_MAPPER).stream().findFirst();
    }

    @Override
    public Optional<Member> lockForBorrowing(String memberId) {
        return jdbc.query(SELECT_MEMBER + " FOR UPDATE", Map.of("id", memberId), MEMBER_MAPPER)
                .stream()
                .findFirst();
    }
}
