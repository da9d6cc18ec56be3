package com.flagship.custody_ledger.access;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcLedgerDirectory implements LedgerDirectory {

    private static final String SELECT_LEDGER =
            "SELECT id, kind, name, owner, created_at FROM ledgers WHERE id = ?";

    private static final RowMapper<LedgerInstance> LEDGER_ROW_MAPPER = (rs, rowNum) -> new LedgerInstance(
            rs.getObject("id", UUID.class),
            LedgerKind.valueOf(rs.getString("kind")),
            rs.getString("name"),
            rs.getString("owner"),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void insert(LedgerInstance ledger) {
        jdbcTemplate.update(
                "INSERT INTO ledgers (id, kind, name, owner, created_at) VALUES (?, ?, ?, ?, ?)",
                ledger.getId(),
                ledger.getKind().name(),
                ledger.getName(),
                ledger.getOwner(),
                Timestamp.from(ledger.getCreatedAt())
        );
    }

    @Override
    public Optional<LedgerInstance> find(UUID ledgerId) {
        return jdbcTemplate.query(SELECT_LEDGER, LEDGER_ROW_MAPPER, ledgerId).stream().findFirst();
    }

    @Override
    public Optional<LedgerInstance> findForUpdate(UUID ledgerId) {
        return jdbcTemplate.query(SELECT_LEDGER + " FOR UPDATE", LEDGER_ROW_MAPPER, ledgerId)
                .stream()
                .findFirst();
    }

    @Override
    public void updateOwner(UUID ledgerId, String newOwner) {
        jdbcTemplate.update("UPDATE ledgers SET owner = ? WHERE id = ?", newOwner, ledgerId);
    }

    @Override
    public boolean isMember(UUID ledgerId, String principal) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM ledger_members WHERE ledger_id = ? AND principal = ?",
                Integer.class,
                ledgerId,
                principal
        );
        return count != null && count > 0;
    }

    @Override
    public boolean addMember(UUID ledgerId, String principal, Instant addedAt) {
        int inserted = jdbcTemplate.update(
                "INSERT INTO ledger_members (ledger_id, principal, added_at) VALUES (?, ?, ?) " +
                "ON CONFLICT (ledger_id, principal) DO NOTHING",
                ledgerId,
                principal,
                Timestamp.from(addedAt)
        );
        return inserted == 1;
    }

    @Override
    public boolean removeMember(UUID ledgerId, String principal) {
        int deleted = jdbcTemplate.update(
                "DELETE FROM ledger_members WHERE ledger_id = ? AND principal = ?",
                ledgerId,
                principal
        );
        return deleted == 1;
    }

    @Override
    public List<String> members(UUID ledgerId) {
        return jdbcTemplate.queryForList(
                "SELECT principal FROM ledger_members WHERE ledger_id = ? ORDER BY added_at, principal",
                String.class,
                ledgerId
        );
    }
}
