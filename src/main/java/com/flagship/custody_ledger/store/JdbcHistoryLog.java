package com.flagship.custody_ledger.store;

import com.flagship.custody_ledger.event.EventKind;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * History backed by the {@code history_entries} table. The sequence is a
 * database identity column, so insertion order is the commit order of appends.
 */
@Repository
@RequiredArgsConstructor
public class JdbcHistoryLog implements HistoryLog {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public HistoryEntry append(HistoryEntry entry) {
        final String sql = """
                INSERT INTO history_entries (
                    ledger_id, record_key, action, actor, counterparty, amount, reason, occurred_at)
                VALUES (
                    :ledgerId, :recordKey, :action, :actor, :counterparty, :amount, :reason, :occurredAt)
                RETURNING sequence
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("ledgerId", entry.getLedgerId())
                .addValue("recordKey", entry.getRecordKey())
                .addValue("action", entry.getAction().name())
                .addValue("actor", entry.getActor())
                .addValue("counterparty", entry.getCounterparty())
                .addValue("amount", entry.getAmount())
                .addValue("reason", entry.getReason())
                .addValue("occurredAt", Timestamp.from(entry.getOccurredAt()));
        Long sequence = jdbcTemplate.queryForObject(sql, params, Long.class);
        return entry.toBuilder().sequence(sequence).build();
    }

    @Override
    public List<HistoryEntry> recent(UUID ledgerId, int limit) {
        return page(ledgerId, null, limit).getEntries();
    }

    @Override
    public HistoryPage page(UUID ledgerId, Long beforeSequence, int limit) {
        final String sql = """
                SELECT sequence, ledger_id, record_key, action, actor, counterparty, amount, reason, occurred_at
                FROM history_entries
                WHERE ledger_id = :ledgerId
                  AND (CAST(:before AS BIGINT) IS NULL OR sequence < :before)
                ORDER BY sequence DESC
                LIMIT :limit
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("ledgerId", ledgerId)
                .addValue("before", beforeSequence)
                .addValue("limit", limit + 1);
        List<HistoryEntry> rows = jdbcTemplate.query(sql, params, this::mapRow);
        if (rows.size() <= limit) {
            return new HistoryPage(rows, null);
        }
        List<HistoryEntry> entries = rows.subList(0, limit);
        return new HistoryPage(List.copyOf(entries), entries.get(limit - 1).getSequence());
    }

    @Override
    public long size(UUID ledgerId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM history_entries WHERE ledger_id = :ledgerId",
                new MapSqlParameterSource("ledgerId", ledgerId),
                Long.class);
        return count != null ? count : 0L;
    }

    private HistoryEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
        return HistoryEntry.builder()
                .sequence(rs.getLong("sequence"))
                .ledgerId(rs.getObject("ledger_id", UUID.class))
                .recordKey(rs.getString("record_key"))
                .action(EventKind.valueOf(rs.getString("action")))
                .actor(rs.getString("actor"))
                .counterparty(rs.getString("counterparty"))
                .amount(rs.getBigDecimal("amount"))
                .reason(rs.getString("reason"))
                .occurredAt(rs.getTimestamp("occurred_at").toInstant())
                .build();
    }
}
