package com.flagship.custody_ledger.store;

import com.flagship.custody_ledger.record.CustodyRecord;
import com.flagship.custody_ledger.record.RecordKind;
import com.flagship.custody_ledger.record.RecordStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed record store.
 *
 * Rows are never deleted. A terminal record keeps its key forever, which is what
 * makes keys single-use per ledger.
 */
@Repository
@RequiredArgsConstructor
public class JdbcRecordStore implements RecordStore {

    private static final String COLUMNS = """
            ledger_id, record_key, kind, status, value, unit_amount, capacity, admitted,
            beneficiary, depositor, parent_key, payload, closing_note,
            created_at, expires_at, updated_at, version
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public Optional<CustodyRecord> find(UUID ledgerId, String key) {
        final String sql = "SELECT " + COLUMNS + """
                FROM custody_records
                WHERE ledger_id = :ledgerId AND record_key = :key
                """;
        return jdbcTemplate.query(sql, keyParams(ledgerId, key), this::mapRow).stream().findFirst();
    }

    @Override
    public Optional<CustodyRecord> findForUpdate(UUID ledgerId, String key) {
        final String sql = "SELECT " + COLUMNS + """
                FROM custody_records
                WHERE ledger_id = :ledgerId AND record_key = :key
                FOR UPDATE
                """;
        return jdbcTemplate.query(sql, keyParams(ledgerId, key), this::mapRow).stream().findFirst();
    }

    @Override
    public boolean insert(CustodyRecord record) {
        final String sql = """
                INSERT INTO custody_records (
                    ledger_id, record_key, kind, status, value, unit_amount, capacity, admitted,
                    beneficiary, depositor, parent_key, payload, closing_note,
                    created_at, expires_at, updated_at, version)
                VALUES (
                    :ledgerId, :key, :kind, :status, :value, :unitAmount, :capacity, :admitted,
                    :beneficiary, :depositor, :parentKey, :payload, :closingNote,
                    :createdAt, :expiresAt, :updatedAt, :version)
                ON CONFLICT (ledger_id, record_key) DO NOTHING
                """;
        return jdbcTemplate.update(sql, recordParams(record)) == 1;
    }

    @Override
    public void update(CustodyRecord record) {
        final String sql = """
                UPDATE custody_records
                SET status = :status,
                    value = :value,
                    admitted = :admitted,
                    beneficiary = :beneficiary,
                    closing_note = :closingNote,
                    updated_at = :updatedAt,
                    version = :version
                WHERE ledger_id = :ledgerId AND record_key = :key AND version = :expectedVersion
                """;
        MapSqlParameterSource params = recordParams(record)
                .addValue("expectedVersion", record.getVersion() - 1);
        int updated = jdbcTemplate.update(sql, params);
        if (updated != 1) {
            throw new OptimisticLockingFailureException(String.format(
                    "Record %s/%s was modified concurrently (expected version %d)",
                    record.getLedgerId(), record.getKey(), record.getVersion() - 1));
        }
    }

    @Override
    public List<CustodyRecord> page(UUID ledgerId, RecordKind kind, String parentKey, int offset, int limit) {
        final String sql = "SELECT " + COLUMNS + """
                FROM custody_records
                WHERE ledger_id = :ledgerId
                  AND kind = :kind
                  AND (CAST(:parentKey AS VARCHAR) IS NULL OR parent_key = :parentKey)
                ORDER BY created_at, record_key
                OFFSET :offset
                LIMIT :limit
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("ledgerId", ledgerId)
                .addValue("kind", kind.name())
                .addValue("parentKey", parentKey)
                .addValue("offset", offset)
                .addValue("limit", limit);
        return jdbcTemplate.query(sql, params, this::mapRow);
    }

    @Override
    public BigDecimal sumValue(UUID ledgerId) {
        BigDecimal total = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(value), 0) FROM custody_records WHERE ledger_id = :ledgerId",
                new MapSqlParameterSource("ledgerId", ledgerId),
                BigDecimal.class);
        return total != null ? total : BigDecimal.ZERO;
    }

    private MapSqlParameterSource keyParams(UUID ledgerId, String key) {
        return new MapSqlParameterSource()
                .addValue("ledgerId", ledgerId)
                .addValue("key", key);
    }

    private MapSqlParameterSource recordParams(CustodyRecord record) {
        return keyParams(record.getLedgerId(), record.getKey())
                .addValue("kind", record.getKind().name())
                .addValue("status", record.getStatus().name())
                .addValue("value", record.getValue())
                .addValue("unitAmount", record.getUnitAmount())
                .addValue("capacity", record.getCapacity())
                .addValue("admitted", record.getAdmitted())
                .addValue("beneficiary", record.getBeneficiary())
                .addValue("depositor", record.getDepositor())
                .addValue("parentKey", record.getParentKey())
                .addValue("payload", record.getPayload())
                .addValue("closingNote", record.getClosingNote())
                .addValue("createdAt", Timestamp.from(record.getCreatedAt()))
                .addValue("expiresAt", toTimestamp(record.getExpiresAt()))
                .addValue("updatedAt", Timestamp.from(record.getUpdatedAt()))
                .addValue("version", record.getVersion());
    }

    private CustodyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp expiresAt = rs.getTimestamp("expires_at");
        return CustodyRecord.builder()
                .ledgerId(rs.getObject("ledger_id", UUID.class))
                .key(rs.getString("record_key"))
                .kind(RecordKind.valueOf(rs.getString("kind")))
                .status(RecordStatus.valueOf(rs.getString("status")))
                .value(rs.getBigDecimal("value"))
                .unitAmount(rs.getBigDecimal("unit_amount"))
                .capacity(rs.getObject("capacity", Integer.class))
                .admitted(rs.getInt("admitted"))
                .beneficiary(rs.getString("beneficiary"))
                .depositor(rs.getString("depositor"))
                .parentKey(rs.getString("parent_key"))
                .payload(rs.getString("payload"))
                .closingNote(rs.getString("closing_note"))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .expiresAt(expiresAt != null ? expiresAt.toInstant() : null)
                .updatedAt(rs.getTimestamp("updated_at").toInstant())
                .version(rs.getLong("version"))
                .build();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
