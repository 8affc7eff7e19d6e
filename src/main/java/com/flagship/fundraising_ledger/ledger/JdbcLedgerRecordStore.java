package com.flagship.fundraising_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL record store for the income and expenses tables.
 *
 * Plain JDBC, no ORM: the amount column is read back as text so the
 * engine's coercion boundary decides what counts as a valid number.
 * Every statement is scoped by club id, so one club can never read or
 * change another club's rows through this store.
 */
@Repository
@Slf4j
public class JdbcLedgerRecordStore implements LedgerRecordStore {

    private static final String INCOME_COLUMNS =
            "id, club_id, campaign_id, event_id, source, description, amount::text AS amount, date, " +
            "payment_method, reference, idempotency_key, created_at, updated_at";

    private static final String EXPENSE_COLUMNS =
            "id, club_id, campaign_id, event_id, category, description, amount::text AS amount, date, " +
            "vendor, payment_method, status, receipt_url, created_by, idempotency_key, created_at, updated_at";

    private static final String ORDERING = " ORDER BY date DESC, created_at DESC, id";

    private final JdbcTemplate jdbcTemplate;

    public JdbcLedgerRecordStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public StoredEntry createEntry(StoredEntry entry) {
        if (entry.getKind() == EntryKind.INCOME) {
            jdbcTemplate.update(
                "INSERT INTO income (id, club_id, campaign_id, event_id, source, description, amount, date, " +
                "payment_method, reference, idempotency_key, created_at, updated_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, CAST(? AS NUMERIC), ?, ?, ?, ?, ?, ?)",
                entry.getId(), entry.getClubId(), entry.getCampaignId(), entry.getEventId(),
                entry.getLabel(), entry.getDescription(), entry.getAmount(), Date.valueOf(entry.getDate()),
                entry.getPaymentMethod(), entry.getReference(), entry.getIdempotencyKey(),
                Timestamp.from(entry.getCreatedAt()), Timestamp.from(entry.getUpdatedAt())
            );
        } else {
            jdbcTemplate.update(
                "INSERT INTO expenses (id, club_id, campaign_id, event_id, category, description, amount, date, " +
                "vendor, payment_method, status, receipt_url, created_by, idempotency_key, created_at, updated_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, CAST(? AS NUMERIC), ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                entry.getId(), entry.getClubId(), entry.getCampaignId(), entry.getEventId(),
                entry.getLabel(), entry.getDescription(), entry.getAmount(), Date.valueOf(entry.getDate()),
                entry.getVendor(), entry.getPaymentMethod(), entry.getStatus(), entry.getReceiptUrl(),
                entry.getCreatedBy(), entry.getIdempotencyKey(),
                Timestamp.from(entry.getCreatedAt()), Timestamp.from(entry.getUpdatedAt())
            );
        }
        log.debug("Inserted {} row {}", entry.getKind(), entry.getId());
        return entry;
    }

    @Override
    public Optional<StoredEntry> updateEntry(StoredEntry entry) {
        int updated;
        if (entry.getKind() == EntryKind.INCOME) {
            updated = jdbcTemplate.update(
                "UPDATE income SET source = ?, description = ?, amount = CAST(? AS NUMERIC), date = ?, " +
                "payment_method = ?, reference = ?, updated_at = ? WHERE id = ? AND club_id = ?",
                entry.getLabel(), entry.getDescription(), entry.getAmount(), Date.valueOf(entry.getDate()),
                entry.getPaymentMethod(), entry.getReference(), Timestamp.from(entry.getUpdatedAt()),
                entry.getId(), entry.getClubId()
            );
        } else {
            updated = jdbcTemplate.update(
                "UPDATE expenses SET category = ?, description = ?, amount = CAST(? AS NUMERIC), date = ?, " +
                "vendor = ?, payment_method = ?, status = ?, receipt_url = ?, updated_at = ? " +
                "WHERE id = ? AND club_id = ?",
                entry.getLabel(), entry.getDescription(), entry.getAmount(), Date.valueOf(entry.getDate()),
                entry.getVendor(), entry.getPaymentMethod(), entry.getStatus(), entry.getReceiptUrl(),
                Timestamp.from(entry.getUpdatedAt()), entry.getId(), entry.getClubId()
            );
        }
        if (updated == 0) {
            return Optional.empty();
        }
        return findEntry(entry.getKind(), entry.getId(), entry.getClubId());
    }

    @Override
    public boolean deleteEntry(EntryKind kind, UUID entryId, UUID clubId) {
        int deleted = jdbcTemplate.update(
            "DELETE FROM " + kind.getTable() + " WHERE id = ? AND club_id = ?",
            entryId, clubId
        );
        return deleted > 0;
    }

    @Override
    public Optional<StoredEntry> findEntry(EntryKind kind, UUID entryId, UUID clubId) {
        List<StoredEntry> rows = jdbcTemplate.query(
            "SELECT " + columns(kind) + " FROM " + kind.getTable() + " WHERE id = ? AND club_id = ?",
            rowMapper(kind), entryId, clubId
        );
        return rows.stream().findFirst();
    }

    @Override
    public Optional<StoredEntry> findByIdempotencyKey(EntryKind kind, UUID clubId, String idempotencyKey) {
        List<StoredEntry> rows = jdbcTemplate.query(
            "SELECT " + columns(kind) + " FROM " + kind.getTable() +
            " WHERE club_id = ? AND idempotency_key = ?",
            rowMapper(kind), clubId, idempotencyKey
        );
        return rows.stream().findFirst();
    }

    @Override
    public List<StoredEntry> listEntriesForClub(EntryKind kind, UUID clubId) {
        return jdbcTemplate.query(
            "SELECT " + columns(kind) + " FROM " + kind.getTable() +
            " WHERE club_id = ? AND campaign_id IS NULL AND event_id IS NULL" + ORDERING,
            rowMapper(kind), clubId
        );
    }

    @Override
    public List<StoredEntry> listEntriesForCampaign(EntryKind kind, UUID campaignId) {
        return jdbcTemplate.query(
            "SELECT " + columns(kind) + " FROM " + kind.getTable() + " WHERE campaign_id = ?" + ORDERING,
            rowMapper(kind), campaignId
        );
    }

    @Override
    public List<StoredEntry> listEntriesForEvent(EntryKind kind, UUID eventId) {
        return jdbcTemplate.query(
            "SELECT " + columns(kind) + " FROM " + kind.getTable() + " WHERE event_id = ?" + ORDERING,
            rowMapper(kind), eventId
        );
    }

    private static String columns(EntryKind kind) {
        return kind == EntryKind.INCOME ? INCOME_COLUMNS : EXPENSE_COLUMNS;
    }

    private RowMapper<StoredEntry> rowMapper(EntryKind kind) {
        return (rs, rowNum) -> {
            StoredEntry.StoredEntryBuilder builder = StoredEntry.builder()
                .id(rs.getObject("id", UUID.class))
                .kind(kind)
                .clubId(rs.getObject("club_id", UUID.class))
                .campaignId(rs.getObject("campaign_id", UUID.class))
                .eventId(rs.getObject("event_id", UUID.class))
                .label(rs.getString(kind.getLabelColumn()))
                .description(rs.getString("description"))
                .amount(rs.getString("amount"))
                .date(rs.getDate("date").toLocalDate())
                .paymentMethod(rs.getString("payment_method"))
                .idempotencyKey(rs.getString("idempotency_key"))
                .createdAt(toInstant(rs, "created_at"))
                .updatedAt(toInstant(rs, "updated_at"));
            if (kind == EntryKind.INCOME) {
                builder.reference(rs.getString("reference"));
            } else {
                builder.vendor(rs.getString("vendor"))
                    .status(rs.getString("status"))
                    .receiptUrl(rs.getString("receipt_url"))
                    .createdBy(rs.getString("created_by"));
            }
            return builder.build();
        };
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
