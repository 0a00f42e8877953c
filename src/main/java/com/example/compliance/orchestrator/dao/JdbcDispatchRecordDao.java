package com.example.compliance.orchestrator.dao;

import com.example.compliance.orchestrator.model.DeliveryStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcDispatchRecordDao implements DispatchRecordDao {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void insertPending(long sessionId, Instant dispatchedAt) {
        final String sql = """
                insert into dispatch_records (session_id, delivery_status, attempt_count, dispatched_at)
                values (?, 'pending', 0, ?)
                """;
        jdbcTemplate.update(sql, sessionId, Timestamp.from(dispatchedAt));
    }

    @Override
    public boolean claimForDelivery(long sessionId) {
        final String sql = """
                update dispatch_records
                set delivery_status = 'delivering',
                    attempt_count = attempt_count + 1
                where session_id = ?
                  and delivery_status = 'pending'
                """;
        int updated = jdbcTemplate.update(sql, sessionId);
        if (updated == 0) {
            log.debug("[outbox] Dispatch for session {} already claimed", sessionId);
        }
        return updated == 1;
    }

    @Override
    public Optional<DeliveryStatus> findDeliveryStatus(long sessionId) {
        final String sql = "select delivery_status from dispatch_records where session_id = ?";
        List<String> rows = jdbcTemplate.queryForList(sql, String.class, sessionId);
        return rows.stream().findFirst().map(DeliveryStatus::fromWire);
    }

    @Override
    public void markDelivered(long sessionId, Instant deliveredAt) {
        final String sql = """
                update dispatch_records
                set delivery_status = 'delivered',
                    delivered_at = ?,
                    last_error = null
                where session_id = ?
                """;
        jdbcTemplate.update(sql, Timestamp.from(deliveredAt), sessionId);
    }

    @Override
    public void markFailed(long sessionId, String lastError) {
        final String sql = """
                update dispatch_records
                set delivery_status = 'failed',
                    last_error = ?
                where session_id = ?
                """;
        jdbcTemplate.update(sql, truncate(lastError), sessionId);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
