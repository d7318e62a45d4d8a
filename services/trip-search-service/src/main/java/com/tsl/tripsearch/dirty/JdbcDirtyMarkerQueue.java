package com.tsl.tripsearch.dirty;

import com.tsl.tripsearch.common.JdbcUtils;
import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcDirtyMarkerQueue implements DirtyMarkerQueue {
    private final JdbcTemplate jdbcTemplate;

    public JdbcDirtyMarkerQueue(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean enqueue(long tripId, DirtyReason reason, Instant createdAt) {
        int inserted = jdbcTemplate.update(
            "INSERT IGNORE INTO trip_dirty_queue (trip_id, reason, created_at) VALUES (?, ?, ?)",
            tripId,
            reason.code(),
            JdbcUtils.toTimestamp(createdAt)
        );
        return inserted > 0;
    }

    @Override
    public List<Long> pendingTripIds(int limit) {
        return jdbcTemplate.queryForList(
            "SELECT trip_id FROM trip_dirty_queue GROUP BY trip_id ORDER BY MIN(id) ASC LIMIT ?",
            Long.class,
            limit
        );
    }

    @Override
    public List<DirtyMarker> pendingMarkers(long tripId) {
        return jdbcTemplate.query(
            "SELECT id, trip_id, reason, created_at FROM trip_dirty_queue WHERE trip_id = ? ORDER BY id ASC",
            (rs, rowNum) -> new DirtyMarker(
                rs.getLong("id"),
                rs.getLong("trip_id"),
                rs.getString("reason"),
                JdbcUtils.asInstant(rs.getTimestamp("created_at"))
            ),
            tripId
        );
    }

    @Override
    public long latestMarkerId(long tripId) {
        Long value = jdbcTemplate.queryForObject(
            "SELECT MAX(id) FROM trip_dirty_queue WHERE trip_id = ?",
            Long.class,
            tripId
        );
        return value == null ? 0L : value;
    }

    @Override
    public int acknowledge(long tripId, long upToMarkerId) {
        if (upToMarkerId <= 0) {
            return 0;
        }
        return jdbcTemplate.update(
            "DELETE FROM trip_dirty_queue WHERE trip_id = ? AND id <= ?",
            tripId,
            upToMarkerId
        );
    }
}
