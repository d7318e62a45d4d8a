package com.tsl.tripsearch.facts;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsl.tripsearch.common.JdbcUtils;
import com.tsl.tripsearch.common.JsonUtils;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class TripFactsRepository {
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public TripFactsRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public Optional<FactsRow> find(long tripId) {
        List<FactsRow> rows = jdbcTemplate.query(
            "SELECT trip_id, total_nights, total_hotels, total_activities, total_cost, transit_minutes, "
                + "traveler_count, traveler_names, traveler_emails, primary_client_email, primary_client_name, "
                + "version, last_computed FROM trip_facts WHERE trip_id = ?",
            (rs, rowNum) -> new FactsRow(
                rs.getLong("trip_id"),
                new TripFacts(
                    rs.getInt("total_nights"),
                    rs.getInt("total_hotels"),
                    rs.getInt("total_activities"),
                    JdbcUtils.asDouble(rs.getBigDecimal("total_cost")),
                    rs.getLong("transit_minutes"),
                    rs.getInt("traveler_count"),
                    JsonUtils.readStringList(objectMapper, rs.getString("traveler_names")),
                    JsonUtils.readStringList(objectMapper, rs.getString("traveler_emails")),
                    rs.getString("primary_client_email"),
                    rs.getString("primary_client_name")
                ),
                rs.getLong("version"),
                JdbcUtils.asInstant(rs.getTimestamp("last_computed"))
            ),
            tripId
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Inserts with version 1 or overwrites every aggregate and bumps the version by one.
     */
    public void upsert(long tripId, TripFacts facts, Instant lastComputed) {
        jdbcTemplate.update(
            "INSERT INTO trip_facts (trip_id, total_nights, total_hotels, total_activities, total_cost, "
                + "transit_minutes, traveler_count, traveler_names, traveler_emails, primary_client_email, "
                + "primary_client_name, version, last_computed) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 1, ?) "
                + "ON DUPLICATE KEY UPDATE total_nights=VALUES(total_nights), total_hotels=VALUES(total_hotels), "
                + "total_activities=VALUES(total_activities), total_cost=VALUES(total_cost), "
                + "transit_minutes=VALUES(transit_minutes), traveler_count=VALUES(traveler_count), "
                + "traveler_names=VALUES(traveler_names), traveler_emails=VALUES(traveler_emails), "
                + "primary_client_email=VALUES(primary_client_email), primary_client_name=VALUES(primary_client_name), "
                + "version=version + 1, last_computed=VALUES(last_computed)",
            tripId,
            facts.totalNights(),
            facts.totalHotels(),
            facts.totalActivities(),
            facts.totalCost(),
            facts.transitMinutes(),
            facts.travelerCount(),
            JsonUtils.toJson(objectMapper, facts.travelerNames()),
            JsonUtils.toJson(objectMapper, facts.travelerEmails()),
            facts.primaryClientEmail(),
            facts.primaryClientName(),
            JdbcUtils.toTimestamp(lastComputed)
        );
    }

    public int delete(long tripId) {
        return jdbcTemplate.update("DELETE FROM trip_facts WHERE trip_id = ?", tripId);
    }

    /**
     * Trips without facts or whose facts predate the latest trip update, least recently updated first.
     */
    public List<Long> findStaleTripIds(int limit) {
        return jdbcTemplate.queryForList(
            "SELECT t.trip_id FROM trips t LEFT JOIN trip_facts f ON f.trip_id = t.trip_id "
                + "WHERE f.trip_id IS NULL OR f.last_computed < t.updated_at "
                + "ORDER BY t.updated_at ASC, t.trip_id ASC LIMIT ?",
            Long.class,
            limit
        );
    }
}
