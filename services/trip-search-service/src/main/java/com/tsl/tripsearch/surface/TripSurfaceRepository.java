package com.tsl.tripsearch.surface;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsl.tripsearch.common.JdbcUtils;
import com.tsl.tripsearch.common.JsonUtils;
import com.tsl.tripsearch.query.SearchTarget;
import com.tsl.tripsearch.query.predicate.SearchPredicate;
import com.tsl.tripsearch.query.predicate.SqlFragment;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class TripSurfaceRepository {
    public static final SearchTarget SURFACE_TARGET = new SearchTarget(
        "trip_search_surface",
        List.of(
            "s.search_tokens",
            "s.normalized_trip_name",
            "s.normalized_destinations",
            "s.normalized_travelers",
            "s.phonetic_tokens",
            "s.traveler_emails"
        ),
        "s.primary_client_email",
        "s.trip_slug",
        "s.trip_id"
    );

    private static final String COLUMNS = "s.trip_id, s.trip_name, s.trip_slug, s.status, s.start_date, s.end_date, "
        + "s.destinations, s.primary_client_name, s.primary_client_email, s.traveler_names, s.traveler_emails, "
        + "s.normalized_trip_name, s.normalized_destinations, s.normalized_travelers, s.normalized_emails, "
        + "s.search_tokens, s.phonetic_tokens, s.traveler_count, s.last_synced";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public TripSurfaceRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public List<SearchSurfaceRow> findCandidates(SearchPredicate predicate, int limit) {
        SqlFragment where = predicate.render();
        List<Object> args = new ArrayList<>(where.params());
        args.add(limit);
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM trip_search_surface s WHERE " + where.sql()
                + " ORDER BY s.last_synced DESC, s.trip_id ASC LIMIT ?",
            new SurfaceRowMapper(),
            args.toArray()
        );
    }

    public void upsert(SearchSurfaceRow row) {
        jdbcTemplate.update(
            "INSERT INTO trip_search_surface (trip_id, trip_name, trip_slug, status, start_date, end_date, "
                + "destinations, primary_client_name, primary_client_email, traveler_names, traveler_emails, "
                + "normalized_trip_name, normalized_destinations, normalized_travelers, normalized_emails, "
                + "search_tokens, phonetic_tokens, traveler_count, last_synced) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
                + "ON DUPLICATE KEY UPDATE trip_name=VALUES(trip_name), trip_slug=VALUES(trip_slug), "
                + "status=VALUES(status), start_date=VALUES(start_date), end_date=VALUES(end_date), "
                + "destinations=VALUES(destinations), primary_client_name=VALUES(primary_client_name), "
                + "primary_client_email=VALUES(primary_client_email), traveler_names=VALUES(traveler_names), "
                + "traveler_emails=VALUES(traveler_emails), normalized_trip_name=VALUES(normalized_trip_name), "
                + "normalized_destinations=VALUES(normalized_destinations), "
                + "normalized_travelers=VALUES(normalized_travelers), normalized_emails=VALUES(normalized_emails), "
                + "search_tokens=VALUES(search_tokens), phonetic_tokens=VALUES(phonetic_tokens), "
                + "traveler_count=VALUES(traveler_count), last_synced=VALUES(last_synced)",
            row.tripId(),
            row.tripName(),
            row.tripSlug(),
            row.status(),
            JdbcUtils.toSqlDate(row.startDate()),
            JdbcUtils.toSqlDate(row.endDate()),
            row.destinations(),
            row.primaryClientName(),
            row.primaryClientEmail(),
            row.travelerNames().isEmpty() ? null : JsonUtils.toJson(objectMapper, row.travelerNames()),
            row.travelerEmails().isEmpty() ? null : JsonUtils.toJson(objectMapper, row.travelerEmails()),
            emptyToNull(row.normalizedTripName()),
            emptyToNull(row.normalizedDestinations()),
            emptyToNull(row.normalizedTravelers()),
            emptyToNull(row.normalizedEmails()),
            String.join(" ", row.searchTokens()),
            row.phoneticTokens().isEmpty() ? null : String.join(" ", row.phoneticTokens()),
            row.travelerCount(),
            JdbcUtils.toTimestamp(row.lastSynced())
        );
    }

    public int delete(long tripId) {
        return jdbcTemplate.update("DELETE FROM trip_search_surface WHERE trip_id = ?", tripId);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static List<String> splitTokens(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.trim().split("\\s+")).toList();
    }

    private class SurfaceRowMapper implements RowMapper<SearchSurfaceRow> {
        @Override
        public SearchSurfaceRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new SearchSurfaceRow(
                rs.getLong("trip_id"),
                rs.getString("trip_name"),
                rs.getString("trip_slug"),
                rs.getString("status"),
                JdbcUtils.asLocalDate(rs.getDate("start_date")),
                JdbcUtils.asLocalDate(rs.getDate("end_date")),
                rs.getString("destinations"),
                rs.getString("primary_client_name"),
                rs.getString("primary_client_email"),
                JsonUtils.readStringList(objectMapper, rs.getString("traveler_names")),
                JsonUtils.readStringList(objectMapper, rs.getString("traveler_emails")),
                rs.getString("normalized_trip_name"),
                rs.getString("normalized_destinations"),
                rs.getString("normalized_travelers"),
                rs.getString("normalized_emails"),
                splitTokens(rs.getString("search_tokens")),
                splitTokens(rs.getString("phonetic_tokens")),
                rs.getInt("traveler_count"),
                JdbcUtils.asInstant(rs.getTimestamp("last_synced"))
            );
        }
    }
}
