package com.tsl.tripsearch.semantic;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsl.tripsearch.common.JsonUtils;
import com.tsl.tripsearch.query.predicate.Predicates;
import com.tsl.tripsearch.query.predicate.SearchPredicate;
import com.tsl.tripsearch.query.predicate.SqlFragment;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class SemanticComponentRepository {
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public SemanticComponentRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Swaps the trip's components for the given set in one transaction.
     */
    @Transactional
    public void replace(long tripId, List<SemanticComponent> components) {
        jdbcTemplate.update("DELETE FROM trip_components WHERE trip_id = ?", tripId);
        if (components.isEmpty()) {
            return;
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO trip_components (trip_id, component_type, component_value, search_weight, synonyms, source) "
                + "VALUES (?, ?, ?, ?, ?, ?)",
            components,
            components.size(),
            (ps, component) -> {
                ps.setLong(1, tripId);
                ps.setString(2, component.type().code());
                ps.setString(3, component.value());
                ps.setDouble(4, component.weight());
                ps.setString(5, component.synonyms().isEmpty() ? null : JsonUtils.toJson(objectMapper, component.synonyms()));
                ps.setString(6, component.source());
            }
        );
    }

    public int deleteByTrip(long tripId) {
        return jdbcTemplate.update("DELETE FROM trip_components WHERE trip_id = ?", tripId);
    }

    public List<SemanticComponent> findByTrip(long tripId) {
        return jdbcTemplate.query(
            "SELECT trip_id, component_type, component_value, search_weight, synonyms, source "
                + "FROM trip_components WHERE trip_id = ? ORDER BY component_id ASC",
            (rs, rowNum) -> mapComponent(rs),
            tripId
        );
    }

    /**
     * Picks the {@code tripLimit} trips whose matching components carry the most weight, then loads those
     * components. The limit applies to trips, never to component rows.
     */
    public List<ComponentHit> findMatching(SearchPredicate predicate, int tripLimit) {
        List<Long> tripIds = findCandidateTripIds(predicate, tripLimit);
        if (tripIds.isEmpty()) {
            return List.of();
        }
        SqlFragment where = Predicates.allOf(List.of(predicate, Predicates.in("tc.trip_id", tripIds))).render();
        return jdbcTemplate.query(
            "SELECT tc.trip_id, tc.component_type, tc.component_value, tc.search_weight, tc.synonyms, tc.source, "
                + "t.trip_name, t.trip_slug "
                + "FROM trip_components tc JOIN trips t ON t.trip_id = tc.trip_id "
                + "WHERE " + where.sql() + " ORDER BY tc.trip_id ASC, tc.component_id ASC",
            (rs, rowNum) -> new ComponentHit(rs.getString("trip_name"), rs.getString("trip_slug"), mapComponent(rs)),
            where.params().toArray()
        );
    }

    List<Long> findCandidateTripIds(SearchPredicate predicate, int tripLimit) {
        SqlFragment where = predicate.render();
        List<Object> args = new ArrayList<>(where.params());
        args.add(tripLimit);
        return jdbcTemplate.queryForList(
            "SELECT tc.trip_id FROM trip_components tc "
                + "WHERE " + where.sql() + " GROUP BY tc.trip_id "
                + "ORDER BY SUM(tc.search_weight) DESC, COUNT(*) DESC, tc.trip_id ASC LIMIT ?",
            Long.class,
            args.toArray()
        );
    }

    private SemanticComponent mapComponent(ResultSet rs) throws SQLException {
        return new SemanticComponent(
            rs.getLong("trip_id"),
            ComponentType.fromCode(rs.getString("component_type")),
            rs.getString("component_value"),
            rs.getDouble("search_weight"),
            JsonUtils.readStringList(objectMapper, rs.getString("synonyms")),
            rs.getString("source")
        );
    }

    public record ComponentHit(String tripName, String tripSlug, SemanticComponent component) {
    }
}
