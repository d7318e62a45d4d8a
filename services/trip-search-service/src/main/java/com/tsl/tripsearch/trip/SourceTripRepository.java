package com.tsl.tripsearch.trip;

import com.tsl.tripsearch.common.JdbcUtils;
import com.tsl.tripsearch.query.SearchTarget;
import com.tsl.tripsearch.query.predicate.SearchPredicate;
import com.tsl.tripsearch.query.predicate.SqlFragment;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Read-only access to the trip tables owned by trip management.
 */
@Repository
public class SourceTripRepository {
    public static final SearchTarget TRIPS_TARGET = new SearchTarget(
        "trips",
        List.of("t.trip_name", "t.destinations", "t.trip_slug"),
        "t.primary_client_email",
        "t.trip_slug",
        "t.trip_id"
    );
    public static final SearchTarget CLIENTS_TARGET = new SearchTarget(
        "clients",
        List.of("c.email", "c.full_name"),
        "c.email",
        null,
        null
    );

    private static final String HEADER_COLUMNS = "t.trip_id, t.trip_name, t.trip_slug, t.status, t.start_date, "
        + "t.end_date, t.destinations, t.primary_client_email, pc.full_name AS primary_client_name, t.updated_at";

    private final JdbcTemplate jdbcTemplate;

    public SourceTripRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<SourceTrip> findById(long tripId) {
        List<SourceTrip> trips = jdbcTemplate.query(
            "SELECT " + HEADER_COLUMNS + ", t.total_cost, t.paid_amount, t.notes "
                + "FROM trips t LEFT JOIN clients pc ON pc.email = t.primary_client_email "
                + "WHERE t.trip_id = ?",
            (rs, rowNum) -> new SourceTrip(
                rs.getLong("trip_id"),
                rs.getString("trip_name"),
                rs.getString("trip_slug"),
                TripStatus.fromCode(rs.getString("status")),
                JdbcUtils.asLocalDate(rs.getDate("start_date")),
                JdbcUtils.asLocalDate(rs.getDate("end_date")),
                rs.getString("destinations"),
                rs.getString("primary_client_email"),
                rs.getString("primary_client_name"),
                List.of(),
                List.of(),
                List.of(),
                JdbcUtils.asDouble(rs.getBigDecimal("total_cost")),
                JdbcUtils.asDouble(rs.getBigDecimal("paid_amount")),
                rs.getString("notes"),
                JdbcUtils.asInstant(rs.getTimestamp("updated_at"))
            ),
            tripId
        );
        if (trips.isEmpty()) {
            return Optional.empty();
        }
        SourceTrip base = trips.get(0);
        return Optional.of(new SourceTrip(
            base.tripId(),
            base.name(),
            base.slug(),
            base.status(),
            base.startDate(),
            base.endDate(),
            base.destinations(),
            base.primaryClientEmail(),
            base.primaryClientName(),
            findTravelers(tripId),
            findActivities(tripId),
            findLegs(tripId),
            base.totalCost(),
            base.paidAmount(),
            base.notes(),
            base.updatedAt()
        ));
    }

    public List<Traveler> findTravelers(long tripId) {
        return jdbcTemplate.query(
            "SELECT tt.client_email, c.full_name, tt.client_role "
                + "FROM trip_travelers tt LEFT JOIN clients c ON c.email = tt.client_email "
                + "WHERE tt.trip_id = ? ORDER BY tt.assignment_id ASC",
            (rs, rowNum) -> new Traveler(rs.getString("client_email"), rs.getString("full_name"), rs.getString("client_role")),
            tripId
        );
    }

    public List<TripActivity> findActivities(long tripId) {
        return jdbcTemplate.query(
            "SELECT day_number, activity_type, title, cost FROM trip_activities "
                + "WHERE trip_id = ? ORDER BY day_number ASC, activity_id ASC",
            (rs, rowNum) -> new TripActivity(
                JdbcUtils.asInt(rs.getObject("day_number")),
                rs.getString("activity_type"),
                rs.getString("title"),
                JdbcUtils.asDouble(rs.getBigDecimal("cost"))
            ),
            tripId
        );
    }

    public List<TransitLeg> findLegs(long tripId) {
        return jdbcTemplate.query(
            "SELECT depart_at, arrive_at FROM trip_legs WHERE trip_id = ? ORDER BY leg_id ASC",
            (rs, rowNum) -> new TransitLeg(
                JdbcUtils.asInstant(rs.getTimestamp("depart_at")),
                JdbcUtils.asInstant(rs.getTimestamp("arrive_at"))
            ),
            tripId
        );
    }

    public List<TripHeader> searchTrips(SearchPredicate predicate, int limit) {
        SqlFragment where = predicate.render();
        return jdbcTemplate.query(
            "SELECT " + HEADER_COLUMNS + " FROM trips t LEFT JOIN clients pc ON pc.email = t.primary_client_email "
                + "WHERE " + where.sql() + " ORDER BY t.updated_at DESC, t.trip_id ASC LIMIT ?",
            new TripHeaderRowMapper(),
            withLimit(where, limit)
        );
    }

    /**
     * Matches client records and returns the trips they are the primary client of.
     */
    public List<TripHeader> searchTripsByClient(SearchPredicate predicate, int limit) {
        SqlFragment where = predicate.render();
        return jdbcTemplate.query(
            "SELECT " + HEADER_COLUMNS + " FROM clients c "
                + "JOIN trips t ON t.primary_client_email = c.email "
                + "LEFT JOIN clients pc ON pc.email = t.primary_client_email "
                + "WHERE " + where.sql() + " ORDER BY t.updated_at DESC, t.trip_id ASC LIMIT ?",
            new TripHeaderRowMapper(),
            withLimit(where, limit)
        );
    }

    public Optional<Instant> findUpdatedAt(long tripId) {
        List<Instant> values = jdbcTemplate.query(
            "SELECT updated_at FROM trips WHERE trip_id = ?",
            (rs, rowNum) -> JdbcUtils.asInstant(rs.getTimestamp("updated_at")),
            tripId
        );
        if (values.isEmpty()) {
            return Optional.empty();
        }
        Instant updatedAt = values.get(0);
        return Optional.of(updatedAt == null ? Instant.EPOCH : updatedAt);
    }

    public List<Long> findTripIds(int limit) {
        return jdbcTemplate.queryForList("SELECT trip_id FROM trips ORDER BY trip_id ASC LIMIT ?", Long.class, limit);
    }

    private static Object[] withLimit(SqlFragment where, int limit) {
        List<Object> args = new ArrayList<>(where.params());
        args.add(limit);
        return args.toArray();
    }

    private static class TripHeaderRowMapper implements RowMapper<TripHeader> {
        @Override
        public TripHeader mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new TripHeader(
                rs.getLong("trip_id"),
                rs.getString("trip_name"),
                rs.getString("trip_slug"),
                TripStatus.fromCode(rs.getString("status")),
                JdbcUtils.asLocalDate(rs.getDate("start_date")),
                JdbcUtils.asLocalDate(rs.getDate("end_date")),
                rs.getString("destinations"),
                rs.getString("primary_client_email"),
                rs.getString("primary_client_name"),
                JdbcUtils.asInstant(rs.getTimestamp("updated_at"))
            );
        }
    }
}
