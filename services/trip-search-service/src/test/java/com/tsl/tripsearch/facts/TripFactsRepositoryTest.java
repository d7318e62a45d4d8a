package com.tsl.tripsearch.facts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class TripFactsRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Test
    void upsertStartsAtVersionOneAndBumpsOnConflict() {
        TripFactsRepository repository = new TripFactsRepository(jdbcTemplate, new ObjectMapper());
        TripFacts facts = new TripFacts(7, 2, 3, 1600.49, 150L, 2, List.of("Sara Jones"), List.of("sara@example.com"),
            "sara@example.com", "Sara Jones");

        repository.upsert(1L, facts, Instant.parse("2025-03-05T12:00:00Z"));

        ArgumentCaptor<String> sqlCaptor = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).update(sqlCaptor.capture(), any(Object[].class));
        assertThat(sqlCaptor.getValue())
            .contains("VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 1, ?)")
            .contains("version=version + 1")
            .contains("last_computed=VALUES(last_computed)");
    }

    @Test
    void staleTripsIncludeMissingAndOutdatedFacts() {
        TripFactsRepository repository = new TripFactsRepository(jdbcTemplate, new ObjectMapper());

        repository.findStaleTripIds(20);

        ArgumentCaptor<String> sqlCaptor = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).queryForList(sqlCaptor.capture(), eq(Long.class), eq(20));
        assertThat(sqlCaptor.getValue())
            .contains("LEFT JOIN trip_facts f")
            .contains("f.trip_id IS NULL OR f.last_computed < t.updated_at")
            .contains("ORDER BY t.updated_at ASC, t.trip_id ASC");
    }

    @Test
    void findReturnsEmptyWhenNoRow() {
        TripFactsRepository repository = new TripFactsRepository(jdbcTemplate, new ObjectMapper());

        assertThat(repository.find(1L)).isEmpty();
    }
}
