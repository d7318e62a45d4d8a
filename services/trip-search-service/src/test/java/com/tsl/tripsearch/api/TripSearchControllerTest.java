package com.tsl.tripsearch.api;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tsl.tripsearch.facts.TripRefreshService;
import com.tsl.tripsearch.fallback.FallbackAttempt;
import com.tsl.tripsearch.fallback.FallbackTier;
import com.tsl.tripsearch.query.ClassifiedTerm;
import com.tsl.tripsearch.query.SearchMode;
import com.tsl.tripsearch.query.TermCategory;
import com.tsl.tripsearch.search.TripSearchResult;
import com.tsl.tripsearch.search.TripSearchService;
import com.tsl.tripsearch.semantic.ComponentType;
import com.tsl.tripsearch.semantic.SemanticComponent;
import com.tsl.tripsearch.semantic.SemanticMatch;
import com.tsl.tripsearch.semantic.SemanticSearchService;
import com.tsl.tripsearch.surface.SearchSurfaceService;
import com.tsl.tripsearch.surface.TripSurfaceMatch;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(TripSearchController.class)
class TripSearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TripSearchService searchService;

    @MockBean
    private SemanticSearchService semanticSearchService;

    @MockBean
    private SearchSurfaceService surfaceService;

    @MockBean
    private TripRefreshService refreshService;

    @Test
    void searchRequiresQuery() throws Exception {
        mockMvc.perform(get("/trips/search").param("q", "  "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"))
            .andExpect(jsonPath("$.error.message").value("q is required"))
            .andExpect(jsonPath("$.trace_id").exists())
            .andExpect(jsonPath("$.request_id").exists());

        verifyNoInteractions(searchService);
    }

    @Test
    void searchReturnsRankedMatchesWithTier() throws Exception {
        TripSurfaceMatch match = new TripSurfaceMatch(
            1L, "Hawaii Honeymoon", "hawaii-honeymoon", "confirmed", null, null, "Hawaii",
            "Sara Jones", "sara@example.com", List.of(), List.of(), 0, 25, List.of("hawaii"), List.of("token_match")
        );
        TripSearchResult result = new TripSearchResult(
            "hawaii",
            SearchMode.FUZZY,
            List.of(new ClassifiedTerm("hawaii", 1.5, TermCategory.LOCATION)),
            "hawaii",
            FallbackTier.PRIMARY,
            "comprehensive",
            List.of(match),
            null,
            null,
            List.of(new FallbackAttempt(FallbackTier.PRIMARY, "comprehensive", FallbackAttempt.Outcome.SUCCESS, 4L))
        );
        when(searchService.search(eq("hawaii"), isNull())).thenReturn(result);

        mockMvc.perform(get("/trips/search").param("q", "hawaii").header("x-trace-id", "trace-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.trace_id").value("trace-1"))
            .andExpect(jsonPath("$.result.tier").value("primary"))
            .andExpect(jsonPath("$.result.primary_term").value("hawaii"))
            .andExpect(jsonPath("$.result.matches[0].trip_id").value(1))
            .andExpect(jsonPath("$.result.matches[0].match_reasons[0]").value("token_match"))
            .andExpect(jsonPath("$.result.attempts[0].outcome").value("success"));
    }

    @Test
    void storeFailureIsReportedAsDataError() throws Exception {
        when(searchService.search(eq("rome"), isNull())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        mockMvc.perform(get("/trips/search").param("q", "rome"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error.code").value("data_error"));
    }

    @Test
    void semanticSearchReturnsMatches() throws Exception {
        SemanticMatch match = new SemanticMatch(
            7L,
            "John and Jane Smith Anniversary",
            null,
            1.6,
            List.of(new SemanticComponent(7L, ComponentType.DESTINATION, "hawaii", 1.5, List.of(), "destinations")),
            SemanticMatch.METHOD
        );
        when(semanticSearchService.semanticSearch("hawaii", 3)).thenReturn(List.of(match));

        mockMvc.perform(get("/trips/semantic-search").param("q", "hawaii").param("max_results", "3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result[0].trip_id").value(7))
            .andExpect(jsonPath("$.result[0].search_method").value("semantic_component_matching"))
            .andExpect(jsonPath("$.result[0].matched_components[0].value").value("hawaii"));
    }

    @Test
    void reindexReportsComponentCount() throws Exception {
        when(semanticSearchService.reindexComponents(7L)).thenReturn(13);

        mockMvc.perform(post("/trips/7/components/reindex"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.trip_id").value(7))
            .andExpect(jsonPath("$.result.component_count").value(13));
    }

    @Test
    void surfaceRefreshScopes() throws Exception {
        when(surfaceService.refreshTrip(4L)).thenReturn(Optional.empty());
        when(surfaceService.refreshAll(50)).thenReturn(12);
        when(refreshService.refreshDirty(100)).thenReturn(3);

        mockMvc.perform(post("/trips/search-surface/refresh").param("trip_id", "4"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.scope").value("trip"))
            .andExpect(jsonPath("$.result.refreshed").value(0));

        mockMvc.perform(post("/trips/search-surface/refresh").param("refresh_all", "true").param("limit", "50"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.scope").value("all"))
            .andExpect(jsonPath("$.result.refreshed").value(12));

        mockMvc.perform(post("/trips/search-surface/refresh"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.scope").value("dirty"))
            .andExpect(jsonPath("$.result.refreshed").value(3));
    }
}
