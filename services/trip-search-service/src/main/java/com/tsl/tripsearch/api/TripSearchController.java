package com.tsl.tripsearch.api;

import com.tsl.tripsearch.api.dto.ErrorResponse;
import com.tsl.tripsearch.api.dto.RefreshSummary;
import com.tsl.tripsearch.api.dto.ReindexSummary;
import com.tsl.tripsearch.api.dto.ToolResponse;
import com.tsl.tripsearch.facts.TripRefreshService;
import com.tsl.tripsearch.search.TripSearchResult;
import com.tsl.tripsearch.search.TripSearchService;
import com.tsl.tripsearch.semantic.SemanticMatch;
import com.tsl.tripsearch.semantic.SemanticSearchService;
import com.tsl.tripsearch.surface.SearchSurfaceService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TripSearchController {
    private static final int DEFAULT_SURFACE_REFRESH_LIMIT = 100;

    private final TripSearchService searchService;
    private final SemanticSearchService semanticSearchService;
    private final SearchSurfaceService surfaceService;
    private final TripRefreshService refreshService;

    public TripSearchController(
        TripSearchService searchService,
        SemanticSearchService semanticSearchService,
        SearchSurfaceService surfaceService,
        TripRefreshService refreshService
    ) {
        this.searchService = searchService;
        this.semanticSearchService = semanticSearchService;
        this.surfaceService = surfaceService;
        this.refreshService = refreshService;
    }

    @GetMapping("/trips/search")
    public ResponseEntity<?> search(
        @RequestParam(value = "q", required = false) String query,
        @RequestParam(value = "limit", required = false) Integer limit,
        @RequestHeader(value = "x-trace-id", required = false) String traceHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestHeader);
        if (isBlank(query)) {
            return ResponseEntity.badRequest().body(new ErrorResponse("bad_request", "q is required", traceId, requestId));
        }
        TripSearchResult result = searchService.search(query, limit);
        return ResponseEntity.ok(new ToolResponse<>(traceId, requestId, result));
    }

    @GetMapping("/trips/semantic-search")
    public ResponseEntity<?> semanticSearch(
        @RequestParam(value = "q", required = false) String query,
        @RequestParam(value = "max_results", required = false) Integer maxResults,
        @RequestHeader(value = "x-trace-id", required = false) String traceHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestHeader);
        if (isBlank(query)) {
            return ResponseEntity.badRequest().body(new ErrorResponse("bad_request", "q is required", traceId, requestId));
        }
        List<SemanticMatch> matches = semanticSearchService.semanticSearch(query, maxResults);
        return ResponseEntity.ok(new ToolResponse<>(traceId, requestId, matches));
    }

    @PostMapping("/trips/{tripId}/components/reindex")
    public ToolResponse<ReindexSummary> reindexComponents(
        @PathVariable("tripId") long tripId,
        @RequestHeader(value = "x-trace-id", required = false) String traceHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestHeader
    ) {
        int count = semanticSearchService.reindexComponents(tripId);
        return new ToolResponse<>(
            RequestIdUtil.resolveOrGenerate(traceHeader),
            RequestIdUtil.resolveOrGenerate(requestHeader),
            new ReindexSummary(tripId, count)
        );
    }

    @PostMapping("/trips/search-surface/refresh")
    public ToolResponse<RefreshSummary> refreshSearchSurface(
        @RequestParam(value = "trip_id", required = false) Long tripId,
        @RequestParam(value = "refresh_all", required = false, defaultValue = "false") boolean refreshAll,
        @RequestParam(value = "limit", required = false) Integer limit,
        @RequestHeader(value = "x-trace-id", required = false) String traceHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestHeader
    ) {
        int bounded = limit == null || limit <= 0 ? DEFAULT_SURFACE_REFRESH_LIMIT : limit;
        RefreshSummary summary;
        if (tripId != null) {
            summary = new RefreshSummary("trip", surfaceService.refreshTrip(tripId).isPresent() ? 1 : 0);
        } else if (refreshAll) {
            summary = new RefreshSummary("all", surfaceService.refreshAll(bounded));
        } else {
            summary = new RefreshSummary("dirty", refreshService.refreshDirty(bounded));
        }
        return new ToolResponse<>(
            RequestIdUtil.resolveOrGenerate(traceHeader),
            RequestIdUtil.resolveOrGenerate(requestHeader),
            summary
        );
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
