package com.tsl.tripsearch.api;

import com.tsl.tripsearch.api.dto.ErrorResponse;
import com.tsl.tripsearch.api.dto.FactsStatus;
import com.tsl.tripsearch.api.dto.RefreshSummary;
import com.tsl.tripsearch.api.dto.ToolResponse;
import com.tsl.tripsearch.facts.TripFactsService;
import com.tsl.tripsearch.facts.TripWithFacts;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TripFactsController {
    private final TripFactsService factsService;

    public TripFactsController(TripFactsService factsService) {
        this.factsService = factsService;
    }

    @PostMapping("/trips/{tripId}/facts/ensure")
    public ToolResponse<FactsStatus> ensureFacts(
        @PathVariable("tripId") long tripId,
        @RequestHeader(value = "x-trace-id", required = false) String traceHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestHeader
    ) {
        boolean exists = factsService.ensureFactsFresh(tripId);
        FactsStatus status = new FactsStatus(tripId, exists, exists ? factsService.findFacts(tripId).orElse(null) : null);
        return new ToolResponse<>(
            RequestIdUtil.resolveOrGenerate(traceHeader),
            RequestIdUtil.resolveOrGenerate(requestHeader),
            status
        );
    }

    @GetMapping("/trips/{tripId}/facts")
    public ResponseEntity<?> tripWithFacts(
        @PathVariable("tripId") long tripId,
        @RequestHeader(value = "x-trace-id", required = false) String traceHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestHeader);
        Optional<TripWithFacts> trip = factsService.getTripWithFacts(tripId);
        if (trip.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("not_found", "Trip " + tripId + " not found", traceId, requestId));
        }
        return ResponseEntity.ok(new ToolResponse<>(traceId, requestId, trip.get()));
    }

    @PostMapping("/trips/facts/refresh")
    public ToolResponse<RefreshSummary> bulkRefresh(
        @RequestParam(value = "limit", required = false) Integer limit,
        @RequestHeader(value = "x-trace-id", required = false) String traceHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestHeader
    ) {
        int refreshed = factsService.bulkRefreshFacts(limit);
        return new ToolResponse<>(
            RequestIdUtil.resolveOrGenerate(traceHeader),
            RequestIdUtil.resolveOrGenerate(requestHeader),
            new RefreshSummary("facts", refreshed)
        );
    }
}
