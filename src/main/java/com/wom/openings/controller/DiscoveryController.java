package com.wom.openings.controller;

import com.wom.openings.dto.DiscoveryRequest;
import com.wom.openings.dto.DiscoveryResponse;
import com.wom.openings.model.QueryContext;
import com.wom.openings.service.DiscoveryOrchestrator;
import com.wom.openings.service.QueryContextFactory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.*;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.*;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/openings")
@RequiredArgsConstructor
public class DiscoveryController {

    private final QueryContextFactory contextFactory;
    private final DiscoveryOrchestrator orchestrator;

    @Operation(summary = "Discover new openings", description = "Queries OpenStreetMap and, when enabled, Google Places and the trade register, then returns one de-duplicated list.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Discovery finished, possibly with per-source warnings"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "502", description = "OpenStreetMap unreachable on every mirror")
    })
    @PostMapping("/discover")
    public ResponseEntity<DiscoveryResponse> discover(@Valid @RequestBody DiscoveryRequest req) {
        QueryContext ctx = contextFactory.create(req);
        return ResponseEntity.ok(DiscoveryResponse.from(orchestrator.discover(ctx)));
    }
}
