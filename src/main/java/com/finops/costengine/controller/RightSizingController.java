package com.finops.costengine.controller;

import com.finops.costengine.model.CatalogEntry;
import com.finops.costengine.model.RecommendationReport;
import com.finops.costengine.model.ResourceRequest;
import com.finops.costengine.service.RightSizingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/right-sizing")
@Tag(name = "Right-sizing", description = "Downsizing recommendations from utilization summaries")
public class RightSizingController {

    private final RightSizingService rightSizingService;

    public RightSizingController(RightSizingService rightSizingService) {
        this.rightSizingService = rightSizingService;
    }

    @Operation(summary = "Generate right-sizing recommendations",
            description = "Matches each resource to the cheapest smaller catalog type covering its p99 utilization " +
                    "plus headroom. Resources with no cheaper fit are skipped. Results are sorted by monthly savings.")
    @PostMapping("/recommendations")
    public ResponseEntity<RecommendationReport> recommend(@RequestBody List<ResourceRequest> resources) {
        return ResponseEntity.ok(rightSizingService.recommend(resources));
    }

    @Operation(summary = "List the resource catalog", description = "Catalog entries ordered by vCPU, then memory.")
    @GetMapping("/catalog")
    public ResponseEntity<List<CatalogEntry>> catalog() {
        return ResponseEntity.ok(rightSizingService.catalog());
    }
}
