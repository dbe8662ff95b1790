package com.finops.costengine.controller;

import com.finops.costengine.repository.ModelSnapshotRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Tenant anomaly model metadata")
public class ModelController {

    private final ModelSnapshotRepository snapshotRepository;

    public ModelController(ModelSnapshotRepository snapshotRepository) {
        this.snapshotRepository = snapshotRepository;
    }

    @Operation(summary = "Get model metadata",
            description = "Returns the current model version of the tenant with its tree count, training samples and training timestamp.")
    @GetMapping("/{tenantId}")
    public ResponseEntity<Map<String, Object>> getModelMetadata(
            @Parameter(description = "Tenant ID", example = "tenant-acme")
            @PathVariable String tenantId) {
        return snapshotRepository.getModelMetadata(tenantId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
