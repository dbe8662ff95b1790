package com.finops.costengine.controller;

import com.finops.costengine.model.AnomalyReport;
import com.finops.costengine.model.CostObservation;
import com.finops.costengine.model.DetectionRequest;
import com.finops.costengine.model.TrainingSummary;
import com.finops.costengine.service.AnomalyDetectionService;
import com.finops.costengine.service.AnomalyTrainingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Per-tenant cost anomaly model training and detection")
public class AnomalyController {

    private final AnomalyTrainingService trainingService;
    private final AnomalyDetectionService detectionService;

    public AnomalyController(AnomalyTrainingService trainingService,
                             AnomalyDetectionService detectionService) {
        this.trainingService = trainingService;
        this.detectionService = detectionService;
    }

    @Operation(summary = "Train the anomaly model for a tenant",
            description = "Fits an isolation forest on at least 90 daily costs and publishes it as the tenant's next " +
                    "model version. Scoring keeps using the previous version until the new one is stored.")
    @PostMapping("/{tenantId}/train")
    public ResponseEntity<TrainingSummary> train(
            @Parameter(description = "Tenant ID", example = "tenant-acme")
            @PathVariable String tenantId,
            @RequestBody List<CostObservation> observations) {
        return ResponseEntity.ok(trainingService.train(tenantId, observations));
    }

    @Operation(summary = "Detect cost anomalies",
            description = "Scores the given days against the tenant's current model. Only outliers are returned, " +
                    "each with severity, type, affected services and estimated impact.")
    @PostMapping("/{tenantId}/detect")
    public ResponseEntity<AnomalyReport> detect(
            @Parameter(description = "Tenant ID", example = "tenant-acme")
            @PathVariable String tenantId,
            @RequestBody DetectionRequest request) {
        return ResponseEntity.ok(detectionService.detect(tenantId, request.getObservations(),
                request.getFrom(), request.getTo()));
    }
}
