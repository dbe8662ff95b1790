package com.finops.costengine.controller;

import com.finops.costengine.model.Degradation;
import com.finops.costengine.model.Recommendation;
import com.finops.costengine.model.RecommendationReport;
import com.finops.costengine.model.RiskLevel;
import com.finops.costengine.service.RightSizingService;
import com.finops.costengine.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RightSizingController.class)
class RightSizingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RightSizingService rightSizingService;

    @Test
    void recommend_success() throws Exception {
        when(rightSizingService.recommend(anyList())).thenReturn(RecommendationReport.builder()
                .recommendations(List.of(Recommendation.builder()
                        .resourceId("i-web-1")
                        .currentType("m5.xlarge")
                        .recommendedType("m5.large")
                        .currentMonthlyCost(138.24)
                        .recommendedMonthlyCost(69.12)
                        .monthlySavings(69.12)
                        .savingsPct(50.0)
                        .requiredVcpu(1.44)
                        .cpuHeadroomPct(28.0)
                        .riskLevel(RiskLevel.MEDIUM)
                        .confidence(85.0)
                        .reasoning("Switching to m5.large saves $69.12/month (50.0%).")
                        .degradations(List.of(Degradation.MISSING_MEMORY_METRICS))
                        .build()))
                .totalPotentialSavings(69.12)
                .analyzedCount(1)
                .skippedCount(0)
                .build());

        mockMvc.perform(post("/api/v1/right-sizing/recommendations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                [{"currentType": "m5.xlarge",
                                  "utilization": {"resourceId": "i-web-1", "avgCpu": 15, "p95Cpu": 25,
                                                  "p99Cpu": 30, "observationCount": 336}}]
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalPotentialSavings").value(69.12))
                .andExpect(jsonPath("$.recommendations[0].recommendedType").value("m5.large"))
                .andExpect(jsonPath("$.recommendations[0].riskLevel").value("MEDIUM"))
                .andExpect(jsonPath("$.recommendations[0].degradations[0]").value("MISSING_MEMORY_METRICS"));
    }

    @Test
    void recommend_missingUtilization_returns400() throws Exception {
        when(rightSizingService.recommend(anyList()))
                .thenThrow(new IllegalArgumentException("Resource on m5.xlarge has no utilization profile"));

        mockMvc.perform(post("/api/v1/right-sizing/recommendations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"currentType\": \"m5.xlarge\"}]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }

    @Test
    void catalog_listsEntries() throws Exception {
        when(rightSizingService.catalog()).thenReturn(TestDataFactory.awsCatalog().entries());

        mockMvc.perform(get("/api/v1/right-sizing/catalog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(12))
                .andExpect(jsonPath("$[0].typeName").value("t3.micro"));
    }
}
