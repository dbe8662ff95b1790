package com.finops.costengine.contract;

import com.finops.costengine.config.TestAerospikeConfig;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test over the generated OpenAPI document, so endpoint paths and report schemas
 * do not drift unnoticed.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        Map<String, Object> paths = apiDocs().read("$.paths");

        assertThat(paths).containsKey("/api/v1/anomalies/{tenantId}/train");
        assertThat(paths).containsKey("/api/v1/anomalies/{tenantId}/detect");
        assertThat(paths).containsKey("/api/v1/models/{tenantId}");
        assertThat(paths).containsKey("/api/v1/right-sizing/recommendations");
        assertThat(paths).containsKey("/api/v1/right-sizing/catalog");
    }

    @Test
    void openApiSpec_reportSchemas_haveRequiredFields() {
        DocumentContext json = apiDocs();

        Map<String, Object> anomaly = json.read("$.components.schemas.AnomalyRecord.properties");
        assertThat(anomaly).containsKeys("date", "cost", "anomalyScore", "severity", "type",
                "affectedServices", "estimatedImpact");

        Map<String, Object> recommendation = json.read("$.components.schemas.Recommendation.properties");
        assertThat(recommendation).containsKeys("resourceId", "currentType", "recommendedType",
                "currentMonthlyCost", "recommendedMonthlyCost", "monthlySavings", "riskLevel",
                "confidence", "reasoning");
    }

    @Test
    void catalog_loadedFromConfiguration() {
        ResponseEntity<List> response = restTemplate.getForEntity("/api/v1/right-sizing/catalog", List.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).hasSize(20);
    }

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        return JsonPath.parse(response.getBody());
    }
}
