package com.example.careplan;

import com.example.careplan.careplan.model.CarePlan;
import com.example.careplan.cost.dto.CostPlanRequest;
import com.example.careplan.cost.model.CostScenario;
import com.example.careplan.gate.model.Tier;
import com.example.careplan.household.model.HomeTenure;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static com.example.careplan.util.AnswersTestBuilder.aSevereWanderingProfile;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class CarePlanApplicationTests {

    @Autowired
    private WebTestClient client;

    @Test
    void contextLoads() {
        client.get().uri("/actuator/health")
                .exchange()
                .expectStatus().isOk();
    }

    @Test
    void carePlanFeedsCostPlan() {
        Map<String, Object> body = Map.of(
                "personId", "person-it-1",
                "answers", aSevereWanderingProfile().build().asMap());

        CarePlan carePlan = client.post().uri("/api/1.0.0/care-plans")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().exists("X-Correlation-Id")
                .expectBody(CarePlan.class)
                .returnResult()
                .getResponseBody();

        assertThat(carePlan).isNotNull();
        assertThat(carePlan.finalTier()).isEqualTo(Tier.MEMORY_CARE);
        assertThat(carePlan.allowedTiers().contains(Tier.MEMORY_CARE)).isTrue();

        CostPlanRequest costRequest = new CostPlanRequest(
                carePlan, new CostScenario.Facility(null, false, null), "94110", null, HomeTenure.OWNER);

        client.post().uri("/api/1.0.0/cost-plans")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(costRequest)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.carePlanId").isEqualTo(carePlan.carePlanId())
                .jsonPath("$.careSetting").isEqualTo("memory_care")
                .jsonPath("$.regional.precision").isEqualTo("zip")
                .jsonPath("$.homeCarryApplied").isEqualTo(false);
    }
}
