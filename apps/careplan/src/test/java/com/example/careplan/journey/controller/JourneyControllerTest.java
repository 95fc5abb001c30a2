package com.example.careplan.journey.controller;

import com.example.careplan.journey.service.ProductUnlockService;
import com.example.careplan.journey.service.RequirementParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static com.example.careplan.util.CarePlanTestProperties.journey;

@DisplayName("JourneyController")
class JourneyControllerTest {

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        ProductUnlockService service = new ProductUnlockService(journey(), new RequirementParser());
        client = WebTestClient.bindToController(new JourneyController(service)).build();
    }

    @Test
    @DisplayName("should split products into unlocked and locked")
    void shouldListUnlockedAndLocked() {
        client.post().uri("/api/1.0.0/journey/unlocked")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"progress": {"gcp": 1.0}, "flags": ["high_risk"]}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.unlocked[0]").isEqualTo("gcp")
                .jsonPath("$.unlocked[1]").isEqualTo("cost_planner")
                .jsonPath("$.unlocked[2]").isEqualTo("safety_checklist")
                .jsonPath("$.locked[0]").isEqualTo("household_planner");
    }
}
