package com.example.careplan.cost.controller;

import com.example.careplan.cost.dto.CostPlanRequest;
import com.example.careplan.cost.model.CostPlan;
import com.example.careplan.cost.service.CostPlanService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/1.0.0/cost-plans")
@RequiredArgsConstructor
public class CostPlanController {

    private final CostPlanService costPlanService;

    @PostMapping
    public Mono<CostPlan> computeCostPlan(@Valid @RequestBody CostPlanRequest request) {
        return costPlanService.computeCostPlan(request.carePlan(), request.toCostRequest());
    }
}
