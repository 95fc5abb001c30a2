package com.example.careplan.household.controller;

import com.example.careplan.household.dto.HouseholdRequest;
import com.example.careplan.household.model.HouseholdTotal;
import com.example.careplan.household.service.HouseholdAggregator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/1.0.0/household")
@RequiredArgsConstructor
public class HouseholdController {

    private final HouseholdAggregator aggregator;

    @PostMapping("/total")
    public Mono<HouseholdTotal> total(@Valid @RequestBody HouseholdRequest request) {
        return Mono.fromSupplier(() -> aggregator.aggregate(request.primary(), request.partner(), request.settings()));
    }
}
