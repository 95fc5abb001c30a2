package com.example.careplan.careplan.controller;

import com.example.careplan.careplan.dto.CarePlanRequest;
import com.example.careplan.careplan.model.CarePlan;
import com.example.careplan.careplan.service.CarePlanService;
import com.example.careplan.intake.model.Answers;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/1.0.0/care-plans")
@RequiredArgsConstructor
public class CarePlanController {

    private final CarePlanService carePlanService;

    @PostMapping
    public Mono<CarePlan> computeCarePlan(@Valid @RequestBody CarePlanRequest request) {
        return carePlanService.computeCarePlan(request.personId(), Answers.of(request.answers()));
    }
}
