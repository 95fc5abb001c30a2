package com.example.careplan.regional.controller;

import com.example.careplan.regional.model.RegionalMultiplier;
import com.example.careplan.regional.service.RegionalMultiplierResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/1.0.0/regions")
@RequiredArgsConstructor
public class RegionController {

    private final RegionalMultiplierResolver resolver;

    @GetMapping("/multiplier")
    public Mono<RegionalMultiplier> multiplier(
            @RequestParam(required = false) String zip,
            @RequestParam(required = false) String state) {
        return Mono.fromSupplier(() -> resolver.resolve(zip, state));
    }

    @GetMapping("/states")
    public Mono<Map<String, String>> states() {
        return Mono.fromSupplier(resolver::listStates);
    }
}
