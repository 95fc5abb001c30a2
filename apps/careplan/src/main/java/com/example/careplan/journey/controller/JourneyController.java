package com.example.careplan.journey.controller;

import com.example.careplan.journey.dto.UnlockedProductsResponse;
import com.example.careplan.journey.model.JourneySnapshot;
import com.example.careplan.journey.model.Product;
import com.example.careplan.journey.service.ProductUnlockService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/1.0.0/journey")
@RequiredArgsConstructor
public class JourneyController {

    private final ProductUnlockService unlockService;

    @PostMapping("/unlocked")
    public Mono<UnlockedProductsResponse> unlocked(@RequestBody JourneySnapshot snapshot) {
        return Mono.fromSupplier(() -> {
            List<String> unlocked = unlockService.unlocked(snapshot);
            List<String> locked = unlockService.products().stream()
                    .map(Product::id)
                    .filter(id -> !unlocked.contains(id))
                    .toList();
            return new UnlockedProductsResponse(unlocked, locked);
        });
    }
}
