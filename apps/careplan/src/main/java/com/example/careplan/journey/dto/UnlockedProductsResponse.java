package com.example.careplan.journey.dto;

import java.util.List;

public record UnlockedProductsResponse(List<String> unlocked, List<String> locked) {
}
