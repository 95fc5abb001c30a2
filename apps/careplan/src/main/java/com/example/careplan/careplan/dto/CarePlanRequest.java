package com.example.careplan.careplan.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.Map;

public record CarePlanRequest(
        @NotBlank
        @Pattern(regexp = "^[a-zA-Z0-9_@.-]{1,128}$", message = "personId contains invalid characters")
        String personId,

        @NotNull
        Map<String, Object> answers
) {
}
