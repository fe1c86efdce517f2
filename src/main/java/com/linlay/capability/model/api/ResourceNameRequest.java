package com.linlay.capability.model.api;

import jakarta.validation.constraints.NotBlank;

public record ResourceNameRequest(
        @NotBlank String name
) {
}
