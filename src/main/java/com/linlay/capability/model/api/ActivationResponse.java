package com.linlay.capability.model.api;

public record ActivationResponse(
        String name,
        boolean active,
        boolean changed
) {
}
