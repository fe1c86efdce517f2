package com.linlay.capability.model.api;

import com.linlay.capability.catalog.SourceType;

import java.util.List;
import java.util.Map;

public record ResourceDetailResponse(
        String name,
        String description,
        SourceType sourceType,
        String directoryPath,
        List<String> allowedTools,
        String instructions,
        Map<String, Object> meta
) {
}
