package com.linlay.capability.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ResourceInfo(
        String name,
        String description,
        List<String> allowedTools,
        SourceType sourceType,
        String directoryPath,
        boolean active,
        boolean bodyLoaded,
        Map<String, Object> attributes
) {
    public ResourceInfo {
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        directoryPath = directoryPath == null ? "" : directoryPath;
        // attribute values may be null (unset optional fields), so Map.copyOf is not an option
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
