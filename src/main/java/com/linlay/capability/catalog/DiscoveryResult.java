package com.linlay.capability.catalog;

import java.util.List;

public record DiscoveryResult(
        List<ResourceInfo> resources,
        List<String> rootsSearched,
        int totalCount,
        int activeCount
) {
    public DiscoveryResult {
        resources = resources == null ? List.of() : List.copyOf(resources);
        rootsSearched = rootsSearched == null ? List.of() : List.copyOf(rootsSearched);
    }
}
