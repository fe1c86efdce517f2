package com.linlay.capability.catalog;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scans roots from highest to lowest priority. The first root that yields a name owns it for
 * the whole pass.
 */
public class PriorityResolver<R extends CapabilityResource> {

    private final DirectoryScanner<R> scanner;

    public PriorityResolver(DirectoryScanner<R> scanner) {
        this.scanner = scanner;
    }

    public Resolution<R> resolve(List<SearchRoot> roots, Map<String, R> catalog) {
        Set<String> seenNames = new HashSet<>();
        List<R> resources = new ArrayList<>();
        List<String> rootsSearched = new ArrayList<>();
        for (SearchRoot root : roots) {
            rootsSearched.add(root.path().toString());
            resources.addAll(scanner.scan(root, seenNames, catalog));
        }
        return new Resolution<>(List.copyOf(resources), List.copyOf(rootsSearched));
    }

    public record Resolution<R extends CapabilityResource>(
            List<R> resources,
            List<String> rootsSearched
    ) {
    }
}
