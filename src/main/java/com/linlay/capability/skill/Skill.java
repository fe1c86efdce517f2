package com.linlay.capability.skill;

import com.linlay.capability.catalog.CapabilityResource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Skill extends CapabilityResource {

    private final String license;
    private final String compatibility;
    private final Map<String, String> metadata;

    public Skill(
            String name,
            String description,
            List<String> allowedTools,
            String license,
            String compatibility,
            Map<String, String> metadata,
            String rawFrontmatter,
            String body
    ) {
        super(name, description, allowedTools, rawFrontmatter, body);
        this.license = license == null ? "" : license;
        this.compatibility = compatibility == null ? "" : compatibility;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    @Override
    public String kind() {
        return "skill";
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("license", license);
        attributes.put("compatibility", compatibility);
        attributes.put("metadata", metadata);
        return attributes;
    }

    public String getLicense() {
        return license;
    }

    public String getCompatibility() {
        return compatibility;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }
}
