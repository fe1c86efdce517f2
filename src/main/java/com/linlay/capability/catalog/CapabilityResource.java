package com.linlay.capability.catalog;

import java.util.List;
import java.util.Map;

/**
 * A directory-backed (or programmatically registered) skill or subagent.
 * <p>
 * {@link #getName()} is fixed at construction. The body starts empty after a metadata-only
 * discovery and is filled in place by the lazy loader, so every holder of this instance
 * observes the loaded body; it is never cleared once set. Activation state is kept by the
 * registry, not here.
 */
public abstract class CapabilityResource {

    private final String name;
    private final String description;
    private final List<String> allowedTools;

    private volatile SourceType sourceType = SourceType.PROGRAMMATIC;
    private volatile String directoryPath = "";
    private volatile String absolutePath = "";
    private volatile String rawFrontmatter;
    private volatile String body;

    protected CapabilityResource(
            String name,
            String description,
            List<String> allowedTools,
            String rawFrontmatter,
            String body
    ) {
        this.name = name == null ? "" : name;
        this.description = description == null ? "" : description;
        this.allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        this.rawFrontmatter = rawFrontmatter == null ? "" : rawFrontmatter;
        this.body = body == null ? "" : body;
    }

    /**
     * Short noun used in messages, e.g. {@code skill}.
     */
    public abstract String kind();

    /**
     * Kind-specific optional fields in declaration order; values may be null.
     */
    public abstract Map<String, Object> attributes();

    protected void validateAttributes() {
    }

    public final void validate() {
        ResourceNames.validate(name);
        if (description.isBlank()) {
            throw new InvalidResourceException(kind() + " description cannot be empty: " + name);
        }
        validateAttributes();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getAllowedTools() {
        return allowedTools;
    }

    public SourceType getSourceType() {
        return sourceType;
    }

    public String getDirectoryPath() {
        return directoryPath;
    }

    public String getAbsolutePath() {
        return absolutePath;
    }

    public String getRawFrontmatter() {
        return rawFrontmatter;
    }

    public String getBody() {
        return body;
    }

    public boolean isBodyLoaded() {
        return !body.isEmpty();
    }

    void locate(SourceType sourceType, String directoryPath, String absolutePath) {
        this.sourceType = sourceType;
        this.directoryPath = directoryPath;
        this.absolutePath = absolutePath;
    }

    void fillBody(String rawFrontmatter, String body) {
        this.rawFrontmatter = rawFrontmatter;
        if (body != null && !body.isEmpty()) {
            this.body = body;
        }
    }

    ResourceInfo snapshot(boolean active) {
        return new ResourceInfo(
                name,
                description,
                allowedTools,
                sourceType,
                directoryPath,
                active,
                isBodyLoaded(),
                attributes()
        );
    }

    @Override
    public String toString() {
        return kind() + "[" + name + ", " + sourceType.value() + "]";
    }
}
