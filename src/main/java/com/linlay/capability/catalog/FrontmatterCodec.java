package com.linlay.capability.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.util.List;

/**
 * Splits a definition document into its {@code ---} delimited YAML block and the free-text body,
 * and decodes the block into a resource through its {@link ResourceKind}.
 */
public class FrontmatterCodec {

    private static final String DELIMITER = "---";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public Frontmatter split(String document) {
        String normalized = document == null ? "" : document.replace("\r\n", "\n");
        List<String> lines = normalized.lines().toList();

        int start = 0;
        while (start < lines.size() && lines.get(start).isBlank()) {
            start++;
        }
        if (start >= lines.size() || !DELIMITER.equals(lines.get(start).trim())) {
            throw new FrontmatterException("invalid YAML frontmatter: missing opening ---");
        }

        int end = -1;
        for (int i = start + 1; i < lines.size(); i++) {
            if (DELIMITER.equals(lines.get(i).trim())) {
                end = i;
                break;
            }
        }
        if (end < 0) {
            throw new FrontmatterException("invalid YAML frontmatter: missing closing ---");
        }

        String yaml = String.join("\n", lines.subList(start + 1, end)).trim();
        return new Frontmatter(yaml, stripBlankLines(lines.subList(end + 1, lines.size())));
    }

    /**
     * Decodes the YAML block only. The returned resource never carries a body.
     */
    public <R extends CapabilityResource> R decodeMetadataOnly(String frontmatter, ResourceKind<R> kind) {
        R resource = kind.decode(readFields(frontmatter, kind));
        requireFields(resource, kind);
        return resource;
    }

    public <R extends CapabilityResource> R decodeFull(String document, ResourceKind<R> kind) {
        Frontmatter parts = split(document);
        R resource = decodeMetadataOnly(parts.yaml(), kind);
        resource.fillBody(parts.yaml(), parts.body());
        return resource;
    }

    private FrontmatterFields readFields(String frontmatter, ResourceKind<?> kind) {
        String yaml = frontmatter == null ? "" : frontmatter;
        if (yaml.isBlank()) {
            return new FrontmatterFields(null, yaml);
        }
        JsonNode root;
        try {
            root = yamlMapper.readTree(yaml);
        } catch (JsonProcessingException ex) {
            throw new FrontmatterException(
                    "failed to parse " + kind.name() + " YAML frontmatter: " + ex.getOriginalMessage(), ex
            );
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new FrontmatterFields(null, yaml);
        }
        if (!root.isObject()) {
            throw new FrontmatterException(kind.name() + " frontmatter must be a YAML mapping");
        }
        return new FrontmatterFields((ObjectNode) root, yaml);
    }

    private void requireFields(CapabilityResource resource, ResourceKind<?> kind) {
        if (resource.getName().isEmpty()) {
            throw new InvalidResourceException(kind.name() + " name is required");
        }
        if (resource.getDescription().isBlank()) {
            throw new InvalidResourceException(kind.name() + " description is required");
        }
    }

    private String stripBlankLines(List<String> lines) {
        int from = 0;
        int to = lines.size();
        while (from < to && lines.get(from).isBlank()) {
            from++;
        }
        while (to > from && lines.get(to - 1).isBlank()) {
            to--;
        }
        return String.join("\n", lines.subList(from, to));
    }

    public record Frontmatter(String yaml, String body) {
    }
}
