package com.linlay.capability.catalog;

/**
 * Binds the generic catalog engine to one resource type.
 */
public interface ResourceKind<R extends CapabilityResource> {

    /**
     * Noun used in log lines and error messages.
     */
    String name();

    /**
     * File expected inside every resource directory, e.g. {@code SKILL.md}.
     */
    String definitionFileName();

    /**
     * Builds a metadata-only resource from decoded frontmatter. The body is left empty.
     */
    R decode(FrontmatterFields fields);
}
