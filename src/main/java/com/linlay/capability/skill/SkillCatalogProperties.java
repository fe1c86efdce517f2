package com.linlay.capability.skill;

import com.linlay.capability.catalog.ResourceCatalogProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.skill")
public class SkillCatalogProperties extends ResourceCatalogProperties {

    public SkillCatalogProperties() {
        super("skills");
    }
}
