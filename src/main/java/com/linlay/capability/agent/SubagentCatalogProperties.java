package com.linlay.capability.agent;

import com.linlay.capability.catalog.ResourceCatalogProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.subagent")
public class SubagentCatalogProperties extends ResourceCatalogProperties {

    public SubagentCatalogProperties() {
        super("agents");
    }
}
