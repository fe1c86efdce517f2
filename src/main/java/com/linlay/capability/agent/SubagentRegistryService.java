package com.linlay.capability.agent;

import com.linlay.capability.catalog.CatalogException;
import com.linlay.capability.catalog.DiscoveryResult;
import com.linlay.capability.catalog.ResourceInfo;
import com.linlay.capability.catalog.ResourceRegistry;
import com.linlay.capability.catalog.SearchRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class SubagentRegistryService implements SubagentManager {

    private static final Logger log = LoggerFactory.getLogger(SubagentRegistryService.class);

    private final ResourceRegistry<Subagent> registry;

    @Autowired
    public SubagentRegistryService(SubagentCatalogProperties properties) {
        this(properties.searchRoots());
        if (properties.isDiscoverOnStartup()) {
            DiscoveryResult result = discoverAgents();
            log.info("Loaded {} agents from {}", result.totalCount(), result.rootsSearched());
        }
    }

    public SubagentRegistryService(List<SearchRoot> roots) {
        this.registry = new ResourceRegistry<>(new SubagentKind(), roots);
    }

    @Override
    public DiscoveryResult discoverAgents() {
        return registry.discover();
    }

    @Override
    public Subagent loadAgentMetadata(String agentName) {
        return registry.loadFull(agentName);
    }

    @Override
    public void registerAgent(Subagent agent) {
        registry.register(agent);
    }

    @Override
    public void unregisterAgent(String agentName) {
        registry.unregister(agentName);
    }

    @Override
    public ResourceInfo getAgentByName(String agentName) {
        return registry.getByName(agentName);
    }

    @Override
    public List<ResourceInfo> listRegisteredAgents() {
        return registry.listActive();
    }

    @Override
    public List<ResourceInfo> listAgents() {
        return registry.listAll();
    }

    @Override
    public Map<String, CatalogException> validateAgents() {
        return registry.validateAll();
    }
}
