package com.linlay.capability.agent;

import com.linlay.capability.catalog.CatalogException;
import com.linlay.capability.catalog.DiscoveryResult;
import com.linlay.capability.catalog.ResourceInfo;

import java.util.List;
import java.util.Map;

public interface SubagentManager {

    DiscoveryResult discoverAgents();

    Subagent loadAgentMetadata(String agentName);

    /**
     * Adds an in-memory agent. Fails when the agent is invalid or its name is already registered.
     */
    void registerAgent(Subagent agent);

    void unregisterAgent(String agentName);

    ResourceInfo getAgentByName(String agentName);

    List<ResourceInfo> listRegisteredAgents();

    List<ResourceInfo> listAgents();

    Map<String, CatalogException> validateAgents();
}
