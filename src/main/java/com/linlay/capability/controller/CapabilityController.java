package com.linlay.capability.controller;

import com.linlay.capability.agent.Subagent;
import com.linlay.capability.agent.SubagentManager;
import com.linlay.capability.catalog.CapabilityResource;
import com.linlay.capability.catalog.CatalogException;
import com.linlay.capability.catalog.DiscoveryResult;
import com.linlay.capability.catalog.ResourceInfo;
import com.linlay.capability.model.api.ActivationResponse;
import com.linlay.capability.model.api.ApiResponse;
import com.linlay.capability.model.api.ResourceDetailResponse;
import com.linlay.capability.model.api.ResourceNameRequest;
import com.linlay.capability.skill.Skill;
import com.linlay.capability.skill.SkillManager;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/cap")
public class CapabilityController {

    private static final Logger log = LoggerFactory.getLogger(CapabilityController.class);

    private final SkillManager skillManager;
    private final SubagentManager subagentManager;

    public CapabilityController(SkillManager skillManager, SubagentManager subagentManager) {
        this.skillManager = skillManager;
        this.subagentManager = subagentManager;
    }

    @GetMapping("/skills")
    public ApiResponse<List<ResourceInfo>> skills(@RequestParam(defaultValue = "false") boolean active) {
        return ApiResponse.success(active ? skillManager.getAvailableSkills() : skillManager.listSkills());
    }

    @GetMapping("/skill")
    public ApiResponse<ResourceInfo> skill(@RequestParam String name) {
        return ApiResponse.success(skillManager.getSkillByName(name));
    }

    @GetMapping("/skill/content")
    public ApiResponse<ResourceDetailResponse> skillContent(@RequestParam String name) {
        Skill skill = skillManager.loadSkillMetadata(name);
        return ApiResponse.success(toDetail(skill, skill.getBody()));
    }

    @PostMapping("/skills/refresh")
    public ApiResponse<DiscoveryResult> refreshSkills() {
        DiscoveryResult result = skillManager.discoverSkills();
        log.info("Refreshed skills, total={}, active={}", result.totalCount(), result.activeCount());
        return ApiResponse.success(result);
    }

    @PostMapping("/skills/activate")
    public ApiResponse<ActivationResponse> activateSkill(@Valid @RequestBody ResourceNameRequest request) {
        boolean changed = skillManager.setSkillActive(request.name(), true);
        return ApiResponse.success(new ActivationResponse(request.name(), true, changed));
    }

    @PostMapping("/skills/deactivate")
    public ApiResponse<ActivationResponse> deactivateSkill(@Valid @RequestBody ResourceNameRequest request) {
        boolean changed = skillManager.setSkillActive(request.name(), false);
        return ApiResponse.success(new ActivationResponse(request.name(), false, changed));
    }

    @GetMapping("/skills/validate")
    public ApiResponse<Map<String, String>> validateSkills() {
        return ApiResponse.success(messages(skillManager.validateSkills()));
    }

    @GetMapping("/agents")
    public ApiResponse<List<ResourceInfo>> agents(@RequestParam(defaultValue = "false") boolean registered) {
        return ApiResponse.success(registered ? subagentManager.listRegisteredAgents() : subagentManager.listAgents());
    }

    @GetMapping("/agent")
    public ApiResponse<ResourceInfo> agent(@RequestParam String name) {
        return ApiResponse.success(subagentManager.getAgentByName(name));
    }

    @GetMapping("/agent/content")
    public ApiResponse<ResourceDetailResponse> agentContent(@RequestParam String name) {
        Subagent agent = subagentManager.loadAgentMetadata(name);
        return ApiResponse.success(toDetail(agent, agent.getSystemPrompt()));
    }

    @PostMapping("/agents/refresh")
    public ApiResponse<DiscoveryResult> refreshAgents() {
        DiscoveryResult result = subagentManager.discoverAgents();
        log.info("Refreshed agents, total={}", result.totalCount());
        return ApiResponse.success(result);
    }

    @PostMapping("/agents/unregister")
    public ApiResponse<ActivationResponse> unregisterAgent(@Valid @RequestBody ResourceNameRequest request) {
        subagentManager.unregisterAgent(request.name());
        return ApiResponse.success(new ActivationResponse(request.name(), false, true));
    }

    @GetMapping("/agents/validate")
    public ApiResponse<Map<String, String>> validateAgents() {
        return ApiResponse.success(messages(subagentManager.validateAgents()));
    }

    private ResourceDetailResponse toDetail(CapabilityResource resource, String instructions) {
        return new ResourceDetailResponse(
                resource.getName(),
                resource.getDescription(),
                resource.getSourceType(),
                resource.getDirectoryPath(),
                resource.getAllowedTools(),
                instructions,
                resource.attributes()
        );
    }

    private Map<String, String> messages(Map<String, CatalogException> failures) {
        Map<String, String> messages = new LinkedHashMap<>();
        failures.forEach((name, ex) -> messages.put(name, ex.getMessage()));
        return messages;
    }
}
