package com.linlay.capability.agent;

import com.linlay.capability.catalog.CapabilityResource;
import com.linlay.capability.catalog.InvalidResourceException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An agent with its own system prompt (the AGENT.md body) and optional model and thinking
 * settings.
 */
public class Subagent extends CapabilityResource {

    private final String model;
    private final int maxActions;
    private final boolean thinkingEnabled;
    private final long thinkingBudget;

    public Subagent(
            String name,
            String description,
            List<String> allowedTools,
            String model,
            int maxActions,
            boolean thinkingEnabled,
            long thinkingBudget,
            String rawFrontmatter,
            String body
    ) {
        super(name, description, allowedTools, rawFrontmatter, body);
        this.model = model == null ? "" : model;
        this.maxActions = maxActions;
        this.thinkingEnabled = thinkingEnabled;
        this.thinkingBudget = thinkingBudget;
    }

    public static Subagent programmatic(String name, String description, String systemPrompt) {
        return new Subagent(name, description, List.of(), "", 0, false, 0L, "", systemPrompt);
    }

    @Override
    public String kind() {
        return "agent";
    }

    @Override
    protected void validateAttributes() {
        if (!model.isEmpty() && SubagentModel.fromValue(model).isEmpty()) {
            throw new InvalidResourceException(
                    "agent model must be one of: inherit, haiku, sonnet, opus (" + getName() + ")"
            );
        }
        if (maxActions < 0) {
            throw new InvalidResourceException("agent max_actions cannot be negative (" + getName() + ")");
        }
        if (thinkingBudget < 0) {
            throw new InvalidResourceException("agent thinking_budget cannot be negative (" + getName() + ")");
        }
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("model", model);
        attributes.put("maxActions", maxActions);
        attributes.put("thinkingEnabled", thinkingEnabled);
        attributes.put("thinkingBudget", thinkingBudget);
        return attributes;
    }

    public String getModel() {
        return model;
    }

    public int getMaxActions() {
        return maxActions;
    }

    public boolean isThinkingEnabled() {
        return thinkingEnabled;
    }

    /**
     * Thinking token budget, 0 for unlimited.
     */
    public long getThinkingBudget() {
        return thinkingBudget;
    }

    public String getSystemPrompt() {
        return getBody();
    }
}
